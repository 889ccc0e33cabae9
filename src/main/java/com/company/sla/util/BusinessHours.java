package com.company.sla.util;

import com.company.sla.domain.BusinessCalendar;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Business time arithmetic over a {@link BusinessCalendar}.
 * Only time inside working hours on working days is counted.
 */
public final class BusinessHours {

    private BusinessHours() {
    }

    /**
     * Working-hour time between two instants, excluding weekends and holidays.
     *
     * @param start interval start
     * @param end interval end
     * @param calendar business calendar
     * @return business milliseconds, or 0 when {@code end <= start}
     */
    public static long calculateBusinessMs(Instant start, Instant end, BusinessCalendar calendar) {
        if (start == null || end == null || !end.isAfter(start)) {
            return 0L;
        }

        ZoneId zone = calendar.zone();
        LocalDate day = start.atZone(zone).toLocalDate();
        LocalDate lastDay = end.atZone(zone).toLocalDate();

        long totalMs = 0L;
        while (!day.isAfter(lastDay)) {
            if (isWorkingDay(day, calendar)) {
                Instant dayStart = workingDayStart(day, calendar);
                Instant dayEnd = workingDayEnd(day, calendar);

                Instant effectiveStart = start.isAfter(dayStart) ? start : dayStart;
                Instant effectiveEnd = end.isBefore(dayEnd) ? end : dayEnd;

                if (effectiveStart.isBefore(effectiveEnd)) {
                    totalMs += Duration.between(effectiveStart, effectiveEnd).toMillis();
                }
            }
            day = day.plusDays(1);
        }

        return totalMs;
    }

    /**
     * Instant reached after consuming {@code ms} of business time from {@code start}.
     * A start outside working time is first moved to the next working-hour start.
     *
     * @param start starting instant
     * @param ms business milliseconds to consume
     * @param calendar business calendar
     * @return resulting instant, or {@code start} when {@code ms <= 0}
     */
    public static Instant addBusinessMs(Instant start, long ms, BusinessCalendar calendar) {
        if (ms <= 0) {
            return start;
        }

        ZoneId zone = calendar.zone();
        Instant current = snapToWorkingTime(start, calendar);
        long remaining = ms;

        while (true) {
            LocalDate day = current.atZone(zone).toLocalDate();
            long availableMs = Duration.between(current, workingDayEnd(day, calendar)).toMillis();

            if (remaining <= availableMs) {
                return current.plusMillis(remaining);
            }

            remaining -= availableMs;
            current = workingDayStart(nextWorkingDay(day, calendar), calendar);
        }
    }

    public static boolean isWorkingDay(LocalDate date, BusinessCalendar calendar) {
        DayOfWeek dayOfWeek = date.getDayOfWeek();
        if (dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY) {
            return false;
        }
        return !calendar.isHoliday(date);
    }

    /**
     * Returns the instant itself when it lies inside working time, otherwise the
     * start of the next working window. The working-hour end counts as outside.
     */
    static Instant snapToWorkingTime(Instant instant, BusinessCalendar calendar) {
        LocalDate day = instant.atZone(calendar.zone()).toLocalDate();

        if (isWorkingDay(day, calendar)) {
            Instant dayStart = workingDayStart(day, calendar);
            if (instant.isBefore(dayStart)) {
                return dayStart;
            }
            if (instant.isBefore(workingDayEnd(day, calendar))) {
                return instant;
            }
        }

        return workingDayStart(nextWorkingDay(day, calendar), calendar);
    }

    private static LocalDate nextWorkingDay(LocalDate day, BusinessCalendar calendar) {
        LocalDate next = day.plusDays(1);
        while (!isWorkingDay(next, calendar)) {
            next = next.plusDays(1);
        }
        return next;
    }

    private static Instant workingDayStart(LocalDate day, BusinessCalendar calendar) {
        return atHour(day, calendar.getWorkingHourStart(), calendar.zone());
    }

    private static Instant workingDayEnd(LocalDate day, BusinessCalendar calendar) {
        return atHour(day, calendar.getWorkingHourEnd(), calendar.zone());
    }

    private static Instant atHour(LocalDate day, int hour, ZoneId zone) {
        if (hour == 24) {
            return day.plusDays(1).atStartOfDay(zone).toInstant();
        }
        return ZonedDateTime.of(day, LocalTime.of(hour, 0), zone).toInstant();
    }
}
