package com.company.sla.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Working-hour window, holiday set and calendar frame used for business time.
 * Saturdays and Sundays are always non-working days.
 */
@Value
public class BusinessCalendar implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_TIMEZONE = "UTC";

    public static final BusinessCalendar DEFAULT = BusinessCalendar.builder()
            .workingHourStart(9)
            .workingHourEnd(17)
            .build();

    // Half-open [start, end) hour interval
    int workingHourStart;
    int workingHourEnd;

    Set<LocalDate> holidays;

    String timezone;

    @Builder(toBuilder = true)
    @Jacksonized
    public BusinessCalendar(int workingHourStart, int workingHourEnd,
                            Set<LocalDate> holidays, String timezone) {
        if (workingHourStart < 0 || workingHourEnd > 24 || workingHourStart >= workingHourEnd) {
            throw new IllegalArgumentException(String.format(
                    "Invalid working hours [%d, %d): expected 0 <= start < end <= 24",
                    workingHourStart, workingHourEnd));
        }

        String zone = timezone == null || timezone.isBlank() ? DEFAULT_TIMEZONE : timezone;
        try {
            ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown calendar timezone: " + zone, e);
        }

        this.workingHourStart = workingHourStart;
        this.workingHourEnd = workingHourEnd;
        this.holidays = holidays == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(holidays));
        this.timezone = zone;
    }

    public ZoneId zone() {
        return ZoneId.of(timezone);
    }

    public boolean isHoliday(LocalDate date) {
        return holidays.contains(date);
    }

    public long workingMsPerDay() {
        return (workingHourEnd - workingHourStart) * 3_600_000L;
    }
}
