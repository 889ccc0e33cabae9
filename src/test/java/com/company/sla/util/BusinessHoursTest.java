package com.company.sla.util;

import com.company.sla.domain.BusinessCalendar;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class BusinessHoursTest {

    private static final long MS_PER_HOUR = 3_600_000L;
    private static final long MS_PER_WORKING_DAY = 8 * MS_PER_HOUR;

    // 9-17 UTC, Christmas 2026 off
    private static final BusinessCalendar CALENDAR = BusinessCalendar.builder()
            .workingHourStart(9)
            .workingHourEnd(17)
            .holidays(Set.of(LocalDate.parse("2026-12-25")))
            .build();

    private static Instant at(String iso) {
        return Instant.parse(iso);
    }

    @Nested
    @DisplayName("calculateBusinessMs")
    class CalculateBusinessMs {

        @Test
        void fullWorkingDay() {
            // Monday
            assertThat(BusinessHours.calculateBusinessMs(
                    at("2026-02-16T09:00:00Z"), at("2026-02-16T17:00:00Z"), CALENDAR))
                    .isEqualTo(MS_PER_WORKING_DAY);
        }

        @Test
        void partialDay() {
            assertThat(BusinessHours.calculateBusinessMs(
                    at("2026-02-16T10:00:00Z"), at("2026-02-16T14:00:00Z"), CALENDAR))
                    .isEqualTo(4 * MS_PER_HOUR);
        }

        @Test
        void clipsTimeOutsideWorkingHours() {
            assertThat(BusinessHours.calculateBusinessMs(
                    at("2026-02-16T06:00:00Z"), at("2026-02-16T20:00:00Z"), CALENDAR))
                    .isEqualTo(MS_PER_WORKING_DAY);
        }

        @Test
        void skipsWeekends() {
            // Friday 09:00 to Monday 17:00
            assertThat(BusinessHours.calculateBusinessMs(
                    at("2026-02-20T09:00:00Z"), at("2026-02-23T17:00:00Z"), CALENDAR))
                    .isEqualTo(2 * MS_PER_WORKING_DAY);
        }

        @Test
        void skipsHolidays() {
            // Thursday, Christmas Friday, Saturday
            assertThat(BusinessHours.calculateBusinessMs(
                    at("2026-12-24T09:00:00Z"), at("2026-12-26T17:00:00Z"), CALENDAR))
                    .isEqualTo(MS_PER_WORKING_DAY);
        }

        @Test
        void holidayRemovesExactlyThatDay() {
            Instant start = at("2026-02-16T09:00:00Z");
            Instant end = at("2026-02-20T17:00:00Z");
            BusinessCalendar withWednesdayOff = CALENDAR.toBuilder()
                    .holidays(Set.of(LocalDate.parse("2026-02-18")))
                    .build();

            long withoutHoliday = BusinessHours.calculateBusinessMs(start, end, CALENDAR);
            long withHoliday = BusinessHours.calculateBusinessMs(start, end, withWednesdayOff);

            assertThat(withoutHoliday).isEqualTo(5 * MS_PER_WORKING_DAY);
            assertThat(withoutHoliday - withHoliday).isEqualTo(MS_PER_WORKING_DAY);
        }

        @Test
        void zeroForEmptyInterval() {
            Instant t = at("2026-02-16T12:00:00Z");
            assertThat(BusinessHours.calculateBusinessMs(t, t, CALENDAR)).isZero();
        }

        @Test
        void zeroWhenEndBeforeStart() {
            assertThat(BusinessHours.calculateBusinessMs(
                    at("2026-02-16T14:00:00Z"), at("2026-02-16T10:00:00Z"), CALENDAR))
                    .isZero();
        }

        @Test
        void zeroForWeekendOnlyInterval() {
            assertThat(BusinessHours.calculateBusinessMs(
                    at("2026-02-21T08:00:00Z"), at("2026-02-22T20:00:00Z"), CALENDAR))
                    .isZero();
        }

        @Test
        void usesCalendarTimezone() {
            BusinessCalendar berlin = BusinessCalendar.builder()
                    .workingHourStart(9)
                    .workingHourEnd(17)
                    .timezone("Europe/Berlin")
                    .build();

            // 09:00-17:00 CET is 08:00-16:00 UTC in February
            assertThat(BusinessHours.calculateBusinessMs(
                    at("2026-02-16T06:00:00Z"), at("2026-02-16T16:00:00Z"), berlin))
                    .isEqualTo(MS_PER_WORKING_DAY);
            assertThat(BusinessHours.calculateBusinessMs(
                    at("2026-02-16T16:00:00Z"), at("2026-02-16T23:00:00Z"), berlin))
                    .isZero();
        }

        @Test
        void roundTheClockCalendarCountsWholeWeekdays() {
            BusinessCalendar allDay = BusinessCalendar.builder()
                    .workingHourStart(0)
                    .workingHourEnd(24)
                    .build();

            // Friday 00:00 to Monday 00:00
            assertThat(BusinessHours.calculateBusinessMs(
                    at("2026-02-20T00:00:00Z"), at("2026-02-23T00:00:00Z"), allDay))
                    .isEqualTo(24 * MS_PER_HOUR);
        }
    }

    @Nested
    @DisplayName("addBusinessMs")
    class AddBusinessMs {

        @Test
        void addsWithinSameDay() {
            assertThat(BusinessHours.addBusinessMs(at("2026-02-16T09:00:00Z"), 4 * MS_PER_HOUR, CALENDAR))
                    .isEqualTo(at("2026-02-16T13:00:00Z"));
        }

        @Test
        void rollsOverToNextWorkingDay() {
            // 2h left Monday + 2h Tuesday
            assertThat(BusinessHours.addBusinessMs(at("2026-02-16T15:00:00Z"), 4 * MS_PER_HOUR, CALENDAR))
                    .isEqualTo(at("2026-02-17T11:00:00Z"));
        }

        @Test
        void skipsWeekends() {
            // 2h left Friday + 2h Monday
            assertThat(BusinessHours.addBusinessMs(at("2026-02-20T15:00:00Z"), 4 * MS_PER_HOUR, CALENDAR))
                    .isEqualTo(at("2026-02-23T11:00:00Z"));
        }

        @Test
        void skipsHolidays() {
            // Thursday 16:00 + 2h: 1h Thursday, Christmas Friday, weekend, 1h Monday
            assertThat(BusinessHours.addBusinessMs(at("2026-12-24T16:00:00Z"), 2 * MS_PER_HOUR, CALENDAR))
                    .isEqualTo(at("2026-12-28T10:00:00Z"));
        }

        @Test
        void returnsStartForZeroOrNegative() {
            Instant start = at("2026-02-16T10:00:00Z");
            assertThat(BusinessHours.addBusinessMs(start, 0, CALENDAR)).isEqualTo(start);
            assertThat(BusinessHours.addBusinessMs(start, -5_000, CALENDAR)).isEqualTo(start);
        }

        @Test
        void handlesPartialDayStart() {
            // 30 min Monday + 30 min Tuesday
            assertThat(BusinessHours.addBusinessMs(at("2026-02-16T16:30:00Z"), MS_PER_HOUR, CALENDAR))
                    .isEqualTo(at("2026-02-17T09:30:00Z"));
        }

        @Test
        void mayLandExactlyOnWorkingHourEnd() {
            assertThat(BusinessHours.addBusinessMs(at("2026-02-16T16:00:00Z"), MS_PER_HOUR, CALENDAR))
                    .isEqualTo(at("2026-02-16T17:00:00Z"));
        }

        @Test
        void startBeforeWorkingHoursBeginsAtOpening() {
            assertThat(BusinessHours.addBusinessMs(at("2026-02-16T06:00:00Z"), MS_PER_HOUR, CALENDAR))
                    .isEqualTo(at("2026-02-16T10:00:00Z"));
        }

        @Test
        void startOnWeekendBeginsMonday() {
            assertThat(BusinessHours.addBusinessMs(at("2026-02-21T12:00:00Z"), 90 * 60_000L, CALENDAR))
                    .isEqualTo(at("2026-02-23T10:30:00Z"));
        }

        @Test
        void roundTheClockCalendarRollsOverMidnight() {
            BusinessCalendar allDay = BusinessCalendar.builder()
                    .workingHourStart(0)
                    .workingHourEnd(24)
                    .build();

            // Friday 23:00 + 2h: 1h Friday, weekend, 1h Monday
            assertThat(BusinessHours.addBusinessMs(at("2026-02-20T23:00:00Z"), 2 * MS_PER_HOUR, allDay))
                    .isEqualTo(at("2026-02-23T01:00:00Z"));
        }

        @ParameterizedTest
        @ValueSource(longs = {1L, 60_000L, 30 * 60_000L, 8 * MS_PER_HOUR, 8 * MS_PER_HOUR + 1, 27 * MS_PER_HOUR + 123_456L,
                100 * MS_PER_HOUR})
        void inverseOfCalculateBusinessMs(long ms) {
            for (Instant start : new Instant[]{
                    at("2026-02-16T09:00:00Z"),
                    at("2026-02-18T13:17:42Z"),
                    at("2026-02-20T16:59:59Z"),
                    at("2026-12-24T15:00:00Z")}) {

                Instant end = BusinessHours.addBusinessMs(start, ms, CALENDAR);

                assertThat(BusinessHours.calculateBusinessMs(start, end, CALENDAR))
                        .as("round trip from %s", start)
                        .isEqualTo(ms);
            }
        }
    }

    @Nested
    @DisplayName("working days")
    class WorkingDays {

        @Test
        void weekendsAndHolidaysAreNotWorkingDays() {
            assertThat(BusinessHours.isWorkingDay(LocalDate.parse("2026-02-16"), CALENDAR)).isTrue();
            assertThat(BusinessHours.isWorkingDay(LocalDate.parse("2026-02-21"), CALENDAR)).isFalse();
            assertThat(BusinessHours.isWorkingDay(LocalDate.parse("2026-02-22"), CALENDAR)).isFalse();
            assertThat(BusinessHours.isWorkingDay(LocalDate.parse("2026-12-25"), CALENDAR)).isFalse();
        }

        @Test
        void snapMovesWorkingHourEndToNextOpening() {
            assertThat(BusinessHours.snapToWorkingTime(at("2026-02-16T17:00:00Z"), CALENDAR))
                    .isEqualTo(at("2026-02-17T09:00:00Z"));
            assertThat(BusinessHours.snapToWorkingTime(at("2026-02-20T18:00:00Z"), CALENDAR))
                    .isEqualTo(at("2026-02-23T09:00:00Z"));
            assertThat(BusinessHours.snapToWorkingTime(at("2026-02-16T11:00:00Z"), CALENDAR))
                    .isEqualTo(at("2026-02-16T11:00:00Z"));
        }
    }
}
