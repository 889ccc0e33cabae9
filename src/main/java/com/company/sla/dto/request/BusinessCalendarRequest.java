package com.company.sla.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Set;

/**
 * Calendar part of a config request. Omitted fields fall back to the
 * service's default calendar.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessCalendarRequest {
    @Min(value = 0, message = "Working hours start must be between 0 and 23")
    @Max(value = 23, message = "Working hours start must be between 0 and 23")
    private Integer workingHourStart;

    @Min(value = 1, message = "Working hours end must be between 1 and 24")
    @Max(value = 24, message = "Working hours end must be between 1 and 24")
    private Integer workingHourEnd;

    private Set<LocalDate> holidays;

    private String timezone; // e.g. "UTC", "Europe/Berlin"

    @JsonIgnore
    @AssertTrue(message = "Working hours start must be before end")
    public boolean isWorkingHoursOrdered() {
        return workingHourStart == null || workingHourEnd == null || workingHourStart < workingHourEnd;
    }
}
