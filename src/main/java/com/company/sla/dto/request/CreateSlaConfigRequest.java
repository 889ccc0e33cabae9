package com.company.sla.dto.request;

import com.company.sla.domain.enums.SlaMetric;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSlaConfigRequest {
    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name must be at most 255 characters")
    private String name;

    private String projectId;

    @NotNull(message = "Metric is required")
    private SlaMetric metric;

    @NotNull(message = "Target duration is required")
    @Positive(message = "Target duration must be positive")
    private Integer targetDurationMinutes;

    @NotNull(message = "Start condition is required")
    private Map<String, Object> startCondition;

    @NotNull(message = "Stop condition is required")
    private Map<String, Object> stopCondition;

    // Optional fields
    private List<Map<String, Object>> pauseConditions;

    @Valid
    private BusinessCalendarRequest calendar;

    private List<Map<String, Object>> escalationRules;

    private Boolean active;
}
