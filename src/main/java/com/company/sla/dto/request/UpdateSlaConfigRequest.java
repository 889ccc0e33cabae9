package com.company.sla.dto.request;

import com.company.sla.domain.enums.SlaMetric;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Partial update: absent fields are left unchanged. {@code projectId} is the one
 * nullable field, so an explicit JSON null clears it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateSlaConfigRequest {
    @Size(min = 1, max = 255, message = "Name must be 1 to 255 characters")
    private String name;

    private String projectId;

    // Set when the JSON body names projectId, even as null
    @JsonIgnore
    private boolean projectIdPresent;

    private SlaMetric metric;

    @Positive(message = "Target duration must be positive")
    private Integer targetDurationMinutes;

    private Map<String, Object> startCondition;
    private Map<String, Object> stopCondition;
    private List<Map<String, Object>> pauseConditions;

    @Valid
    private BusinessCalendarRequest calendar;

    private List<Map<String, Object>> escalationRules;

    private Boolean active;

    public void setProjectId(String projectId) {
        this.projectId = projectId;
        this.projectIdPresent = true;
    }

    public boolean hasProjectId() {
        return projectIdPresent || projectId != null;
    }
}
