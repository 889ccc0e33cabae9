package com.company.sla.domain;

import com.company.sla.domain.enums.SlaMetric;
import com.company.sla.util.TimeUtils;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Tenant-owned SLA definition. Trigger descriptors and escalation rules are
 * opaque JSON payloads evaluated by the rule engine, not by this service.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SlaConfig implements Serializable {
    private static final long serialVersionUID = 1L;

    private String slaConfigId;
    private String tenantId;
    private String projectId;

    private String name;
    private SlaMetric metric;
    private Integer targetDurationMinutes;

    private Map<String, Object> startCondition;
    private Map<String, Object> stopCondition;
    private List<Map<String, Object>> pauseConditions;

    private BusinessCalendar calendar;

    private List<Map<String, Object>> escalationRules;

    private Boolean active;

    private Instant createdAt;
    private Instant updatedAt;

    @JsonIgnore
    public long getTargetDurationMs() {
        return targetDurationMinutes == null ? 0L : TimeUtils.minutesToMs(targetDurationMinutes);
    }

    @JsonIgnore
    public BusinessCalendar getEffectiveCalendar() {
        return calendar != null ? calendar : BusinessCalendar.DEFAULT;
    }
}
