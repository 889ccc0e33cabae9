package com.company.sla.dto.response;

import com.company.sla.domain.BusinessCalendar;
import com.company.sla.domain.enums.SlaMetric;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaConfigResponse {
    private String slaConfigId;
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
}
