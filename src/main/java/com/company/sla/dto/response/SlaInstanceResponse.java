package com.company.sla.dto.response;

import com.company.sla.domain.enums.SlaMetric;
import com.company.sla.domain.enums.SlaStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaInstanceResponse {
    private String instanceId;
    private String slaConfigId;
    private String entityId;
    private SlaMetric metric;
    private SlaStatus status;
    private Instant startedAt;
    private Instant pausedAt;
    private Instant completedAt;
    private Instant breachTime;
    private Long elapsedMs;
    private Long remainingMs;

    // Display helpers, e.g. "1h 30m"
    private String elapsedFormatted;
    private String remainingFormatted;
}
