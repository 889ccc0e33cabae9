package com.company.sla.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Minimal instance info kept next to the deadline sorted set
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaDeadlineEntry {
    private String instanceId;
    private String tenantId;
    private String entityId;
    private String slaConfigId;
    private String metric;
    private long breachTimeMs;
}
