package com.company.sla.domain;

import com.company.sla.domain.enums.SlaMetric;
import com.company.sla.domain.enums.SlaStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * One tracked SLA clock for one entity (e.g. an issue's time-to-first-response).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SlaInstance implements Serializable {
    private static final long serialVersionUID = 1L;

    private String instanceId;
    private String tenantId;

    // Null once the owning config has been deleted
    private String slaConfigId;
    private String entityId;
    private SlaMetric metric;

    private SlaStatus status;

    private Instant startedAt;
    // Start of the current active interval
    private Instant resumedAt;
    private Instant pausedAt;
    private Instant completedAt;

    // Business-time accounting
    private Long targetDurationMs;
    private Long elapsedMs;
    private Long remainingMs;
    private Instant breachTime;

    // Calendar captured when the clock started
    private BusinessCalendar calendar;

    private Long version;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
