package com.company.sla.service;

import com.company.sla.domain.SlaConfig;
import com.company.sla.domain.SlaInstance;
import com.company.sla.event.SlaBreachedEvent;
import com.company.sla.exception.SlaConfigNotFoundException;
import com.company.sla.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Records breaches against the escalation rules of the owning config. Delivery of
 * the escalations themselves happens outside this service.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SlaBreachHandlerService {

    private final SlaConfigService configService;
    private final MeterRegistry meterRegistry;

    @EventListener
    @Async
    public void handleSlaBreachedEvent(SlaBreachedEvent event) {
        SlaInstance instance = event.getInstance();
        int escalationRules = countEscalationRules(instance);

        log.warn("SLA breached: instance={} entity={} metric={} overdue={} escalationRules={}",
                instance.getInstanceId(), instance.getEntityId(), instance.getMetric(),
                TimeUtils.formatDuration(event.getOverdueMs()), escalationRules);

        meterRegistry.counter("sla.breaches.escalated",
                "metric", instance.getMetric().name(),
                "hasRules", String.valueOf(escalationRules > 0)
        ).increment();
    }

    private int countEscalationRules(SlaInstance instance) {
        if (instance.getSlaConfigId() == null) {
            return 0;
        }
        try {
            SlaConfig config = configService.getConfig(instance.getTenantId(), instance.getSlaConfigId());
            return config.getEscalationRules() == null ? 0 : config.getEscalationRules().size();
        } catch (SlaConfigNotFoundException e) {
            log.debug("Config {} of breached instance {} no longer exists",
                    instance.getSlaConfigId(), instance.getInstanceId());
            return 0;
        }
    }
}
