package com.company.sla.service;

import com.company.sla.cache.SlaDeadlineCache;
import com.company.sla.domain.BusinessCalendar;
import com.company.sla.domain.SlaConfig;
import com.company.sla.domain.SlaInstance;
import com.company.sla.domain.enums.SlaStatus;
import com.company.sla.event.SlaBreachedEvent;
import com.company.sla.event.SlaMetEvent;
import com.company.sla.event.SlaPausedEvent;
import com.company.sla.event.SlaResumedEvent;
import com.company.sla.event.SlaStartedEvent;
import com.company.sla.exception.InvalidSlaTransitionException;
import com.company.sla.exception.SlaInstanceNotFoundException;
import com.company.sla.repository.SlaInstanceRepository;
import com.company.sla.util.BusinessHours;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * SLA instance state machine.
 *
 * <pre>
 * (none)  --start-->    ACTIVE
 * ACTIVE  --pause-->    PAUSED
 * PAUSED  --resume-->   ACTIVE
 * ACTIVE|PAUSED --complete--> MET | BREACHED
 * </pre>
 *
 * Elapsed time is business time only. Every transition is written with a
 * status/version guarded update, so a stale read can never be applied twice.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SlaLifecycleService {

    private final SlaConfigService configService;
    private final SlaInstanceRepository instanceRepository;
    private final SlaDeadlineCache deadlineCache;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Transactional
    public SlaInstance startSla(String tenantId, String slaConfigId, String entityId) {
        SlaConfig config = configService.getConfig(tenantId, slaConfigId);

        if (!Boolean.TRUE.equals(config.getActive())) {
            throw new InvalidSlaTransitionException(
                    "SLA config " + slaConfigId + " is inactive",
                    InvalidSlaTransitionException.SLA_CONFIG_INACTIVE, null);
        }

        Instant now = clock.instant();
        long targetMs = config.getTargetDurationMs();
        BusinessCalendar calendar = config.getEffectiveCalendar();

        SlaInstance instance = SlaInstance.builder()
                .instanceId(UUID.randomUUID().toString())
                .tenantId(tenantId)
                .slaConfigId(slaConfigId)
                .entityId(entityId)
                .metric(config.getMetric())
                .status(SlaStatus.ACTIVE)
                .startedAt(now)
                .resumedAt(now)
                .targetDurationMs(targetMs)
                .elapsedMs(0L)
                .remainingMs(targetMs)
                .breachTime(BusinessHours.addBusinessMs(now, targetMs, calendar))
                .calendar(calendar)
                .build();

        instance = instanceRepository.insert(instance);

        deadlineCache.register(instance);
        eventPublisher.publishEvent(new SlaStartedEvent(instance));

        meterRegistry.counter("sla.instances.started",
                "metric", String.valueOf(instance.getMetric())
        ).increment();

        log.info("SLA instance {} started for entity {} (config: {}, deadline: {})",
                instance.getInstanceId(), entityId, slaConfigId, instance.getBreachTime());

        return instance;
    }

    @Transactional
    public SlaInstance pauseSla(String tenantId, String instanceId) {
        SlaInstance instance = loadInstance(tenantId, instanceId);

        if (!instance.getStatus().canPause()) {
            throw new InvalidSlaTransitionException(
                    "SLA instance must be active to pause",
                    InvalidSlaTransitionException.SLA_NOT_ACTIVE, instance.getStatus());
        }

        Instant now = clock.instant();
        long activeIntervalMs = BusinessHours.calculateBusinessMs(
                instance.getResumedAt(), now, instance.getCalendar());

        // remainingMs keeps its value from the last start/resume until the next resume
        SlaInstance paused = instance.toBuilder()
                .status(SlaStatus.PAUSED)
                .pausedAt(now)
                .elapsedMs(instance.getElapsedMs() + activeIntervalMs)
                .build();

        persistTransition(paused, instance);

        deadlineCache.deregister(instanceId);
        eventPublisher.publishEvent(new SlaPausedEvent(paused));

        meterRegistry.counter("sla.instances.paused",
                "metric", String.valueOf(paused.getMetric())
        ).increment();

        log.info("SLA instance {} paused (elapsed: {}ms, +{}ms this interval)",
                instanceId, paused.getElapsedMs(), activeIntervalMs);

        return paused;
    }

    @Transactional
    public SlaInstance resumeSla(String tenantId, String instanceId) {
        SlaInstance instance = loadInstance(tenantId, instanceId);

        if (!instance.getStatus().canResume()) {
            throw new InvalidSlaTransitionException(
                    "SLA instance must be paused to resume",
                    InvalidSlaTransitionException.SLA_NOT_PAUSED, instance.getStatus());
        }

        // Wall-clock time spent paused never counts, whatever the calendar says
        Instant now = clock.instant();
        long remainingMs = Math.max(0L, instance.getTargetDurationMs() - instance.getElapsedMs());

        SlaInstance resumed = instance.toBuilder()
                .status(SlaStatus.ACTIVE)
                .pausedAt(null)
                .resumedAt(now)
                .remainingMs(remainingMs)
                .breachTime(BusinessHours.addBusinessMs(now, remainingMs, instance.getCalendar()))
                .build();

        persistTransition(resumed, instance);

        deadlineCache.register(resumed);
        eventPublisher.publishEvent(new SlaResumedEvent(resumed));

        meterRegistry.counter("sla.instances.resumed",
                "metric", String.valueOf(resumed.getMetric())
        ).increment();

        log.info("SLA instance {} resumed (remaining: {}ms, new deadline: {})",
                instanceId, remainingMs, resumed.getBreachTime());

        return resumed;
    }

    /**
     * Judges the instance against the deadline computed at its last start or
     * resume. Paused instances are not recomputed: their clock is stopped.
     */
    @Transactional
    public SlaInstance completeSla(String tenantId, String instanceId) {
        SlaInstance instance = loadInstance(tenantId, instanceId);

        if (!instance.getStatus().canComplete()) {
            throw new InvalidSlaTransitionException(
                    "SLA instance must be active or paused to complete",
                    InvalidSlaTransitionException.SLA_CANNOT_COMPLETE, instance.getStatus());
        }

        Instant now = clock.instant();
        boolean met = instance.getBreachTime() != null && !now.isAfter(instance.getBreachTime());

        SlaInstance completed = instance.toBuilder()
                .status(met ? SlaStatus.MET : SlaStatus.BREACHED)
                .completedAt(now)
                .build();

        persistTransition(completed, instance);

        deadlineCache.deregister(instanceId);

        if (met) {
            eventPublisher.publishEvent(new SlaMetEvent(completed));
        } else {
            long overdueMs = instance.getBreachTime() != null
                    ? Duration.between(instance.getBreachTime(), now).toMillis()
                    : 0L;
            eventPublisher.publishEvent(new SlaBreachedEvent(completed, overdueMs));
            log.warn("SLA instance {} for entity {} BREACHED ({}ms past deadline {})",
                    instanceId, completed.getEntityId(), overdueMs, instance.getBreachTime());
        }

        meterRegistry.counter("sla.instances.completed",
                "metric", String.valueOf(completed.getMetric()),
                "status", completed.getStatus().name()
        ).increment();

        log.info("SLA instance {} completed as {} (from {})",
                instanceId, completed.getStatus(), instance.getStatus());

        return completed;
    }

    public List<SlaInstance> getSlaInstances(String tenantId, String entityId, SlaStatus status) {
        return instanceRepository.findByEntity(tenantId, entityId, status);
    }

    private SlaInstance loadInstance(String tenantId, String instanceId) {
        return instanceRepository.findById(tenantId, instanceId)
                .orElseThrow(() -> new SlaInstanceNotFoundException(instanceId));
    }

    private void persistTransition(SlaInstance updated, SlaInstance previous) {
        long expectedVersion = previous.getVersion() != null ? previous.getVersion() : 0L;

        if (!instanceRepository.updateTransition(updated, previous.getStatus(), expectedVersion)) {
            meterRegistry.counter("sla.instances.transition.conflicts").increment();
            throw new InvalidSlaTransitionException(
                    "SLA instance " + previous.getInstanceId() + " was modified concurrently",
                    InvalidSlaTransitionException.SLA_CONCURRENT_UPDATE, previous.getStatus());
        }
    }
}
