package com.company.sla.scheduled;

import com.company.sla.cache.SlaDeadlineCache;
import com.company.sla.cache.SlaDeadlineEntry;
import com.company.sla.domain.SlaInstance;
import com.company.sla.domain.enums.SlaStatus;
import com.company.sla.exception.InvalidSlaTransitionException;
import com.company.sla.repository.SlaInstanceRepository;
import com.company.sla.service.SlaLifecycleService;
import com.company.sla.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Finds ACTIVE instances whose deadline has passed and completes them, which
 * resolves them as BREACHED. Deadlines come from the Redis sorted set; the
 * database row is re-checked before each completion.
 */
@Component
@Slf4j
@ConditionalOnProperty(
        value = "sla.breach-detection.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class SlaBreachDetectionJob {

    private final SlaDeadlineCache deadlineCache;
    private final SlaInstanceRepository instanceRepository;
    private final SlaLifecycleService lifecycleService;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;
    private final Clock clock;

    private final AtomicInteger approachingCount = new AtomicInteger();

    @Value("${sla.early-warning.minutes-ahead:10}")
    private int earlyWarningMinutes;

    @Value("${sla.breach-detection.resync-batch-size:500}")
    private int resyncBatchSize;

    public SlaBreachDetectionJob(SlaDeadlineCache deadlineCache,
                                 SlaInstanceRepository instanceRepository,
                                 SlaLifecycleService lifecycleService,
                                 MeterRegistry meterRegistry,
                                 Tracer tracer,
                                 Clock clock) {
        this.deadlineCache = deadlineCache;
        this.instanceRepository = instanceRepository;
        this.lifecycleService = lifecycleService;
        this.meterRegistry = meterRegistry;
        this.tracer = tracer;
        this.clock = clock;
        meterRegistry.gauge("sla.approaching.count", approachingCount);
    }

    @Scheduled(
            fixedDelayString = "${sla.breach-detection.interval-ms:15000}",
            initialDelayString = "${sla.breach-detection.initial-delay-ms:10000}"
    )
    public void detectBreaches() {
        Instant startTime = clock.instant();
        Span span = tracer.spanBuilder("sla.breach-detection").startSpan();

        try (Scope ignored = span.makeCurrent()) {
            List<SlaDeadlineEntry> overdue = deadlineCache.getOverdueEntries(startTime);
            span.setAttribute("sla.overdue.count", overdue.size());

            if (overdue.isEmpty()) {
                log.debug("No overdue SLA instances");
                recordMetrics(0, Duration.between(startTime, clock.instant()));
                return;
            }

            log.warn("Found {} SLA instances past their deadline", overdue.size());

            int breachedCount = 0;
            for (SlaDeadlineEntry entry : overdue) {
                if (completeOverdue(entry)) {
                    breachedCount++;
                }
            }

            span.setAttribute("sla.breached.count", breachedCount);

            Duration executionTime = Duration.between(startTime, clock.instant());
            log.info("SLA breach detection completed: {}/{} instances breached in {}ms",
                    breachedCount, overdue.size(), executionTime.toMillis());

            recordMetrics(breachedCount, executionTime);

        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            log.error("SLA breach detection job failed", e);
            meterRegistry.counter("sla.breach_detection.failures").increment();
        } finally {
            span.end();
        }
    }

    /**
     * Early warning for instances close to their deadline
     */
    @Scheduled(
            fixedDelayString = "${sla.early-warning.interval-ms:60000}",
            initialDelayString = "30000"
    )
    public void detectApproachingDeadlines() {
        Instant now = clock.instant();
        List<SlaDeadlineEntry> approaching = deadlineCache.getApproachingEntries(now, earlyWarningMinutes);
        approachingCount.set(approaching.size());

        if (approaching.isEmpty()) {
            return;
        }

        log.info("EARLY WARNING: {} SLA instances due within {} min", approaching.size(), earlyWarningMinutes);

        for (SlaDeadlineEntry entry : approaching) {
            log.warn("SLA instance {} (entity {}, metric {}) due in {}",
                    entry.getInstanceId(),
                    entry.getEntityId(),
                    entry.getMetric(),
                    TimeUtils.formatDuration(entry.getBreachTimeMs() - now.toEpochMilli()));
        }
    }

    /**
     * Re-registers every ACTIVE instance so that deadlines lost from Redis
     * (restart, eviction, failed registration) are monitored again.
     */
    @Scheduled(
            fixedDelayString = "${sla.breach-detection.resync-interval-ms:600000}",
            initialDelayString = "${sla.breach-detection.initial-delay-ms:10000}"
    )
    public void resyncDeadlines() {
        try {
            List<SlaInstance> active = instanceRepository.findByStatus(SlaStatus.ACTIVE, resyncBatchSize);
            active.forEach(deadlineCache::register);

            if (active.size() >= resyncBatchSize) {
                log.warn("Deadline resync hit batch limit of {}; later deadlines wait for the next run",
                        resyncBatchSize);
            }
            log.debug("Resynced {} active SLA deadlines", active.size());

        } catch (Exception e) {
            log.error("Failed to resync SLA deadlines", e);
            meterRegistry.counter("sla.deadline_resync.failures").increment();
        }
    }

    private boolean completeOverdue(SlaDeadlineEntry entry) {
        String instanceId = entry.getInstanceId();

        try {
            Optional<SlaInstance> instanceOpt = instanceRepository.findById(entry.getTenantId(), instanceId);

            if (instanceOpt.isEmpty()) {
                log.warn("SLA instance {} not found in database, deregistering", instanceId);
                deadlineCache.deregister(instanceId);
                return false;
            }

            SlaInstance instance = instanceOpt.get();
            if (instance.getStatus() != SlaStatus.ACTIVE) {
                log.debug("SLA instance {} is {}, deregistering", instanceId, instance.getStatus());
                deadlineCache.deregister(instanceId);
                return false;
            }

            if (!instance.getBreachTime().isBefore(clock.instant())) {
                log.debug("Stale deadline for SLA instance {}, re-registering at {}",
                        instanceId, instance.getBreachTime());
                deadlineCache.register(instance);
                return false;
            }

            SlaInstance completed = lifecycleService.completeSla(entry.getTenantId(), instanceId);

            if (completed.getStatus() == SlaStatus.BREACHED) {
                meterRegistry.counter("sla.breaches.detected",
                        "metric", String.valueOf(completed.getMetric())
                ).increment();
                return true;
            }
            return false;

        } catch (InvalidSlaTransitionException e) {
            // Paused or completed between our read and the write
            log.info("SLA instance {} changed during breach detection: {}", instanceId, e.getMessage());
            return false;
        } catch (Exception e) {
            log.error("Failed to process overdue SLA instance {}", instanceId, e);
            return false;
        }
    }

    private void recordMetrics(int breachedCount, Duration executionTime) {
        meterRegistry.counter("sla.breach_detection.runs").increment();
        meterRegistry.timer("sla.breach_detection.duration").record(executionTime);
        meterRegistry.counter("sla.breach_detection.breached").increment(breachedCount);
    }
}
