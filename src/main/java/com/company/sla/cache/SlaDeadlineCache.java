package com.company.sla.cache;

import com.company.sla.domain.SlaInstance;
import com.company.sla.domain.enums.SlaStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Deadline index of running SLA clocks in a Redis sorted set.
 * Only ACTIVE instances are registered: a paused clock cannot breach.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SlaDeadlineCache {

    private final RedisTemplate<String, Object> redisTemplate;
    private final ObjectMapper objectMapper;

    // Sorted set: member = instanceId, score = breach time (epoch millis)
    static final String DEADLINES_ZSET = "sla:deadlines";

    // Hash: instanceId -> SlaDeadlineEntry JSON
    static final String ENTRY_HASH = "sla:deadline_entries";

    public void register(SlaInstance instance) {
        if (instance.getStatus() != SlaStatus.ACTIVE || instance.getBreachTime() == null) {
            log.debug("SLA instance {} is {}, not monitoring", instance.getInstanceId(), instance.getStatus());
            return;
        }

        try {
            long score = instance.getBreachTime().toEpochMilli();

            SlaDeadlineEntry entry = SlaDeadlineEntry.builder()
                    .instanceId(instance.getInstanceId())
                    .tenantId(instance.getTenantId())
                    .entityId(instance.getEntityId())
                    .slaConfigId(instance.getSlaConfigId())
                    .metric(instance.getMetric() != null ? instance.getMetric().name() : null)
                    .breachTimeMs(score)
                    .build();

            redisTemplate.opsForZSet().add(DEADLINES_ZSET, instance.getInstanceId(), score);
            redisTemplate.opsForHash().put(ENTRY_HASH, instance.getInstanceId(),
                    objectMapper.writeValueAsString(entry));

            log.debug("Monitoring SLA instance {} (deadline: {})",
                    instance.getInstanceId(), instance.getBreachTime());

        } catch (Exception e) {
            // The periodic resync re-registers anything missed here
            log.error("Failed to register SLA instance {} for deadline monitoring",
                    instance.getInstanceId(), e);
        }
    }

    public void deregister(String instanceId) {
        try {
            redisTemplate.opsForZSet().remove(DEADLINES_ZSET, instanceId);
            redisTemplate.opsForHash().delete(ENTRY_HASH, instanceId);

            log.debug("Stopped monitoring SLA instance {}", instanceId);

        } catch (Exception e) {
            log.error("Failed to deregister SLA instance {} from deadline monitoring", instanceId, e);
        }
    }

    /**
     * Entries whose deadline is strictly before {@code now}
     */
    public List<SlaDeadlineEntry> getOverdueEntries(Instant now) {
        return entriesInRange(0, now.toEpochMilli() - 1);
    }

    /**
     * Entries whose deadline falls within the next {@code minutesAhead} minutes
     */
    public List<SlaDeadlineEntry> getApproachingEntries(Instant now, int minutesAhead) {
        long from = now.toEpochMilli();
        long to = now.plus(Duration.ofMinutes(minutesAhead)).toEpochMilli();
        return entriesInRange(from, to);
    }

    public long getMonitoredCount() {
        try {
            Long count = redisTemplate.opsForZSet().size(DEADLINES_ZSET);
            return count != null ? count : 0;
        } catch (Exception e) {
            log.error("Failed to get monitored SLA count", e);
            return 0;
        }
    }

    public Optional<Instant> getNextDeadline() {
        try {
            Set<Object> next = redisTemplate.opsForZSet().range(DEADLINES_ZSET, 0, 0);
            if (next == null || next.isEmpty()) {
                return Optional.empty();
            }

            Double score = redisTemplate.opsForZSet().score(DEADLINES_ZSET, next.iterator().next());
            return score != null ? Optional.of(Instant.ofEpochMilli(score.longValue())) : Optional.empty();

        } catch (Exception e) {
            log.error("Failed to get next SLA deadline", e);
            return Optional.empty();
        }
    }

    private List<SlaDeadlineEntry> entriesInRange(long minScore, long maxScore) {
        try {
            Set<Object> instanceIds = redisTemplate.opsForZSet().rangeByScore(DEADLINES_ZSET, minScore, maxScore);

            if (instanceIds == null || instanceIds.isEmpty()) {
                return Collections.emptyList();
            }

            List<SlaDeadlineEntry> entries = new ArrayList<>();
            for (Object idObj : instanceIds) {
                String instanceId = idObj.toString();
                Object json = redisTemplate.opsForHash().get(ENTRY_HASH, instanceId);

                if (json == null) {
                    log.warn("Deadline entry missing for SLA instance {}, dropping it", instanceId);
                    redisTemplate.opsForZSet().remove(DEADLINES_ZSET, instanceId);
                    continue;
                }
                entries.add(objectMapper.readValue(json.toString(), SlaDeadlineEntry.class));
            }
            return entries;

        } catch (Exception e) {
            log.error("Failed to read SLA deadlines in range [{}, {}]", minScore, maxScore, e);
            return Collections.emptyList();
        }
    }
}
