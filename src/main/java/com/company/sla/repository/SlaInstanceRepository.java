package com.company.sla.repository;

import com.company.sla.domain.BusinessCalendar;
import com.company.sla.domain.SlaInstance;
import com.company.sla.domain.enums.SlaMetric;
import com.company.sla.domain.enums.SlaStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * SLA instance store. Lifecycle writes go through {@link #updateTransition}, a
 * conditional update keyed on the status and version that were read.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class SlaInstanceRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumnMapper jsonMapper;
    private final Clock clock;

    private static final String SELECT_BASE = """
        SELECT instance_id, tenant_id, sla_config_id, entity_id, metric, status,
               started_at, resumed_at, paused_at, completed_at,
               target_duration_ms, elapsed_ms, remaining_ms, breach_time,
               calendar, version, created_at, updated_at
        FROM sla_instances
        """;

    public SlaInstance insert(SlaInstance instance) {
        Instant now = clock.instant();
        instance.setCreatedAt(now);
        instance.setUpdatedAt(now);
        instance.setVersion(0L);

        jdbcTemplate.update("""
            INSERT INTO sla_instances (
                instance_id, tenant_id, sla_config_id, entity_id, metric, status,
                started_at, resumed_at, paused_at, completed_at,
                target_duration_ms, elapsed_ms, remaining_ms, breach_time,
                calendar, version, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?)
            """,
                instance.getInstanceId(),
                instance.getTenantId(),
                instance.getSlaConfigId(),
                instance.getEntityId(),
                instance.getMetric() != null ? instance.getMetric().name() : null,
                instance.getStatus().name(),
                toTimestamp(instance.getStartedAt()),
                toTimestamp(instance.getResumedAt()),
                toTimestamp(instance.getPausedAt()),
                toTimestamp(instance.getCompletedAt()),
                instance.getTargetDurationMs(),
                instance.getElapsedMs(),
                instance.getRemainingMs(),
                toTimestamp(instance.getBreachTime()),
                jsonMapper.write(instance.getCalendar()),
                instance.getVersion(),
                Timestamp.from(instance.getCreatedAt()),
                Timestamp.from(instance.getUpdatedAt())
        );

        log.debug("Inserted SLA instance {} for entity {}", instance.getInstanceId(), instance.getEntityId());
        return instance;
    }

    public Optional<SlaInstance> findById(String tenantId, String instanceId) {
        String sql = SELECT_BASE + " WHERE instance_id = ? AND tenant_id = ?";
        List<SlaInstance> results = jdbcTemplate.query(sql, new SlaInstanceRowMapper(), instanceId, tenantId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Writes the mutable lifecycle columns only if the row still has the expected
     * status and version. On success the instance carries the new version.
     *
     * @return false when another writer changed the row first
     */
    public boolean updateTransition(SlaInstance instance, SlaStatus expectedStatus, long expectedVersion) {
        Instant now = clock.instant();

        int updated = jdbcTemplate.update("""
            UPDATE sla_instances
            SET status = ?,
                resumed_at = ?,
                paused_at = ?,
                completed_at = ?,
                elapsed_ms = ?,
                remaining_ms = ?,
                breach_time = ?,
                version = version + 1,
                updated_at = ?
            WHERE instance_id = ?
              AND tenant_id = ?
              AND status = ?
              AND version = ?
            """,
                instance.getStatus().name(),
                toTimestamp(instance.getResumedAt()),
                toTimestamp(instance.getPausedAt()),
                toTimestamp(instance.getCompletedAt()),
                instance.getElapsedMs(),
                instance.getRemainingMs(),
                toTimestamp(instance.getBreachTime()),
                Timestamp.from(now),
                instance.getInstanceId(),
                instance.getTenantId(),
                expectedStatus.name(),
                expectedVersion
        );

        if (updated == 0) {
            log.warn("Conditional update of SLA instance {} lost (expected status={}, version={})",
                    instance.getInstanceId(), expectedStatus, expectedVersion);
            return false;
        }

        instance.setVersion(expectedVersion + 1);
        instance.setUpdatedAt(now);
        return true;
    }

    /**
     * Instances for one tracked entity, newest first
     */
    public List<SlaInstance> findByEntity(String tenantId, String entityId, SlaStatus status) {
        if (status == null) {
            return jdbcTemplate.query(
                    SELECT_BASE + " WHERE tenant_id = ? AND entity_id = ? ORDER BY started_at DESC",
                    new SlaInstanceRowMapper(), tenantId, entityId);
        }
        return jdbcTemplate.query(
                SELECT_BASE + " WHERE tenant_id = ? AND entity_id = ? AND status = ? ORDER BY started_at DESC",
                new SlaInstanceRowMapper(), tenantId, entityId, status.name());
    }

    /**
     * Across all tenants, earliest deadline first. Used to rebuild the deadline cache.
     */
    public List<SlaInstance> findByStatus(SlaStatus status, int limit) {
        return jdbcTemplate.query(
                SELECT_BASE + " WHERE status = ? ORDER BY breach_time ASC LIMIT ?",
                new SlaInstanceRowMapper(), status.name(), limit);
    }

    public long countByStatus(SlaStatus status) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM sla_instances WHERE status = ?", Long.class, status.name());
        return count != null ? count : 0L;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class SlaInstanceRowMapper implements RowMapper<SlaInstance> {
        @Override
        public SlaInstance mapRow(ResultSet rs, int rowNum) throws SQLException {
            String metric = rs.getString("metric");
            return SlaInstance.builder()
                    .instanceId(rs.getString("instance_id"))
                    .tenantId(rs.getString("tenant_id"))
                    .slaConfigId(rs.getString("sla_config_id"))
                    .entityId(rs.getString("entity_id"))
                    .metric(metric != null ? SlaMetric.valueOf(metric) : null)
                    .status(SlaStatus.fromString(rs.getString("status")))
                    .startedAt(getInstant(rs, "started_at"))
                    .resumedAt(getInstant(rs, "resumed_at"))
                    .pausedAt(getInstant(rs, "paused_at"))
                    .completedAt(getInstant(rs, "completed_at"))
                    .targetDurationMs(rs.getLong("target_duration_ms"))
                    .elapsedMs(rs.getLong("elapsed_ms"))
                    .remainingMs(rs.getLong("remaining_ms"))
                    .breachTime(getInstant(rs, "breach_time"))
                    .calendar(jsonMapper.read(rs.getString("calendar"), BusinessCalendar.class))
                    .version(rs.getLong("version"))
                    .createdAt(getInstant(rs, "created_at"))
                    .updatedAt(getInstant(rs, "updated_at"))
                    .build();
        }

        private Instant getInstant(ResultSet rs, String columnName) throws SQLException {
            Timestamp timestamp = rs.getTimestamp(columnName);
            return timestamp != null ? timestamp.toInstant() : null;
        }
    }
}
