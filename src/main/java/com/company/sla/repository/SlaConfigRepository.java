package com.company.sla.repository;

import com.company.sla.domain.BusinessCalendar;
import com.company.sla.domain.SlaConfig;
import com.company.sla.domain.enums.SlaMetric;
import com.company.sla.exception.SlaConfigNotFoundException;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
@Slf4j
public class SlaConfigRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumnMapper jsonMapper;
    private final Clock clock;

    private static final String SELECT_BASE = """
        SELECT sla_config_id, tenant_id, project_id, name, metric, target_duration_minutes,
               start_condition, stop_condition, pause_conditions, calendar, escalation_rules,
               active, created_at, updated_at
        FROM sla_configs
        """;

    public Optional<SlaConfig> findById(String tenantId, String slaConfigId) {
        String sql = SELECT_BASE + " WHERE sla_config_id = ? AND tenant_id = ?";

        List<SlaConfig> results = jdbcTemplate.query(sql, new SlaConfigRowMapper(), slaConfigId, tenantId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * One page of the tenant's configs, newest first. {@code active} and
     * {@code projectId} are optional filters. {@code cursorId} is the last config of
     * the previous page; the page starts strictly after it.
     */
    public List<SlaConfig> findPage(String tenantId, Boolean active, String projectId,
                                    int limit, String cursorId) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder(SELECT_BASE);
        appendFilters(sql, params, tenantId, active, projectId);

        if (cursorId != null) {
            sql.append("""
                 AND (created_at, sla_config_id) < (
                     SELECT created_at, sla_config_id FROM sla_configs
                     WHERE sla_config_id = ? AND tenant_id = ?)
                """);
            params.add(cursorId);
            params.add(tenantId);
        }

        sql.append(" ORDER BY created_at DESC, sla_config_id DESC LIMIT ?");
        params.add(limit);

        return jdbcTemplate.query(sql.toString(), new SlaConfigRowMapper(), params.toArray());
    }

    public long count(String tenantId, Boolean active, String projectId) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM sla_configs");
        appendFilters(sql, params, tenantId, active, projectId);

        Long count = jdbcTemplate.queryForObject(sql.toString(), Long.class, params.toArray());
        return count != null ? count : 0L;
    }

    private static void appendFilters(StringBuilder sql, List<Object> params,
                                      String tenantId, Boolean active, String projectId) {
        sql.append(" WHERE tenant_id = ?");
        params.add(tenantId);

        if (active != null) {
            sql.append(" AND active = ?");
            params.add(active);
        }
        if (projectId != null) {
            sql.append(" AND project_id = ?");
            params.add(projectId);
        }
    }

    public SlaConfig insert(SlaConfig config) {
        Instant now = clock.instant();
        config.setCreatedAt(now);
        config.setUpdatedAt(now);

        jdbcTemplate.update("""
            INSERT INTO sla_configs (
                sla_config_id, tenant_id, project_id, name, metric, target_duration_minutes,
                start_condition, stop_condition, pause_conditions, calendar, escalation_rules,
                active, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?::jsonb, ?::jsonb, ?::jsonb, ?, ?, ?)
            """,
                config.getSlaConfigId(),
                config.getTenantId(),
                config.getProjectId(),
                config.getName(),
                config.getMetric().name(),
                config.getTargetDurationMinutes(),
                jsonMapper.write(config.getStartCondition()),
                jsonMapper.write(config.getStopCondition()),
                jsonMapper.write(config.getPauseConditions()),
                jsonMapper.write(config.getCalendar()),
                jsonMapper.write(config.getEscalationRules()),
                config.getActive(),
                Timestamp.from(config.getCreatedAt()),
                Timestamp.from(config.getUpdatedAt())
        );

        log.debug("Inserted SLA config {} for tenant {}", config.getSlaConfigId(), config.getTenantId());
        return config;
    }

    public SlaConfig update(SlaConfig config) {
        config.setUpdatedAt(clock.instant());

        int updated = jdbcTemplate.update("""
            UPDATE sla_configs
            SET project_id = ?,
                name = ?,
                metric = ?,
                target_duration_minutes = ?,
                start_condition = ?::jsonb,
                stop_condition = ?::jsonb,
                pause_conditions = ?::jsonb,
                calendar = ?::jsonb,
                escalation_rules = ?::jsonb,
                active = ?,
                updated_at = ?
            WHERE sla_config_id = ? AND tenant_id = ?
            """,
                config.getProjectId(),
                config.getName(),
                config.getMetric().name(),
                config.getTargetDurationMinutes(),
                jsonMapper.write(config.getStartCondition()),
                jsonMapper.write(config.getStopCondition()),
                jsonMapper.write(config.getPauseConditions()),
                jsonMapper.write(config.getCalendar()),
                jsonMapper.write(config.getEscalationRules()),
                config.getActive(),
                Timestamp.from(config.getUpdatedAt()),
                config.getSlaConfigId(),
                config.getTenantId()
        );

        if (updated == 0) {
            log.warn("SLA config {} was deleted before the update was written", config.getSlaConfigId());
            throw new SlaConfigNotFoundException(config.getSlaConfigId());
        }
        return config;
    }

    /**
     * Instances that reference the config keep their history; the foreign key
     * clears their sla_config_id.
     */
    public int delete(String tenantId, String slaConfigId) {
        return jdbcTemplate.update(
                "DELETE FROM sla_configs WHERE sla_config_id = ? AND tenant_id = ?",
                slaConfigId, tenantId);
    }

    private class SlaConfigRowMapper implements RowMapper<SlaConfig> {
        @Override
        public SlaConfig mapRow(ResultSet rs, int rowNum) throws SQLException {
            return SlaConfig.builder()
                    .slaConfigId(rs.getString("sla_config_id"))
                    .tenantId(rs.getString("tenant_id"))
                    .projectId(rs.getString("project_id"))
                    .name(rs.getString("name"))
                    .metric(SlaMetric.valueOf(rs.getString("metric")))
                    .targetDurationMinutes(rs.getInt("target_duration_minutes"))
                    .startCondition(jsonMapper.readObject(rs.getString("start_condition")))
                    .stopCondition(jsonMapper.readObject(rs.getString("stop_condition")))
                    .pauseConditions(jsonMapper.readObjectList(rs.getString("pause_conditions")))
                    .calendar(jsonMapper.read(rs.getString("calendar"), BusinessCalendar.class))
                    .escalationRules(jsonMapper.readObjectList(rs.getString("escalation_rules")))
                    .active(rs.getBoolean("active"))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .updatedAt(rs.getTimestamp("updated_at").toInstant())
                    .build();
        }
    }
}
