package com.company.sla.service;

import com.company.sla.domain.BusinessCalendar;
import com.company.sla.domain.SlaConfig;
import com.company.sla.domain.SlaConfigPage;
import com.company.sla.dto.request.BusinessCalendarRequest;
import com.company.sla.dto.request.CreateSlaConfigRequest;
import com.company.sla.dto.request.UpdateSlaConfigRequest;
import com.company.sla.exception.SlaConfigNotFoundException;
import com.company.sla.repository.SlaConfigRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class SlaConfigService {

    public static final String CONFIG_CACHE = "slaConfigs";
    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 100;

    private final SlaConfigRepository configRepository;
    private final MeterRegistry meterRegistry;

    @Value("${sla.calendar.default-working-hour-start:9}")
    private int defaultWorkingHourStart;

    @Value("${sla.calendar.default-working-hour-end:17}")
    private int defaultWorkingHourEnd;

    @Value("${sla.calendar.default-timezone:UTC}")
    private String defaultTimezone;

    @Transactional
    public SlaConfig createConfig(String tenantId, CreateSlaConfigRequest request) {
        SlaConfig config = SlaConfig.builder()
                .slaConfigId(UUID.randomUUID().toString())
                .tenantId(tenantId)
                .projectId(request.getProjectId())
                .name(request.getName())
                .metric(request.getMetric())
                .targetDurationMinutes(request.getTargetDurationMinutes())
                .startCondition(request.getStartCondition())
                .stopCondition(request.getStopCondition())
                .pauseConditions(orEmpty(request.getPauseConditions()))
                .calendar(toCalendar(request.getCalendar()))
                .escalationRules(orEmpty(request.getEscalationRules()))
                .active(request.getActive() != null ? request.getActive() : Boolean.TRUE)
                .build();

        config = configRepository.insert(config);

        meterRegistry.counter("sla.configs.created", "metric", config.getMetric().name()).increment();
        log.info("Created SLA config {} '{}' ({} min, {}) for tenant {}",
                config.getSlaConfigId(), config.getName(), config.getTargetDurationMinutes(),
                config.getMetric(), tenantId);

        return config;
    }

    @Transactional
    @CacheEvict(value = CONFIG_CACHE, key = "#tenantId + ':' + #slaConfigId")
    public SlaConfig updateConfig(String tenantId, String slaConfigId, UpdateSlaConfigRequest request) {
        SlaConfig existing = configRepository.findById(tenantId, slaConfigId)
                .orElseThrow(() -> new SlaConfigNotFoundException(slaConfigId));

        SlaConfig.SlaConfigBuilder updated = existing.toBuilder();
        if (request.getName() != null) updated.name(request.getName());
        if (request.hasProjectId()) updated.projectId(request.getProjectId());
        if (request.getMetric() != null) updated.metric(request.getMetric());
        if (request.getTargetDurationMinutes() != null) updated.targetDurationMinutes(request.getTargetDurationMinutes());
        if (request.getStartCondition() != null) updated.startCondition(request.getStartCondition());
        if (request.getStopCondition() != null) updated.stopCondition(request.getStopCondition());
        if (request.getPauseConditions() != null) updated.pauseConditions(request.getPauseConditions());
        if (request.getCalendar() != null) updated.calendar(toCalendar(request.getCalendar()));
        if (request.getEscalationRules() != null) updated.escalationRules(request.getEscalationRules());
        if (request.getActive() != null) updated.active(request.getActive());

        SlaConfig saved = configRepository.update(updated.build());

        log.info("Updated SLA config {} for tenant {}", slaConfigId, tenantId);
        return saved;
    }

    @Cacheable(value = CONFIG_CACHE, key = "#tenantId + ':' + #slaConfigId")
    public SlaConfig getConfig(String tenantId, String slaConfigId) {
        return configRepository.findById(tenantId, slaConfigId)
                .orElseThrow(() -> new SlaConfigNotFoundException(slaConfigId));
    }

    /**
     * Pages through the tenant's configs, newest first. A cursor is the id of the
     * last config on the previous page.
     */
    public SlaConfigPage listConfigs(String tenantId, Boolean active, String projectId,
                                     int limit, String cursor) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (cursor != null && configRepository.findById(tenantId, cursor).isEmpty()) {
            throw new IllegalArgumentException("Unknown cursor: " + cursor);
        }

        List<SlaConfig> configs = configRepository.findPage(tenantId, active, projectId, limit, cursor);
        String nextCursor = configs.size() == limit
                ? configs.get(configs.size() - 1).getSlaConfigId()
                : null;

        return SlaConfigPage.builder()
                .configs(configs)
                .total(configRepository.count(tenantId, active, projectId))
                .nextCursor(nextCursor)
                .build();
    }

    /**
     * Existing instances are kept; they lose their config pointer only.
     */
    @Transactional
    @CacheEvict(value = CONFIG_CACHE, key = "#tenantId + ':' + #slaConfigId")
    public void deleteConfig(String tenantId, String slaConfigId) {
        int deleted = configRepository.delete(tenantId, slaConfigId);
        if (deleted == 0) {
            throw new SlaConfigNotFoundException(slaConfigId);
        }

        meterRegistry.counter("sla.configs.deleted").increment();
        log.info("Deleted SLA config {} for tenant {}", slaConfigId, tenantId);
    }

    /**
     * Builds a calendar from the request, filling omitted fields from the
     * configured defaults. Invalid bounds fail with IllegalArgumentException.
     */
    BusinessCalendar toCalendar(BusinessCalendarRequest request) {
        if (request == null) {
            return BusinessCalendar.builder()
                    .workingHourStart(defaultWorkingHourStart)
                    .workingHourEnd(defaultWorkingHourEnd)
                    .timezone(defaultTimezone)
                    .build();
        }

        return BusinessCalendar.builder()
                .workingHourStart(request.getWorkingHourStart() != null
                        ? request.getWorkingHourStart() : defaultWorkingHourStart)
                .workingHourEnd(request.getWorkingHourEnd() != null
                        ? request.getWorkingHourEnd() : defaultWorkingHourEnd)
                .holidays(request.getHolidays())
                .timezone(request.getTimezone() != null ? request.getTimezone() : defaultTimezone)
                .build();
    }

    private static List<Map<String, Object>> orEmpty(List<Map<String, Object>> values) {
        return values != null ? values : List.of();
    }
}
