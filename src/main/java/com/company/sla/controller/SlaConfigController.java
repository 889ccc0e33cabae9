package com.company.sla.controller;

import com.company.sla.domain.SlaConfig;
import com.company.sla.domain.SlaConfigPage;
import com.company.sla.dto.request.CreateSlaConfigRequest;
import com.company.sla.dto.request.UpdateSlaConfigRequest;
import com.company.sla.dto.response.SlaConfigPageResponse;
import com.company.sla.dto.response.SlaConfigResponse;
import com.company.sla.security.TenantContext;
import com.company.sla.service.SlaConfigService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;

@RestController
@RequestMapping("/api/v1/sla/configs")
@Tag(name = "SLA Configs", description = "Manage SLA definitions")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class SlaConfigController {

    private final SlaConfigService configService;
    private final TenantContext tenantContext;
    private final MeterRegistry meterRegistry;

    @PostMapping
    @Operation(summary = "Create an SLA config")
    @PreAuthorize("hasRole('SLA_ADMIN')")
    public ResponseEntity<SlaConfigResponse> createConfig(@Valid @RequestBody CreateSlaConfigRequest request) {
        String tenantId = tenantContext.getCurrentTenantId();

        log.info("Create SLA config request from user {} in tenant {}",
                tenantContext.getCurrentUserId(), tenantId);

        meterRegistry.counter("api.sla.configs.create.requests").increment();

        SlaConfig config = configService.createConfig(tenantId, request);

        return ResponseEntity
                .created(URI.create("/api/v1/sla/configs/" + config.getSlaConfigId()))
                .body(toResponse(config));
    }

    @PatchMapping("/{slaConfigId}")
    @Operation(summary = "Update an SLA config", description = "Only the fields present in the body are changed")
    @PreAuthorize("hasRole('SLA_ADMIN')")
    public ResponseEntity<SlaConfigResponse> updateConfig(
            @PathVariable String slaConfigId,
            @Valid @RequestBody UpdateSlaConfigRequest request) {

        String tenantId = tenantContext.getCurrentTenantId();
        meterRegistry.counter("api.sla.configs.update.requests").increment();

        return ResponseEntity.ok(toResponse(configService.updateConfig(tenantId, slaConfigId, request)));
    }

    @GetMapping("/{slaConfigId}")
    @Operation(summary = "Get an SLA config")
    @PreAuthorize("hasAnyRole('SLA_ADMIN', 'SLA_AGENT')")
    public ResponseEntity<SlaConfigResponse> getConfig(@PathVariable String slaConfigId) {
        String tenantId = tenantContext.getCurrentTenantId();
        return ResponseEntity.ok(toResponse(configService.getConfig(tenantId, slaConfigId)));
    }

    @GetMapping
    @Operation(
            summary = "List SLA configs for the caller's tenant",
            description = "Newest first, paged with limit and the nextCursor of the previous page"
    )
    @PreAuthorize("hasAnyRole('SLA_ADMIN', 'SLA_AGENT')")
    public ResponseEntity<SlaConfigPageResponse> listConfigs(
            @Parameter(description = "Filter on the active flag; omit for all configs")
            @RequestParam(required = false) Boolean active,
            @Parameter(description = "Only configs of this project")
            @RequestParam(required = false) String projectId,
            @Parameter(description = "Page size, 1 to 100")
            @RequestParam(defaultValue = "50") int limit,
            @Parameter(description = "nextCursor from the previous page")
            @RequestParam(required = false) String cursor) {

        String tenantId = tenantContext.getCurrentTenantId();

        SlaConfigPage page = configService.listConfigs(tenantId, active, projectId, limit, cursor);

        return ResponseEntity.ok(SlaConfigPageResponse.builder()
                .configs(page.getConfigs().stream().map(this::toResponse).toList())
                .total(page.getTotal())
                .nextCursor(page.getNextCursor())
                .build());
    }

    @DeleteMapping("/{slaConfigId}")
    @Operation(summary = "Delete an SLA config", description = "Instances created from it are kept")
    @PreAuthorize("hasRole('SLA_ADMIN')")
    public ResponseEntity<Void> deleteConfig(@PathVariable String slaConfigId) {
        String tenantId = tenantContext.getCurrentTenantId();

        log.info("Delete SLA config {} requested by user {} in tenant {}",
                slaConfigId, tenantContext.getCurrentUserId(), tenantId);

        configService.deleteConfig(tenantId, slaConfigId);
        return ResponseEntity.noContent().build();
    }

    private SlaConfigResponse toResponse(SlaConfig config) {
        return SlaConfigResponse.builder()
                .slaConfigId(config.getSlaConfigId())
                .projectId(config.getProjectId())
                .name(config.getName())
                .metric(config.getMetric())
                .targetDurationMinutes(config.getTargetDurationMinutes())
                .startCondition(config.getStartCondition())
                .stopCondition(config.getStopCondition())
                .pauseConditions(config.getPauseConditions())
                .calendar(config.getEffectiveCalendar())
                .escalationRules(config.getEscalationRules())
                .active(config.getActive())
                .createdAt(config.getCreatedAt())
                .updatedAt(config.getUpdatedAt())
                .build();
    }
}
