package com.company.sla.controller;

import com.company.sla.domain.SlaInstance;
import com.company.sla.domain.enums.SlaStatus;
import com.company.sla.dto.request.StartSlaRequest;
import com.company.sla.dto.response.SlaInstanceResponse;
import com.company.sla.security.TenantContext;
import com.company.sla.service.SlaLifecycleService;
import com.company.sla.util.TimeUtils;
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
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.List;

/**
 * Lifecycle endpoints for SLA instances. Transition errors surface as 409 with
 * the instance's current status.
 */
@RestController
@RequestMapping("/api/v1/sla/instances")
@Tag(name = "SLA Instances", description = "Start, pause, resume and complete SLA clocks")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class SlaInstanceController {

    private final SlaLifecycleService lifecycleService;
    private final TenantContext tenantContext;
    private final MeterRegistry meterRegistry;

    @PostMapping
    @Operation(summary = "Start an SLA clock for an entity")
    @PreAuthorize("hasRole('SLA_AGENT')")
    public ResponseEntity<SlaInstanceResponse> startSla(@Valid @RequestBody StartSlaRequest request) {
        String tenantId = tenantContext.getCurrentTenantId();

        log.info("Start SLA request from user {} for entity {} (config {}) in tenant {}",
                tenantContext.getCurrentUserId(), request.getEntityId(), request.getSlaConfigId(), tenantId);

        meterRegistry.counter("api.sla.instances.requests", "action", "start").increment();

        SlaInstance instance = lifecycleService.startSla(tenantId, request.getSlaConfigId(), request.getEntityId());

        return ResponseEntity
                .created(URI.create("/api/v1/sla/instances/" + instance.getInstanceId()))
                .body(toResponse(instance));
    }

    @PostMapping("/{instanceId}/pause")
    @Operation(summary = "Pause an active SLA clock")
    @PreAuthorize("hasRole('SLA_AGENT')")
    public ResponseEntity<SlaInstanceResponse> pauseSla(@PathVariable String instanceId) {
        String tenantId = tenantContext.getCurrentTenantId();
        meterRegistry.counter("api.sla.instances.requests", "action", "pause").increment();

        return ResponseEntity.ok(toResponse(lifecycleService.pauseSla(tenantId, instanceId)));
    }

    @PostMapping("/{instanceId}/resume")
    @Operation(summary = "Resume a paused SLA clock")
    @PreAuthorize("hasRole('SLA_AGENT')")
    public ResponseEntity<SlaInstanceResponse> resumeSla(@PathVariable String instanceId) {
        String tenantId = tenantContext.getCurrentTenantId();
        meterRegistry.counter("api.sla.instances.requests", "action", "resume").increment();

        return ResponseEntity.ok(toResponse(lifecycleService.resumeSla(tenantId, instanceId)));
    }

    @PostMapping("/{instanceId}/complete")
    @Operation(summary = "Complete an SLA clock", description = "Resolves the instance as MET or BREACHED")
    @PreAuthorize("hasRole('SLA_AGENT')")
    public ResponseEntity<SlaInstanceResponse> completeSla(@PathVariable String instanceId) {
        String tenantId = tenantContext.getCurrentTenantId();
        meterRegistry.counter("api.sla.instances.requests", "action", "complete").increment();

        return ResponseEntity.ok(toResponse(lifecycleService.completeSla(tenantId, instanceId)));
    }

    @GetMapping
    @Operation(summary = "List SLA instances for an entity", description = "Most recently started first")
    @PreAuthorize("hasAnyRole('SLA_ADMIN', 'SLA_AGENT')")
    public ResponseEntity<List<SlaInstanceResponse>> getSlaInstances(
            @RequestParam String entityId,
            @Parameter(description = "Optional status filter")
            @RequestParam(required = false) SlaStatus status) {

        String tenantId = tenantContext.getCurrentTenantId();

        List<SlaInstanceResponse> instances = lifecycleService.getSlaInstances(tenantId, entityId, status).stream()
                .map(this::toResponse)
                .toList();

        return ResponseEntity.ok(instances);
    }

    private SlaInstanceResponse toResponse(SlaInstance instance) {
        return SlaInstanceResponse.builder()
                .instanceId(instance.getInstanceId())
                .slaConfigId(instance.getSlaConfigId())
                .entityId(instance.getEntityId())
                .metric(instance.getMetric())
                .status(instance.getStatus())
                .startedAt(instance.getStartedAt())
                .pausedAt(instance.getPausedAt())
                .completedAt(instance.getCompletedAt())
                .breachTime(instance.getBreachTime())
                .elapsedMs(instance.getElapsedMs())
                .remainingMs(instance.getRemainingMs())
                .elapsedFormatted(TimeUtils.formatDuration(instance.getElapsedMs()))
                .remainingFormatted(TimeUtils.formatDuration(instance.getRemainingMs()))
                .build();
    }
}
