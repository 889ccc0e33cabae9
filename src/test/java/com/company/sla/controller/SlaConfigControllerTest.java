package com.company.sla.controller;

import com.company.sla.domain.BusinessCalendar;
import com.company.sla.domain.SlaConfig;
import com.company.sla.domain.SlaConfigPage;
import com.company.sla.domain.enums.SlaMetric;
import com.company.sla.dto.request.CreateSlaConfigRequest;
import com.company.sla.dto.request.UpdateSlaConfigRequest;
import com.company.sla.exception.GlobalExceptionHandler;
import com.company.sla.exception.SlaConfigNotFoundException;
import com.company.sla.security.TenantContext;
import com.company.sla.service.SlaConfigService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SlaConfigControllerTest {

    private static final String TENANT = "tenant-1";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private SlaConfigService configService;

    @Mock
    private TenantContext tenantContext;

    @Captor
    private ArgumentCaptor<UpdateSlaConfigRequest> requestCaptor;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new SlaConfigController(configService, tenantContext, new SimpleMeterRegistry()))
                .setControllerAdvice(new GlobalExceptionHandler(CLOCK))
                .build();

        lenient().when(tenantContext.getCurrentTenantId()).thenReturn(TENANT);
    }

    @Test
    void createReturnsConfig() throws Exception {
        when(configService.createConfig(eq(TENANT), any(CreateSlaConfigRequest.class))).thenReturn(config());

        mockMvc.perform(post("/api/v1/sla/configs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"First response","metric":"TIME_TO_FIRST_RESPONSE",
                                 "targetDurationMinutes":60,
                                 "startCondition":{"event":"issue.created"},
                                 "stopCondition":{"event":"issue.commented"}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.slaConfigId").value("cfg-1"))
                .andExpect(jsonPath("$.calendar.workingHourStart").value(9))
                .andExpect(jsonPath("$.calendar.workingHourEnd").value(17));
    }

    @Test
    void createRejectsNonPositiveTarget() throws Exception {
        mockMvc.perform(post("/api/v1/sla/configs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"First response","metric":"TIME_TO_FIRST_RESPONSE",
                                 "targetDurationMinutes":0,
                                 "startCondition":{},"stopCondition":{}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.targetDurationMinutes").value("Target duration must be positive"));

        verify(configService, never()).createConfig(any(), any());
    }

    @Test
    void createRejectsInvertedWorkingHours() throws Exception {
        mockMvc.perform(post("/api/v1/sla/configs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"First response","metric":"TIME_TO_FIRST_RESPONSE",
                                 "targetDurationMinutes":60,
                                 "startCondition":{},"stopCondition":{},
                                 "calendar":{"workingHourStart":17,"workingHourEnd":9}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors['calendar.workingHoursOrdered']")
                        .value("Working hours start must be before end"));
    }

    @Test
    void listReturnsFirstPageByDefault() throws Exception {
        when(configService.listConfigs(TENANT, null, null, 50, null))
                .thenReturn(new SlaConfigPage(List.of(config()), 1L, null));

        mockMvc.perform(get("/api/v1/sla/configs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.configs[0].name").value("First response"))
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.nextCursor").value(nullValue()));
    }

    @Test
    void listPassesProjectFilterAndCursor() throws Exception {
        when(configService.listConfigs(TENANT, Boolean.TRUE, "proj-1", 1, "cfg-0"))
                .thenReturn(new SlaConfigPage(List.of(config()), 3L, "cfg-1"));

        mockMvc.perform(get("/api/v1/sla/configs")
                        .param("active", "true")
                        .param("projectId", "proj-1")
                        .param("limit", "1")
                        .param("cursor", "cfg-0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(3))
                .andExpect(jsonPath("$.nextCursor").value("cfg-1"));
    }

    @Test
    void listRejectsOversizedPage() throws Exception {
        when(configService.listConfigs(TENANT, null, null, 500, null))
                .thenThrow(new IllegalArgumentException("limit must be between 1 and 100"));

        mockMvc.perform(get("/api/v1/sla/configs").param("limit", "500"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("limit must be between 1 and 100"));
    }

    @Test
    void updateWithNullProjectIdRequestsClear() throws Exception {
        when(configService.updateConfig(eq(TENANT), eq("cfg-1"), any(UpdateSlaConfigRequest.class)))
                .thenReturn(config());

        mockMvc.perform(patch("/api/v1/sla/configs/cfg-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\":null}"))
                .andExpect(status().isOk());

        verify(configService).updateConfig(eq(TENANT), eq("cfg-1"), requestCaptor.capture());
        assertThat(requestCaptor.getValue().hasProjectId()).isTrue();
        assertThat(requestCaptor.getValue().getProjectId()).isNull();
    }

    @Test
    void updateWithoutProjectIdLeavesItAlone() throws Exception {
        when(configService.updateConfig(eq(TENANT), eq("cfg-1"), any(UpdateSlaConfigRequest.class)))
                .thenReturn(config());

        mockMvc.perform(patch("/api/v1/sla/configs/cfg-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Renamed\"}"))
                .andExpect(status().isOk());

        verify(configService).updateConfig(eq(TENANT), eq("cfg-1"), requestCaptor.capture());
        assertThat(requestCaptor.getValue().hasProjectId()).isFalse();
    }

    @Test
    void deleteMissingConfigIsNotFound() throws Exception {
        doThrow(new SlaConfigNotFoundException("missing")).when(configService).deleteConfig(TENANT, "missing");

        mockMvc.perform(delete("/api/v1/sla/configs/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("SLA config not found: missing"))
                .andExpect(jsonPath("$.timestamp").value("2026-03-02T10:00:00Z"));
    }

    @Test
    void deleteReturnsNoContent() throws Exception {
        mockMvc.perform(delete("/api/v1/sla/configs/cfg-1"))
                .andExpect(status().isNoContent());

        verify(configService).deleteConfig(TENANT, "cfg-1");
    }

    private SlaConfig config() {
        return SlaConfig.builder()
                .slaConfigId("cfg-1")
                .tenantId(TENANT)
                .name("First response")
                .metric(SlaMetric.TIME_TO_FIRST_RESPONSE)
                .targetDurationMinutes(60)
                .startCondition(Map.of("event", "issue.created"))
                .stopCondition(Map.of("event", "issue.commented"))
                .calendar(BusinessCalendar.DEFAULT)
                .active(true)
                .build();
    }
}
