package com.company.sla.repository;

import com.company.sla.domain.SlaInstance;
import com.company.sla.domain.enums.SlaMetric;
import com.company.sla.domain.enums.SlaStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SlaInstanceRepository Unit Tests")
class SlaInstanceRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private JsonColumnMapper jsonMapper;

    private SlaInstanceRepository repository;

    // SQL first, then the bound values in order
    private List<Object> lastUpdate;

    @BeforeEach
    void setUp() {
        repository = new SlaInstanceRepository(jdbcTemplate, jsonMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should bind the expected status and version to the conditional update")
    void shouldGuardTransitionOnStatusAndVersion() {
        // Given
        stubUpdateRows(1);
        SlaInstance instance = pausedInstance(3L);

        // When
        boolean written = repository.updateTransition(instance, SlaStatus.ACTIVE, 3L);

        // Then
        assertThat(written).isTrue();
        String sql = (String) lastUpdate.get(0);
        assertThat(sql).contains("version = version + 1")
                .contains("AND status = ?")
                .contains("AND version = ?");

        List<Object> bound = lastUpdate.subList(1, lastUpdate.size());
        assertThat(bound.get(0)).isEqualTo("PAUSED");
        assertThat(bound.get(7)).isEqualTo(Timestamp.from(NOW));
        assertThat(bound.subList(bound.size() - 4, bound.size()))
                .containsExactly("inst-1", "tenant-1", "ACTIVE", 3L);

        assertThat(instance.getVersion()).isEqualTo(4L);
        assertThat(instance.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should report a lost write and leave the version alone when no row matches")
    void shouldReturnFalseWhenAnotherWriterWon() {
        // Given
        stubUpdateRows(0);
        SlaInstance instance = pausedInstance(3L);

        // When
        boolean written = repository.updateTransition(instance, SlaStatus.ACTIVE, 3L);

        // Then
        assertThat(written).isFalse();
        assertThat(instance.getVersion()).isEqualTo(3L);
        assertThat(instance.getUpdatedAt()).isNull();
    }

    @Test
    @DisplayName("Should stamp new instances with version 0 and the clock time")
    void shouldInsertWithInitialVersion() {
        stubUpdateRows(1);
        SlaInstance instance = pausedInstance(null).toBuilder().status(SlaStatus.ACTIVE).build();

        repository.insert(instance);

        assertThat(instance.getVersion()).isZero();
        assertThat(instance.getCreatedAt()).isEqualTo(NOW);
        assertThat(instance.getUpdatedAt()).isEqualTo(NOW);
        assertThat(lastUpdate).contains("ACTIVE", 0L, Timestamp.from(NOW));
    }

    private void stubUpdateRows(int rows) {
        when(jdbcTemplate.update(anyString(), any(Object[].class))).thenAnswer(invocation -> {
            lastUpdate = Arrays.asList(invocation.getArguments());
            return rows;
        });
    }

    private SlaInstance pausedInstance(Long version) {
        return SlaInstance.builder()
                .instanceId("inst-1")
                .tenantId("tenant-1")
                .slaConfigId("cfg-1")
                .entityId("issue-42")
                .metric(SlaMetric.TIME_TO_FIRST_RESPONSE)
                .status(SlaStatus.PAUSED)
                .startedAt(NOW.minusSeconds(3600))
                .pausedAt(NOW)
                .targetDurationMs(3_600_000L)
                .elapsedMs(1_800_000L)
                .remainingMs(1_800_000L)
                .version(version)
                .build();
    }
}
