package com.company.sla.config;

import com.company.sla.cache.SlaDeadlineCache;
import com.company.sla.domain.enums.SlaStatus;
import com.company.sla.repository.SlaInstanceRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final SlaInstanceRepository instanceRepository;
    private final SlaDeadlineCache deadlineCache;

    @Bean
    public MeterBinder slaInstanceMetrics() {
        return registry -> {
            for (SlaStatus status : new SlaStatus[]{SlaStatus.ACTIVE, SlaStatus.PAUSED}) {
                Gauge.builder("sla.instances.open", instanceRepository, repo -> {
                            try {
                                return repo.countByStatus(status);
                            } catch (Exception e) {
                                log.warn("Failed to count {} SLA instances", status, e);
                                return 0;
                            }
                        })
                        .tag("status", status.name())
                        .description("Number of SLA instances that are not yet completed")
                        .register(registry);
            }

            Gauge.builder("sla.monitoring.deadlines", deadlineCache, SlaDeadlineCache::getMonitoredCount)
                    .description("Number of running SLA clocks in the deadline index")
                    .register(registry);

            log.info("SLA metrics registered");
        };
    }
}
