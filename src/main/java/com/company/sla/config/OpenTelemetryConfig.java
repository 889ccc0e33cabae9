package com.company.sla.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

@Configuration
public class OpenTelemetryConfig {

    @Value("${spring.application.name:sla-tracking-service}")
    private String serviceName;

    @Value("${otel.traces-exporter:none}")
    private String tracesExporter;

    @Value("${otel.metrics-exporter:none}")
    private String metricsExporter;

    @Value("${otel.logs-exporter:none}")
    private String logsExporter;

    /**
     * Defaults come from application properties; OTEL_* environment variables still win.
     */
    @Bean
    public OpenTelemetry openTelemetry() {
        return AutoConfiguredOpenTelemetrySdk.builder()
                .addPropertiesSupplier(() -> Map.of(
                        "otel.service.name", serviceName,
                        "otel.traces.exporter", tracesExporter,
                        "otel.metrics.exporter", metricsExporter,
                        "otel.logs.exporter", logsExporter))
                .build()
                .getOpenTelemetrySdk();
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(serviceName);
    }
}
