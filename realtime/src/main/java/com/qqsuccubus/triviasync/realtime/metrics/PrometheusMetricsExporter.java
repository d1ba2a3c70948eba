package com.qqsuccubus.triviasync.realtime.metrics;

import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus registry attached to Micrometer's global composite registry.
 * <p>
 * The embedding application exposes {@link #scrape()} on whatever endpoint it serves.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String clientId) {
        this.registry = Metrics.globalRegistry;

        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        Metrics.globalRegistry.add(prometheusRegistry);

        registry.config().commonTags("service", "trivia-sync");
        log.info("Metrics exporter initialized for client {} with global registry + Prometheus", clientId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }

    public void close() {
        Metrics.globalRegistry.remove(prometheusRegistry);
        prometheusRegistry.close();
    }
}
