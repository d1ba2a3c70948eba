package com.qqsuccubus.triviasync.realtime.metrics;

import com.qqsuccubus.triviasync.realtime.config.SyncConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PrometheusMetricsExporterTest {

    @Test
    void testScrape_ExposesRecordedMeters() {
        PrometheusMetricsExporter exporter = new PrometheusMetricsExporter("scrape-client");
        try {
            MetricsService metricsService = new MetricsService(exporter.getRegistry(),
                SyncConfig.builder().clientId("scrape-client").build());
            metricsService.recordSync("clean");

            String text = exporter.scrape();

            assertTrue(text.contains("trivia_sync_total"), text);
            assertTrue(text.contains("client_id=\"scrape-client\""), text);
        } finally {
            exporter.close();
        }
    }
}
