package io.malicki.retrycommander.kafka.metrics;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsCollectorTest {

    @Test
    void countsPerTopic() {
        MetricsCollector collector = new MetricsCollector();

        collector.incrementRetryCount("orders");
        collector.incrementRetryCount("orders");
        collector.incrementRetryCount("payments");
        collector.incrementDLQCount("orders");

        assertThat(collector.getMetrics())
            .containsEntry("kafka_retry_retry_count_orders", 2L)
            .containsEntry("kafka_retry_retry_count_payments", 1L)
            .containsEntry("kafka_retry_dlq_count_orders", 1L);
        assertThat(collector.totalDlqCount()).isEqualTo(1);
    }

    @Test
    void averagesLatencyAndProcessingTime() {
        MetricsCollector collector = new MetricsCollector(true, "app", Map.of("env", "test"));

        collector.recordRetryLatency("orders", 100);
        collector.recordRetryLatency("orders", 300);
        collector.recordProcessingTime("orders", 10);

        assertThat(collector.getMetrics().get("app_retry_latency_orders").doubleValue()).isEqualTo(200.0);
        assertThat(collector.getMetrics().get("app_processing_time_orders").doubleValue()).isEqualTo(10.0);
        assertThat(collector.getLabels()).containsEntry("env", "test");
    }

    @Test
    void disabledCollectorRecordsNothing() {
        MetricsCollector collector = new MetricsCollector(false, null, null);

        collector.incrementRetryCount("orders");
        collector.recordProcessingTime("orders", 5);

        assertThat(collector.isEnabled()).isFalse();
        assertThat(collector.getMetrics()).isEmpty();
    }

    @Test
    void resetClearsEverything() {
        MetricsCollector collector = new MetricsCollector();
        collector.incrementDLQCount("orders");

        collector.reset();

        assertThat(collector.getMetrics()).isEmpty();
        assertThat(collector.count("dlq_count", "orders")).isZero();
    }
}
