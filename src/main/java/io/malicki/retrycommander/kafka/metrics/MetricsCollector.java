package io.malicki.retrycommander.kafka.metrics;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-memory metrics. Counters are plain totals; latency and processing time are kept as
 * running averages. Keys have the form {@code {prefix}_{metric}_{topic}}.
 */
@Slf4j
public class MetricsCollector implements RetryMetrics {

    public static final String DEFAULT_PREFIX = "kafka_retry";

    private final boolean enabled;
    private final String prefix;
    private final Map<String, String> labels;

    private final Map<String, LongAdder> counters = new ConcurrentHashMap<>();
    private final Map<String, RunningAverage> averages = new ConcurrentHashMap<>();

    public MetricsCollector() {
        this(true, DEFAULT_PREFIX, Map.of());
    }

    public MetricsCollector(boolean enabled, String prefix, Map<String, String> labels) {
        this.enabled = enabled;
        this.prefix = prefix == null || prefix.isBlank() ? DEFAULT_PREFIX : prefix;
        this.labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    @Override
    public void incrementRetryCount(String topic) {
        if (!enabled) return;
        counters.computeIfAbsent(key("retry_count", topic), k -> new LongAdder()).increment();
    }

    @Override
    public void incrementDLQCount(String topic) {
        if (!enabled) return;
        counters.computeIfAbsent(key("dlq_count", topic), k -> new LongAdder()).increment();
    }

    @Override
    public void recordRetryLatency(String topic, long latencyMs) {
        if (!enabled) return;
        averages.computeIfAbsent(key("retry_latency", topic), k -> new RunningAverage()).add(latencyMs);
    }

    @Override
    public void recordProcessingTime(String topic, long timeMs) {
        if (!enabled) return;
        averages.computeIfAbsent(key("processing_time", topic), k -> new RunningAverage()).add(timeMs);
    }

    public Map<String, Number> getMetrics() {
        Map<String, Number> snapshot = new TreeMap<>();
        counters.forEach((k, v) -> snapshot.put(k, v.sum()));
        averages.forEach((k, v) -> snapshot.put(k, v.average()));
        return snapshot;
    }

    /** Sum of all DLQ counters across topics. */
    public long totalDlqCount() {
        String marker = prefix + "_dlq_count_";
        return counters.entrySet().stream()
            .filter(e -> e.getKey().startsWith(marker))
            .mapToLong(e -> e.getValue().sum())
            .sum();
    }

    public long count(String metric, String topic) {
        LongAdder adder = counters.get(key(metric, topic));
        return adder == null ? 0 : adder.sum();
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void reset() {
        counters.clear();
        averages.clear();
        log.debug("Metrics reset");
    }

    private String key(String metric, String topic) {
        return prefix + "_" + metric + "_" + topic;
    }

    private static final class RunningAverage {
        private long count;
        private double mean;

        synchronized void add(long value) {
            count++;
            mean += (value - mean) / count;
        }

        synchronized double average() {
            return mean;
        }
    }
}
