package io.malicki.retrycommander.kafka.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Publishes retry metrics to a Micrometer registry, one meter per topic.
 */
public class MicrometerRetryMetrics implements RetryMetrics {

    private final MeterRegistry registry;
    private final String prefix;
    private final Tags commonTags;

    private final ConcurrentHashMap<String, Counter> retryCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> dlqCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> retryLatency = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> processingTime = new ConcurrentHashMap<>();

    public MicrometerRetryMetrics(MeterRegistry registry, String prefix, Map<String, String> labels) {
        this.registry = registry;
        this.prefix = prefix.replace('_', '.');
        Tags tags = Tags.empty();
        if (labels != null) {
            for (Map.Entry<String, String> label : labels.entrySet()) {
                tags = tags.and(Tag.of(label.getKey(), label.getValue()));
            }
        }
        this.commonTags = tags;
    }

    @Override
    public void incrementRetryCount(String topic) {
        retryCounters.computeIfAbsent(topic, t -> Counter.builder(prefix + ".retries")
            .description("Messages republished to a retry topic")
            .tags(commonTags).tag("topic", t)
            .register(registry)).increment();
    }

    @Override
    public void incrementDLQCount(String topic) {
        dlqCounters.computeIfAbsent(topic, t -> Counter.builder(prefix + ".dlq")
            .description("Messages routed to the dead-letter topic")
            .tags(commonTags).tag("topic", t)
            .register(registry)).increment();
    }

    @Override
    public void recordRetryLatency(String topic, long latencyMs) {
        retryLatency.computeIfAbsent(topic, t -> Timer.builder(prefix + ".retry.latency")
            .description("Delay between a retry becoming due and its dispatch")
            .tags(commonTags).tag("topic", t)
            .register(registry)).record(Duration.ofMillis(latencyMs));
    }

    @Override
    public void recordProcessingTime(String topic, long timeMs) {
        processingTime.computeIfAbsent(topic, t -> Timer.builder(prefix + ".processing.time")
            .description("Handler processing time")
            .tags(commonTags).tag("topic", t)
            .register(registry)).record(Duration.ofMillis(timeMs));
    }
}
