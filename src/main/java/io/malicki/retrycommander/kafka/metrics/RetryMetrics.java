package io.malicki.retrycommander.kafka.metrics;

/**
 * Sink for retry counters and timings. Called from every partition's dispatch, so
 * implementations must be thread-safe and should return quickly.
 */
public interface RetryMetrics {

    void incrementRetryCount(String topic);

    void incrementDLQCount(String topic);

    void recordRetryLatency(String topic, long latencyMs);

    void recordProcessingTime(String topic, long timeMs);
}
