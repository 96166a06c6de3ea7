package io.malicki.retrycommander.kafka.metrics;

import lombok.extern.slf4j.Slf4j;

/**
 * Wraps a sink so that its failures are logged and never reach message processing.
 * A {@code null} delegate makes every call a no-op.
 */
@Slf4j
public class SafeRetryMetrics implements RetryMetrics {

    private final RetryMetrics delegate;

    public SafeRetryMetrics(RetryMetrics delegate) {
        this.delegate = delegate;
    }

    @Override
    public void incrementRetryCount(String topic) {
        if (delegate == null) return;
        try {
            delegate.incrementRetryCount(topic);
        } catch (RuntimeException e) {
            warn("incrementRetryCount", topic, e);
        }
    }

    @Override
    public void incrementDLQCount(String topic) {
        if (delegate == null) return;
        try {
            delegate.incrementDLQCount(topic);
        } catch (RuntimeException e) {
            warn("incrementDLQCount", topic, e);
        }
    }

    @Override
    public void recordRetryLatency(String topic, long latencyMs) {
        if (delegate == null) return;
        try {
            delegate.recordRetryLatency(topic, latencyMs);
        } catch (RuntimeException e) {
            warn("recordRetryLatency", topic, e);
        }
    }

    @Override
    public void recordProcessingTime(String topic, long timeMs) {
        if (delegate == null) return;
        try {
            delegate.recordProcessingTime(topic, timeMs);
        } catch (RuntimeException e) {
            warn("recordProcessingTime", topic, e);
        }
    }

    private void warn(String call, String topic, RuntimeException e) {
        log.warn("⚠️ Metrics sink {} failed in {} for topic {}: {}",
                delegate.getClass().getSimpleName(), call, topic, e.getMessage());
    }
}
