package io.malicki.retrycommander.kafka.retry;

import io.malicki.retrycommander.kafka.hook.RetryHook;
import io.malicki.retrycommander.kafka.metrics.RetryMetrics;
import io.malicki.retrycommander.kafka.topology.TopicNamingStrategy;
import io.malicki.retrycommander.kafka.topology.TopicProvisioning;
import io.malicki.retrycommander.kafka.validation.PayloadValidator;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class RetryConfig {

    @Builder.Default
    int maxRetries = 3;

    /** Delay before the first retry, in ms. */
    @Builder.Default
    long initialDelay = 1000;

    @Builder.Default
    double backoffFactor = 2.0;

    /** Upper bound on a single delay in ms; {@code null} leaves backoff unbounded. */
    Long maxDelay;

    @Builder.Default
    TopicNamingStrategy naming = TopicNamingStrategy.defaults();

    @Builder.Default
    TopicProvisioning provisioning = TopicProvisioning.defaults();

    PayloadValidator validator;

    @Singular
    List<RetryHook> hooks;

    RetryMetrics metrics;

    /**
     * Backoff before retry level {@code retryCount + 1}:
     * {@code initialDelay * backoffFactor^retryCount}, saturating at {@link Long#MAX_VALUE}.
     */
    public long delayFor(int retryCount) {
        double delay = initialDelay * Math.pow(backoffFactor, retryCount);
        long millis = delay >= Long.MAX_VALUE ? Long.MAX_VALUE : Math.round(delay);
        if (maxDelay != null) {
            millis = Math.min(millis, maxDelay);
        }
        return Math.max(0, millis);
    }

    public void validate() {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        if (initialDelay < 0) {
            throw new IllegalArgumentException("initialDelay must be >= 0, got " + initialDelay);
        }
        if (!(backoffFactor > 0) || Double.isInfinite(backoffFactor)) {
            throw new IllegalArgumentException("backoffFactor must be a finite positive number, got " + backoffFactor);
        }
        if (maxDelay != null && maxDelay < 0) {
            throw new IllegalArgumentException("maxDelay must be >= 0, got " + maxDelay);
        }
    }
}
