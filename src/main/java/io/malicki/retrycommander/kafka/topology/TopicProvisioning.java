package io.malicki.retrycommander.kafka.topology;

import lombok.Builder;
import lombok.Value;

/**
 * Creation parameters for the topics of a {@link TopicSet}.
 * Retention is only applied to retry and dead-letter topics; the main topic keeps the broker default.
 */
@Value
@Builder
public class TopicProvisioning {

    public static final String RETENTION_MS = "retention.ms";

    @Builder.Default
    int partitions = 1;

    @Builder.Default
    short replicationFactor = 1;

    /** Retention for retry topics in ms, {@code null} for broker default. */
    Long retryRetentionMs;

    /** Retention for the dead-letter topic in ms, {@code null} for broker default. */
    Long dlqRetentionMs;

    public static TopicProvisioning defaults() {
        return TopicProvisioning.builder().build();
    }
}
