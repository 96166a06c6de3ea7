package io.malicki.retrycommander.kafka.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Bound from application.yml under "retry-commander":
 * <pre>
 * retry-commander:
 *   brokers: [localhost:9092]
 *   group-id: orders-service
 *   topics: [orders]
 *   retry:
 *     max-retries: 3
 *     initial-delay: 1000
 *     backoff-factor: 2
 * </pre>
 */
@ConfigurationProperties(prefix = "retry-commander")
@Getter
@Setter
public class RetryCommanderProperties {

    private List<String> brokers = new ArrayList<>(List.of("localhost:9092"));
    private String clientId = "retry-commander";
    private String groupId = "retry-commander";
    private List<String> topics = new ArrayList<>();
    private Duration pollTimeout = Duration.ofMillis(500);
    /** Consumer threads of the listener container. */
    private int concurrency = 1;
    private Duration sendTimeout = Duration.ofSeconds(30);
    private boolean autoStartup = true;
    private boolean loggingHook = false;

    private Retry retry = new Retry();
    private Metrics metrics = new Metrics();

    @Getter
    @Setter
    public static class Retry {
        private int maxRetries = 3;
        /** Delay before the first retry in ms. */
        private long initialDelay = 1000;
        private double backoffFactor = 2.0;
        /** Cap for a single delay in ms; unset means unbounded. */
        private Long maxDelay;
        private Topics topics = new Topics();
        private TopicConfig topicConfig = new TopicConfig();
    }

    @Getter
    @Setter
    public static class Topics {
        /** Static dead-letter topic shared by all topics; default {topic}.dlq. */
        private String dlq;
        /** Static retry topic name or a template with {topic} and {n}; default {topic}.retry.{n}. */
        private String retry;
    }

    @Getter
    @Setter
    public static class TopicConfig {
        private int partitions = 1;
        private short replicationFactor = 1;
        private Retention retention = new Retention();
    }

    @Getter
    @Setter
    public static class Retention {
        /** ms; unset keeps the broker default. */
        private Long retryTopics;
        /** ms; unset keeps the broker default. */
        private Long dlq;
    }

    @Getter
    @Setter
    public static class Metrics {
        private boolean enabled = true;
        private Backend backend = Backend.IN_MEMORY;
        private String prefix = "kafka_retry";
        private Map<String, String> labels = new HashMap<>();
        /** DLQ volume above which /api/retry/health reports WARNING. */
        private long dlqWarningThreshold = 100;
    }

    public enum Backend {
        IN_MEMORY,
        MICROMETER
    }
}
