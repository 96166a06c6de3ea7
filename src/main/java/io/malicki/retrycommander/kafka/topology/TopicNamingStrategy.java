package io.malicki.retrycommander.kafka.topology;

import java.util.Objects;
import java.util.function.IntFunction;

/**
 * Derives retry and dead-letter topic names from a logical topic.
 * <p>
 * The same instance is used when topics are provisioned and when records are routed,
 * so the two paths can never disagree on a name.
 */
public interface TopicNamingStrategy {

    String RETRY_SUFFIX = ".retry.";
    String DLQ_SUFFIX = ".dlq";

    String retryTopic(String topic, int retryLevel);

    String dlqTopic(String topic);

    /** {@code {topic}.retry.{n}} and {@code {topic}.dlq}. */
    static TopicNamingStrategy defaults() {
        return of(null, null);
    }

    /**
     * Builds a strategy from configured overrides.
     *
     * @param retry    static retry topic name, or a template containing {@code {topic}} and/or {@code {n}};
     *                 {@code null} or blank for the default
     * @param dlq      static dead-letter topic name; {@code null} or blank for the default
     */
    static TopicNamingStrategy of(String retry, String dlq) {
        String dlqName = blankToNull(dlq);
        String retryName = blankToNull(retry);

        if (retryName == null) {
            return new Simple((topic, level) -> topic + RETRY_SUFFIX + level, dlqName);
        }
        if (retryName.contains("{topic}") || retryName.contains("{n}")) {
            return new Simple((topic, level) -> retryName
                .replace("{topic}", topic)
                .replace("{n}", Integer.toString(level)), dlqName);
        }
        return new Simple((topic, level) -> retryName, dlqName);
    }

    /** Retry names computed from the retry level alone, independent of the logical topic. */
    static TopicNamingStrategy retryFunction(IntFunction<String> retry, String dlq) {
        Objects.requireNonNull(retry, "retry");
        return new Simple((topic, level) -> retry.apply(level), blankToNull(dlq));
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    @FunctionalInterface
    interface RetryNamer {
        String name(String topic, int level);
    }

    final class Simple implements TopicNamingStrategy {
        private final RetryNamer retryNamer;
        private final String staticDlq;

        Simple(RetryNamer retryNamer, String staticDlq) {
            this.retryNamer = retryNamer;
            this.staticDlq = staticDlq;
        }

        @Override
        public String retryTopic(String topic, int retryLevel) {
            if (retryLevel < 1) {
                throw new IllegalArgumentException("Retry level starts at 1, got " + retryLevel);
            }
            return retryNamer.name(topic, retryLevel);
        }

        @Override
        public String dlqTopic(String topic) {
            return staticDlq != null ? staticDlq : topic + DLQ_SUFFIX;
        }
    }
}
