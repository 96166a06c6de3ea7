package io.malicki.retrycommander.kafka.topology;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TopicNamingStrategyTest {

    @Test
    void defaultNames() {
        TopicNamingStrategy naming = TopicNamingStrategy.defaults();

        assertThat(naming.retryTopic("orders", 1)).isEqualTo("orders.retry.1");
        assertThat(naming.retryTopic("orders", 3)).isEqualTo("orders.retry.3");
        assertThat(naming.dlqTopic("orders")).isEqualTo("orders.dlq");
    }

    @Test
    void sameInputsGiveSameNames() {
        TopicNamingStrategy naming = TopicNamingStrategy.of("{topic}-r{n}", null);

        assertThat(naming.retryTopic("payments", 2)).isEqualTo(naming.retryTopic("payments", 2));
        assertThat(naming.retryTopic("payments", 2)).isEqualTo("payments-r2");
    }

    @Test
    void staticOverrides() {
        TopicNamingStrategy naming = TopicNamingStrategy.of("shared-retry", "shared-dlq");

        assertThat(naming.retryTopic("orders", 1)).isEqualTo("shared-retry");
        assertThat(naming.retryTopic("payments", 3)).isEqualTo("shared-retry");
        assertThat(naming.dlqTopic("orders")).isEqualTo("shared-dlq");
    }

    @Test
    void blankOverridesFallBackToDefaults() {
        TopicNamingStrategy naming = TopicNamingStrategy.of("  ", "");

        assertThat(naming.retryTopic("orders", 1)).isEqualTo("orders.retry.1");
        assertThat(naming.dlqTopic("orders")).isEqualTo("orders.dlq");
    }

    @Test
    void retryFunctionIgnoresTopic() {
        TopicNamingStrategy naming = TopicNamingStrategy.retryFunction(level -> "retry-" + level * 5 + "s", null);

        assertThat(naming.retryTopic("orders", 2)).isEqualTo("retry-10s");
        assertThat(naming.dlqTopic("orders")).isEqualTo("orders.dlq");
    }

    @Test
    void levelStartsAtOne() {
        assertThatThrownBy(() -> TopicNamingStrategy.defaults().retryTopic("orders", 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
