package io.malicki.retrycommander.kafka.retry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RetryConfigTest {

    @Test
    void delayGrowsExponentially() {
        RetryConfig config = RetryConfig.builder().initialDelay(1000).backoffFactor(2.0).build();
        assertEquals(1000, config.delayFor(0));
        assertEquals(2000, config.delayFor(1));
        assertEquals(4000, config.delayFor(2));
        assertEquals(8000, config.delayFor(3));
    }

    @Test
    void delayIsCappedByMaxDelay() {
        RetryConfig config = RetryConfig.builder().initialDelay(1000).backoffFactor(3.0).maxDelay(5000L).build();
        assertEquals(3000, config.delayFor(1));
        assertEquals(5000, config.delayFor(2)); // capped
    }

    @Test
    void hugeExponentSaturates() {
        RetryConfig config = RetryConfig.builder().initialDelay(1000).backoffFactor(10.0).build();
        assertEquals(Long.MAX_VALUE, config.delayFor(400));
    }

    @Test
    void defaults() {
        RetryConfig config = RetryConfig.builder().build();
        assertEquals(3, config.getMaxRetries());
        assertEquals(1000, config.getInitialDelay());
        assertEquals(2.0, config.getBackoffFactor());
        assertNull(config.getMaxDelay());
        assertTrue(config.getHooks().isEmpty());
        assertEquals("orders.retry.2", config.getNaming().retryTopic("orders", 2));
        assertDoesNotThrow(config::validate);
    }

    @Test
    void invalidParamsThrow() {
        assertThrows(IllegalArgumentException.class, () -> RetryConfig.builder().maxRetries(-1).build().validate());
        assertThrows(IllegalArgumentException.class, () -> RetryConfig.builder().initialDelay(-1).build().validate());
        assertThrows(IllegalArgumentException.class, () -> RetryConfig.builder().backoffFactor(0).build().validate());
        assertThrows(IllegalArgumentException.class, () -> RetryConfig.builder().backoffFactor(Double.NaN).build().validate());
        assertThrows(IllegalArgumentException.class, () -> RetryConfig.builder().maxDelay(-5L).build().validate());
    }
}
