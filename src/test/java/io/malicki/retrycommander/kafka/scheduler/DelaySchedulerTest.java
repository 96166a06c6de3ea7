package io.malicki.retrycommander.kafka.scheduler;

import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class DelaySchedulerTest {

    private static final TopicPartition RETRY_1 = new TopicPartition("orders.retry.1", 0);
    private static final TopicPartition RETRY_2 = new TopicPartition("orders.retry.2", 0);

    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final Clock clock = Clock.systemUTC();
    private final DelayScheduler scheduler = new DelayScheduler(new PartitionPauser() {
        @Override
        public void pause(TopicPartition partition) {
            calls.add("pause:" + partition);
        }

        @Override
        public void resume(TopicPartition partition) {
            calls.add("resume:" + partition);
        }
    }, clock);

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void pausesThenResumesWhenDue() {
        scheduler.holdUntil(RETRY_1, clock.millis() + 100);

        assertThat(calls).containsExactly("pause:" + RETRY_1);
        assertThat(scheduler.isHeld(RETRY_1)).isTrue();

        await().atMost(Duration.ofSeconds(2))
            .untilAsserted(() -> assertThat(calls).containsExactly("pause:" + RETRY_1, "resume:" + RETRY_1));
        assertThat(scheduler.isHeld(RETRY_1)).isFalse();
    }

    @Test
    void earliestDueTimeWins() {
        long now = clock.millis();
        scheduler.holdUntil(RETRY_1, now + 60_000);
        scheduler.holdUntil(RETRY_1, now + 100);
        scheduler.holdUntil(RETRY_1, now + 120_000);

        assertThat(scheduler.pendingResumes()).containsEntry(RETRY_1, now + 100);

        await().atMost(Duration.ofSeconds(2))
            .untilAsserted(() -> assertThat(calls).contains("resume:" + RETRY_1));
        assertThat(calls).filteredOn(c -> c.startsWith("resume")).hasSize(1);
    }

    @Test
    void resumesInDueOrder() {
        long now = clock.millis();
        scheduler.holdUntil(RETRY_2, now + 300);
        scheduler.holdUntil(RETRY_1, now + 100);

        await().atMost(Duration.ofSeconds(2))
            .untilAsserted(() -> assertThat(calls).filteredOn(c -> c.startsWith("resume")).hasSize(2));
        assertThat(calls).filteredOn(c -> c.startsWith("resume"))
            .containsExactly("resume:" + RETRY_1, "resume:" + RETRY_2);
    }

    @Test
    void pastDueTimeResumesImmediately() {
        scheduler.holdUntil(RETRY_1, clock.millis() - 1_000);

        await().atMost(Duration.ofSeconds(1))
            .untilAsserted(() -> assertThat(calls).contains("resume:" + RETRY_1));
    }

    @Test
    void shutdownDropsPendingResumesAndLeavesPartitionsPaused() throws Exception {
        scheduler.holdUntil(RETRY_1, clock.millis() + 200);

        scheduler.shutdown();
        scheduler.shutdown();

        assertThat(scheduler.pendingResumes()).isEmpty();
        Thread.sleep(400);
        assertThat(calls).containsExactly("pause:" + RETRY_1);

        scheduler.holdUntil(RETRY_2, clock.millis());
        assertThat(calls).containsExactly("pause:" + RETRY_1);
    }
}
