package io.malicki.retrycommander.kafka.retry;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static io.malicki.retrycommander.support.TestRecords.record;
import static org.assertj.core.api.Assertions.assertThat;

class RetryMetadataTest {

    @Test
    void freshRecordHasNoRetryState() {
        RetryMetadata metadata = RetryMetadata.fromRecord(record("orders", 12, "k", "{}"));

        assertThat(metadata.getRetryCount()).isZero();
        assertThat(metadata.getNextRetryTimestamp()).isZero();
        assertThat(metadata.getOriginalTopic()).isEqualTo("orders");
        assertThat(metadata.getOriginalPartition()).isZero();
        assertThat(metadata.getOriginalOffset()).isEqualTo(12);
        assertThat(metadata.getError()).isNull();
    }

    @Test
    void readsRetryHeaders() {
        RetryMetadata metadata = RetryMetadata.fromRecord(record("orders.retry.2", 0, "k", "{}",
            RetryHeaders.RETRY_COUNT, "2",
            RetryHeaders.NEXT_RETRY_TIMESTAMP, "1700000003000",
            RetryHeaders.LAST_RETRY, "2023-11-14T22:13:21Z",
            RetryHeaders.ORIGINAL_TOPIC, "orders",
            RetryHeaders.ERROR_MESSAGE, "timeout"));

        assertThat(metadata.getRetryCount()).isEqualTo(2);
        assertThat(metadata.getNextRetryTimestamp()).isEqualTo(1_700_000_003_000L);
        assertThat(metadata.getLastRetryTimestamp()).isEqualTo(Instant.parse("2023-11-14T22:13:21Z").toEpochMilli());
        assertThat(metadata.getOriginalTopic()).isEqualTo("orders");
        assertThat(metadata.getError()).isEqualTo("timeout");
    }

    @Test
    void malformedOrNegativeValuesFallBackToZero() {
        assertThat(RetryMetadata.fromRecord(record("orders", 0, "k", "{}", RetryHeaders.RETRY_COUNT, "-4")).getRetryCount())
            .isZero();
        assertThat(RetryMetadata.fromRecord(record("orders", 0, "k", "{}", RetryHeaders.RETRY_COUNT, "2x")).getRetryCount())
            .isZero();
        assertThat(RetryMetadata.fromRecord(record("orders", 0, "k", "{}", RetryHeaders.NEXT_RETRY_TIMESTAMP, "soon")).getNextRetryTimestamp())
            .isZero();
    }

    @Test
    void lastHeaderOccurrenceWins() {
        ConsumerRecord<String, String> record = record("orders", 0, "k", "{}", RetryHeaders.RETRY_COUNT, "1");
        record.headers().add(RetryHeaders.RETRY_COUNT, "2".getBytes(StandardCharsets.UTF_8));

        assertThat(RetryMetadata.fromRecord(record).getRetryCount()).isEqualTo(2);
    }
}
