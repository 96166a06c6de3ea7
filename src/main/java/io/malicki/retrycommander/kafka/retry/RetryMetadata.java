package io.malicki.retrycommander.kafka.retry;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Retry state of a message, parsed once from the record headers.
 * <p>
 * Parsing never fails: a missing, malformed or negative retry count is read as {@code 0}
 * and malformed timestamps as {@code 0}, each with a logged warning.
 */
@Value
@Builder
@With
@Slf4j
public class RetryMetadata {

    int retryCount;
    long lastRetryTimestamp;
    long nextRetryTimestamp;
    String originalTopic;
    int originalPartition;
    long originalOffset;
    String error;
    String errorStack;

    public static RetryMetadata fromRecord(ConsumerRecord<?, ?> record) {
        Map<String, String> headers = headersOf(record.headers());
        String originalTopic = headers.get(RetryHeaders.ORIGINAL_TOPIC);

        return RetryMetadata.builder()
            .retryCount(parseRetryCount(headers.get(RetryHeaders.RETRY_COUNT), record))
            .nextRetryTimestamp(parseEpochMillis(RetryHeaders.NEXT_RETRY_TIMESTAMP, headers.get(RetryHeaders.NEXT_RETRY_TIMESTAMP), record))
            .lastRetryTimestamp(parseEpochMillis(RetryHeaders.LAST_RETRY, headers.get(RetryHeaders.LAST_RETRY), record))
            .originalTopic(originalTopic == null || originalTopic.isBlank() ? record.topic() : originalTopic)
            .originalPartition(record.partition())
            .originalOffset(record.offset())
            .error(headers.get(RetryHeaders.ERROR_MESSAGE))
            .errorStack(headers.get(RetryHeaders.ERROR_STACK))
            .build();
    }

    /** Header map where the last occurrence of a key wins. */
    public static Map<String, String> headersOf(Headers headers) {
        Map<String, String> map = new LinkedHashMap<>();
        if (headers == null) {
            return map;
        }
        for (Header header : headers) {
            map.put(header.key(), header.value() == null ? "" : new String(header.value(), StandardCharsets.UTF_8));
        }
        return map;
    }

    static int parseRetryCount(String raw, ConsumerRecord<?, ?> record) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            int count = Integer.parseInt(raw.trim());
            if (count < 0) {
                log.warn("⚠️ Negative {} '{}' | Topic: {} | Offset: {} | Treating as 0",
                        RetryHeaders.RETRY_COUNT, raw, record.topic(), record.offset());
                return 0;
            }
            return count;
        } catch (NumberFormatException e) {
            log.warn("⚠️ Malformed {} '{}' | Topic: {} | Offset: {} | Treating as 0",
                    RetryHeaders.RETRY_COUNT, raw, record.topic(), record.offset());
            return 0;
        }
    }

    /** Accepts epoch milliseconds or an ISO-8601 instant. */
    static long parseEpochMillis(String header, String raw, ConsumerRecord<?, ?> record) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        String value = raw.trim();
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ignored) {
            // not epoch millis, fall through to ISO-8601
        }
        try {
            return Instant.parse(value).toEpochMilli();
        } catch (DateTimeParseException e) {
            log.warn("⚠️ Malformed {} '{}' | Topic: {} | Offset: {} | Treating as 0",
                    header, raw, record.topic(), record.offset());
            return 0;
        }
    }
}
