package io.malicki.retrycommander.kafka.routing;

import io.malicki.retrycommander.kafka.retry.RetryHeaders;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;
import org.apache.kafka.common.header.internals.RecordHeaders;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds and publishes the outbound copy of a failed record, either to the next retry
 * topic or to the dead-letter topic. Key and value are carried over untouched; inbound
 * headers are kept and the retry headers overwritten.
 */
@Slf4j
public class RetryRouter {

    private final RecordPublisher publisher;
    private final AtomicLong retryMessageCount = new AtomicLong(0);
    private final AtomicLong dltMessageCount = new AtomicLong(0);

    public RetryRouter(RecordPublisher publisher) {
        this.publisher = publisher;
    }

    public void sendToRetryTopic(ConsumerRecord<String, String> record,
                                 String retryTopic,
                                 String originalTopic,
                                 int nextLevel,
                                 long nextRetryTimestamp,
                                 Throwable failure,
                                 long now) {
        Headers headers = copyHeaders(record.headers());
        put(headers, RetryHeaders.RETRY_COUNT, Integer.toString(nextLevel));
        put(headers, RetryHeaders.NEXT_RETRY_TIMESTAMP, Long.toString(nextRetryTimestamp));
        put(headers, RetryHeaders.ERROR_MESSAGE, errorMessage(failure));
        put(headers, RetryHeaders.ORIGINAL_TOPIC, originalTopic);
        put(headers, RetryHeaders.LAST_RETRY, Instant.ofEpochMilli(now).toString());

        publisher.publish(new ProducerRecord<>(retryTopic, null, record.key(), record.value(), headers));

        long count = retryMessageCount.incrementAndGet();
        log.info("🔄 Message sent to retry topic: {} | Original Topic: {} | Offset: {} | Level: {} | Due: {} | Total retries: {}",
                retryTopic,
                originalTopic,
                record.offset(),
                nextLevel,
                Instant.ofEpochMilli(nextRetryTimestamp),
                count);
    }

    public void sendToDeadLetterTopic(ConsumerRecord<String, String> record,
                                      String dlqTopic,
                                      String originalTopic,
                                      int retryCount,
                                      Throwable failure,
                                      long now) {
        Headers headers = copyHeaders(record.headers());
        put(headers, RetryHeaders.RETRY_COUNT, Integer.toString(retryCount));
        put(headers, RetryHeaders.ERROR_MESSAGE, errorMessage(failure));
        put(headers, RetryHeaders.ERROR_STACK, getStackTraceAsString(failure));
        put(headers, RetryHeaders.ORIGINAL_TOPIC, originalTopic);
        put(headers, RetryHeaders.FAILED_AT, Instant.ofEpochMilli(now).toString());

        publisher.publish(new ProducerRecord<>(dlqTopic, null, record.key(), record.value(), headers));

        long count = dltMessageCount.incrementAndGet();
        log.warn("📮 Message sent to DLQ: {} | Original Topic: {} | Offset: {} | Retries: {} | Total DLQ: {}",
                dlqTopic,
                originalTopic,
                record.offset(),
                retryCount,
                count);
    }

    public long getRetryMessageCount() {
        return retryMessageCount.get();
    }

    public long getDltMessageCount() {
        return dltMessageCount.get();
    }

    static String errorMessage(Throwable failure) {
        if (failure.getMessage() != null) {
            return failure.getMessage();
        }
        return failure.getClass().getName();
    }

    static String getStackTraceAsString(Throwable e) {
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        e.printStackTrace(pw);
        return sw.toString();
    }

    private static Headers copyHeaders(Headers source) {
        RecordHeaders headers = new RecordHeaders();
        if (source != null) {
            for (Header header : source) {
                headers.add(header.key(), header.value());
            }
        }
        return headers;
    }

    private static void put(Headers headers, String key, String value) {
        headers.remove(key);
        headers.add(key, value.getBytes(StandardCharsets.UTF_8));
    }
}
