package io.malicki.retrycommander.kafka.errorhandling;

import io.malicki.retrycommander.exception.RetryCommanderException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;

@Slf4j
public class LoggingRetryErrorHandler implements RetryErrorHandler {

    @Override
    public void handleError(Throwable error, ConsumerRecord<?, ?> record) {
        ErrorCategory category = error instanceof RetryCommanderException
            ? ((RetryCommanderException) error).getCategory()
            : ErrorCategory.HANDLER;

        log.error("❌ Error processing message | Topic: {} | Partition: {} | Offset: {} | Category: {} | Counts as attempt: {} | Error: {}",
                record.topic(),
                record.partition(),
                record.offset(),
                category.name(),
                category.isCountsAsAttempt(),
                error.getMessage());

        for (Throwable suppressed : error.getSuppressed()) {
            log.error("   ↳ also: {}", suppressed.getMessage());
        }
        log.debug("   {}", category.getDescription(), error);
    }
}
