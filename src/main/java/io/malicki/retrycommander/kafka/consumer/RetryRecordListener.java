package io.malicki.retrycommander.kafka.consumer;

import io.malicki.retrycommander.kafka.errorhandling.RetryErrorHandler;
import io.malicki.retrycommander.kafka.retry.DispatchOutcome;
import io.malicki.retrycommander.kafka.retry.RetryOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.listener.AcknowledgingMessageListener;
import org.springframework.kafka.support.Acknowledgment;

import java.time.Duration;

/**
 * Hands every record of the subscribed topic sets to the {@link RetryOrchestrator}.
 * <p>
 * Runs with {@code AckMode.MANUAL}: a record that reached a terminal outcome is acknowledged,
 * one that has to be consumed again (not due, or routing failed) is nacked, which rewinds
 * its partition to it and drops the rest of the poll.
 */
@Slf4j
class RetryRecordListener implements AcknowledgingMessageListener<String, String> {

    private final RetryOrchestrator orchestrator;
    private final RetryErrorHandler errorHandler;

    RetryRecordListener(RetryOrchestrator orchestrator, RetryErrorHandler errorHandler) {
        this.orchestrator = orchestrator;
        this.errorHandler = errorHandler;
    }

    @Override
    public void onMessage(ConsumerRecord<String, String> record, Acknowledgment ack) {
        DispatchOutcome outcome;
        try {
            outcome = orchestrator.dispatch(record);
        } catch (RuntimeException e) {
            report(e, record);
            outcome = DispatchOutcome.DONE;
        }

        if (outcome.isRedeliver()) {
            log.debug("Rewinding {}-{} to offset {} ({})", record.topic(), record.partition(), record.offset(), outcome);
            ack.nack(Duration.ZERO);
            return;
        }
        ack.acknowledge();
    }

    private void report(RuntimeException error, ConsumerRecord<String, String> record) {
        log.error("❌ Failed to process message | Topic: {} | Partition: {} | Offset: {} | Error: {}",
                record.topic(), record.partition(), record.offset(), error.getMessage());
        if (errorHandler == null) return;
        try {
            errorHandler.handleError(error, record);
        } catch (RuntimeException e) {
            log.error("❌ Error handler threw | Topic: {} | Offset: {}", record.topic(), record.offset(), e);
        }
    }
}
