package io.malicki.retrycommander.kafka.errorhandling;

import org.apache.kafka.clients.consumer.ConsumerRecord;

/**
 * Receives every classified failure together with the record that caused it.
 * Reporting only: the routing decision has already been made when this is called.
 */
@FunctionalInterface
public interface RetryErrorHandler {

    void handleError(Throwable error, ConsumerRecord<?, ?> record);
}
