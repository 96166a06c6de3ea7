package io.malicki.retrycommander.kafka.routing;

import io.malicki.retrycommander.exception.PublishException;
import org.apache.kafka.clients.producer.ProducerRecord;

@FunctionalInterface
public interface RecordPublisher {

    /**
     * Sends the record and waits for the broker's acknowledgement.
     *
     * @throws PublishException if the send fails or times out; never retried by the caller
     */
    void publish(ProducerRecord<String, String> record) throws PublishException;
}
