package io.malicki.retrycommander.kafka.retry;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Application logic for main-topic and retry-topic records. Throwing sends the
 * record to the next retry topic, or to the dead-letter topic once retries are exhausted.
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(JsonNode payload) throws Exception;
}
