package io.malicki.retrycommander.kafka.validation;

import com.fasterxml.jackson.databind.JsonNode;
import io.malicki.retrycommander.exception.ValidationException;

/**
 * Checks a decoded payload before it reaches the message handler.
 * A rejection takes the same retry / dead-letter path as a handler failure.
 */
@FunctionalInterface
public interface PayloadValidator {

    void validate(JsonNode payload) throws ValidationException;
}
