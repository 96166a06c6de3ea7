package io.malicki.retrycommander.exception;

import io.malicki.retrycommander.kafka.errorhandling.ErrorCategory;

public class ValidationException extends RetryCommanderException {

    public ValidationException(String message) {
        super(ErrorCategory.VALIDATION, "Schema validation failed: " + message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorCategory.VALIDATION, "Schema validation failed: " + message, cause);
    }
}
