package io.malicki.retrycommander.exception;

import io.malicki.retrycommander.kafka.errorhandling.ErrorCategory;
import lombok.Getter;

@Getter
public abstract class RetryCommanderException extends RuntimeException {

    private final ErrorCategory category;

    protected RetryCommanderException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    protected RetryCommanderException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }
}
