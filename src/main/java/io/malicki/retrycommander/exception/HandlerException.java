package io.malicki.retrycommander.exception;

import io.malicki.retrycommander.kafka.errorhandling.ErrorCategory;
import lombok.Getter;

@Getter
public class HandlerException extends RetryCommanderException {

    private final String topic;

    public HandlerException(String topic, Throwable cause) {
        super(ErrorCategory.HANDLER, describe(cause), cause);
        this.topic = topic;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    }
}
