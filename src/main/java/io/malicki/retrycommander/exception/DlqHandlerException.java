package io.malicki.retrycommander.exception;

import io.malicki.retrycommander.kafka.errorhandling.ErrorCategory;
import lombok.Getter;

@Getter
public class DlqHandlerException extends RetryCommanderException {

    private final String dlqTopic;

    public DlqHandlerException(String dlqTopic, Throwable cause) {
        super(ErrorCategory.DLQ_HANDLER, "DLQ handler failed on " + dlqTopic + ": " + cause.getMessage(), cause);
        this.dlqTopic = dlqTopic;
    }
}
