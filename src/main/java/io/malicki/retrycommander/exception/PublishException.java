package io.malicki.retrycommander.exception;

import io.malicki.retrycommander.kafka.errorhandling.ErrorCategory;
import lombok.Getter;

@Getter
public class PublishException extends RetryCommanderException {

    private final String destinationTopic;

    public PublishException(String destinationTopic, Throwable cause) {
        super(ErrorCategory.PUBLISH, "Failed to publish to " + destinationTopic + ": " + cause.getMessage(), cause);
        this.destinationTopic = destinationTopic;
    }
}
