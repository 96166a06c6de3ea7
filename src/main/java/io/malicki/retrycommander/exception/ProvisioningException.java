package io.malicki.retrycommander.exception;

import io.malicki.retrycommander.kafka.errorhandling.ErrorCategory;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Raised when the broker rejects creation or deletion of one or more topics.
 * Topics that did succeed are reported but never rolled back.
 */
@Getter
public class ProvisioningException extends RetryCommanderException {

    private final List<String> succeededTopics;
    private final Map<String, Throwable> failedTopics;

    public ProvisioningException(String operation, List<String> succeededTopics, Map<String, Throwable> failedTopics) {
        super(ErrorCategory.PROVISIONING,
            "Failed to " + operation + " topics " + failedTopics.keySet() + " (succeeded: " + succeededTopics + ")",
            failedTopics.values().stream().findFirst().orElse(null));
        this.succeededTopics = List.copyOf(succeededTopics);
        this.failedTopics = Map.copyOf(failedTopics);
    }
}
