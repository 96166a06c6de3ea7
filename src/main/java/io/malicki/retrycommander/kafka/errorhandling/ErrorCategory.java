package io.malicki.retrycommander.kafka.errorhandling;

public enum ErrorCategory {

    PROVISIONING(
        false,                // countsAsAttempt
        "Topic creation or deletion rejected by the broker"
    ),

    VALIDATION(
        true,
        "Payload could not be decoded or failed the configured validator"
    ),

    HANDLER(
        true,
        "Message handler threw while processing the payload"
    ),

    HOOK(
        false,
        "Retry hook threw - remaining hooks for the transition skipped"
    ),

    PUBLISH(
        false,
        "Publishing to a retry or dead-letter topic failed - record will be redelivered"
    ),

    DLQ_HANDLER(
        false,
        "Dead-letter handler threw while processing a dead-lettered message"
    );

    private final boolean countsAsAttempt;
    private final String description;

    ErrorCategory(boolean countsAsAttempt, String description) {
        this.countsAsAttempt = countsAsAttempt;
        this.description = description;
    }

    public boolean isCountsAsAttempt() { return countsAsAttempt; }
    public String getDescription() { return description; }
}
