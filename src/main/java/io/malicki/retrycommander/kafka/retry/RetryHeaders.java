package io.malicki.retrycommander.kafka.retry;

/**
 * Header keys carrying retry provenance. Values are UTF-8 strings.
 */
public final class RetryHeaders {

    public static final String RETRY_COUNT = "x-retry-count";
    public static final String NEXT_RETRY_TIMESTAMP = "x-next-retry-timestamp";
    public static final String ERROR_MESSAGE = "x-error-message";
    public static final String ERROR_STACK = "x-error-stack";
    public static final String ORIGINAL_TOPIC = "x-original-topic";
    public static final String LAST_RETRY = "x-last-retry";
    public static final String FAILED_AT = "x-failed-at";

    private RetryHeaders() {
    }
}
