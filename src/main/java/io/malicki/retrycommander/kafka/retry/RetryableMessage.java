package io.malicki.retrycommander.kafka.retry;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.util.Map;

/**
 * A consumed record as seen by hooks and the dead-letter handler. Lives for one dispatch.
 */
@Value
public class RetryableMessage {

    String key;
    /** Decoded payload, {@code null} when the value is empty or not valid JSON. */
    JsonNode value;
    String rawValue;
    Map<String, String> headers;
    RetryMetadata metadata;

    public RetryableMessage(String key, JsonNode value, String rawValue, Map<String, String> headers, RetryMetadata metadata) {
        this.key = key == null ? "" : key;
        this.value = value;
        this.rawValue = rawValue;
        this.headers = headers == null ? Map.of() : Map.copyOf(headers);
        this.metadata = metadata;
    }

    public RetryableMessage withFailure(String error, String errorStack) {
        return new RetryableMessage(key, value, rawValue, headers,
            metadata.withError(error).withErrorStack(errorStack));
    }
}
