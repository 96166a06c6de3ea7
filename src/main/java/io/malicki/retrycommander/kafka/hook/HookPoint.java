package io.malicki.retrycommander.kafka.hook;

public enum HookPoint {
    BEFORE_RETRY,
    AFTER_RETRY,
    BEFORE_DLQ,
    AFTER_DLQ
}
