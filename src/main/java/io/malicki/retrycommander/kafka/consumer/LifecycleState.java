package io.malicki.retrycommander.kafka.consumer;

public enum LifecycleState {
    CREATED,
    CONNECTED,
    RUNNING,
    STOPPING,
    STOPPED;

    /** Handlers, hooks and metrics can only be registered before the loop starts. */
    public boolean acceptsRegistration() {
        return this == CREATED || this == CONNECTED;
    }
}
