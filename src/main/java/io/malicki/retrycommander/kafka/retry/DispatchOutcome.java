package io.malicki.retrycommander.kafka.retry;

public enum DispatchOutcome {

    /** Handler (or DLQ handler) completed. */
    DONE(false),
    /** Handler failed, record republished to the next retry topic. */
    RESCHEDULED(false),
    /** Handler failed with retries exhausted, record published to the dead-letter topic. */
    ROUTED_TO_DLQ(false),
    /** Retry not due yet; partition held, record must be consumed again. */
    DEFERRED(true),
    /** Republishing or routing the failure failed; record must be consumed again. */
    FAILED(true),
    /** Nothing to do with the record (no DLQ handler registered). */
    SKIPPED(false);

    private final boolean redeliver;

    DispatchOutcome(boolean redeliver) {
        this.redeliver = redeliver;
    }

    /** Whether the consumer has to rewind to this record instead of acknowledging it. */
    public boolean isRedeliver() {
        return redeliver;
    }
}
