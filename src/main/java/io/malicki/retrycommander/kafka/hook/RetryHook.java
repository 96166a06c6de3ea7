package io.malicki.retrycommander.kafka.hook;

import io.malicki.retrycommander.kafka.retry.RetryableMessage;

import java.util.Set;

/**
 * Extension invoked around retry and dead-letter transitions.
 * <p>
 * A hook declares the callbacks it implements through {@link #hookPoints()}; the
 * pipeline only invokes those. Callbacks run on the dispatching thread and may throw,
 * which aborts the remaining hooks for that transition.
 */
public interface RetryHook {

    Set<HookPoint> hookPoints();

    default String name() {
        return getClass().getSimpleName();
    }

    default void beforeRetry(RetryableMessage message) throws Exception {
    }

    /**
     * @param success whether the attempt that triggered the transition succeeded; always
     *                {@code false} since the pipeline only runs on the failure path
     */
    default void afterRetry(RetryableMessage message, boolean success) throws Exception {
    }

    default void beforeDlq(RetryableMessage message) throws Exception {
    }

    default void afterDlq(RetryableMessage message) throws Exception {
    }
}
