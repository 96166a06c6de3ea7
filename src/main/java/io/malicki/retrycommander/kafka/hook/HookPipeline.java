package io.malicki.retrycommander.kafka.hook;

import io.malicki.retrycommander.exception.HookException;
import io.malicki.retrycommander.kafka.retry.RetryableMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Runs hooks for one transition in registration order, one after the other.
 * The first hook that throws stops the chain.
 */
@Slf4j
public class HookPipeline {

    private final List<RetryHook> hooks;

    public HookPipeline(List<RetryHook> hooks) {
        this.hooks = List.copyOf(hooks);
    }

    public void beforeRetry(RetryableMessage message) {
        run(HookPoint.BEFORE_RETRY, message, false);
    }

    public void afterRetry(RetryableMessage message, boolean success) {
        run(HookPoint.AFTER_RETRY, message, success);
    }

    public void beforeDlq(RetryableMessage message) {
        run(HookPoint.BEFORE_DLQ, message, false);
    }

    public void afterDlq(RetryableMessage message) {
        run(HookPoint.AFTER_DLQ, message, false);
    }

    private void run(HookPoint point, RetryableMessage message, boolean success) {
        for (RetryHook hook : hooks) {
            if (!hook.hookPoints().contains(point)) {
                continue;
            }
            try {
                switch (point) {
                    case BEFORE_RETRY:
                        hook.beforeRetry(message);
                        break;
                    case AFTER_RETRY:
                        hook.afterRetry(message, success);
                        break;
                    case BEFORE_DLQ:
                        hook.beforeDlq(message);
                        break;
                    case AFTER_DLQ:
                        hook.afterDlq(message);
                        break;
                }
            } catch (Exception e) {
                log.error("🪝 Hook {} failed in {} | Topic: {} | Error: {}",
                        hook.name(), point, message.getMetadata().getOriginalTopic(), e.getMessage());
                throw new HookException(point, hook.name(), e);
            }
        }
    }
}
