package io.malicki.retrycommander.kafka.hook;

import io.malicki.retrycommander.kafka.retry.RetryMetadata;
import io.malicki.retrycommander.kafka.retry.RetryableMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.Set;

@Slf4j
public class LoggingRetryHook implements RetryHook {

    @Override
    public Set<HookPoint> hookPoints() {
        return EnumSet.allOf(HookPoint.class);
    }

    @Override
    public void beforeRetry(RetryableMessage message) {
        RetryMetadata m = message.getMetadata();
        log.info("🔄 Before retry | Topic: {} | Partition: {} | Offset: {} | Attempt: {}",
                m.getOriginalTopic(), m.getOriginalPartition(), m.getOriginalOffset(), m.getRetryCount() + 1);
    }

    @Override
    public void afterRetry(RetryableMessage message, boolean success) {
        RetryMetadata m = message.getMetadata();
        log.info("🔄 After retry | Topic: {} | Attempt: {} | Success: {} | Error: {}",
                m.getOriginalTopic(), m.getRetryCount() + 1, success, m.getError());
    }

    @Override
    public void beforeDlq(RetryableMessage message) {
        RetryMetadata m = message.getMetadata();
        log.warn("📮 Before DLQ | Topic: {} | Retries: {} | Error: {}",
                m.getOriginalTopic(), m.getRetryCount(), m.getError());
    }

    @Override
    public void afterDlq(RetryableMessage message) {
        log.warn("📮 After DLQ | Topic: {} | Key: {}",
                message.getMetadata().getOriginalTopic(), message.getKey());
    }
}
