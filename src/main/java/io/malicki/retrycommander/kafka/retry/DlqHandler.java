package io.malicki.retrycommander.kafka.retry;

@FunctionalInterface
public interface DlqHandler {

    void handle(RetryableMessage message) throws Exception;
}
