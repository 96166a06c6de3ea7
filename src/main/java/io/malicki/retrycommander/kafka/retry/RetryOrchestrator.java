package io.malicki.retrycommander.kafka.retry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.malicki.retrycommander.exception.DlqHandlerException;
import io.malicki.retrycommander.exception.HandlerException;
import io.malicki.retrycommander.exception.HookException;
import io.malicki.retrycommander.exception.PublishException;
import io.malicki.retrycommander.exception.ValidationException;
import io.malicki.retrycommander.kafka.errorhandling.RetryErrorHandler;
import io.malicki.retrycommander.kafka.hook.HookPipeline;
import io.malicki.retrycommander.kafka.metrics.SafeRetryMetrics;
import io.malicki.retrycommander.kafka.routing.RetryRouter;
import io.malicki.retrycommander.kafka.scheduler.DelayScheduler;
import io.malicki.retrycommander.kafka.topology.TopicSet;
import io.malicki.retrycommander.kafka.topology.TopicTopologyManager;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Decides what happens to each consumed record.
 * <p>
 * Main and retry-topic records go through the due-time gate, validation and the message
 * handler. A failure republishes the record to the next retry topic with exponential
 * backoff, or to the dead-letter topic once {@code maxRetries} is reached. Dead-letter
 * records go to the {@link DlqHandler}.
 * <p>
 * Stateless between records; safe to call from several partition threads.
 */
@Slf4j
public class RetryOrchestrator {

    private final RetryConfig config;
    private final List<String> logicalTopics;
    private final TopicTopologyManager topology;
    private final RetryRouter router;
    private final DelayScheduler scheduler;
    private final HookPipeline hooks;
    private final SafeRetryMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final MessageHandler messageHandler;
    private final DlqHandler dlqHandler;
    private final RetryErrorHandler errorHandler;

    @Builder
    public RetryOrchestrator(RetryConfig config,
                             List<String> logicalTopics,
                             TopicTopologyManager topology,
                             RetryRouter router,
                             DelayScheduler scheduler,
                             ObjectMapper objectMapper,
                             Clock clock,
                             MessageHandler messageHandler,
                             DlqHandler dlqHandler,
                             RetryErrorHandler errorHandler) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.logicalTopics = List.copyOf(logicalTopics);
        this.topology = Objects.requireNonNull(topology, "topology");
        if (!topology.isBuiltFrom(config)) {
            throw new IllegalArgumentException("Topology was built from a different naming strategy or maxRetries than the retry config");
        }
        this.router = Objects.requireNonNull(router, "router");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.hooks = new HookPipeline(config.getHooks());
        this.metrics = new SafeRetryMetrics(config.getMetrics());
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.messageHandler = messageHandler;
        this.dlqHandler = dlqHandler;
        this.errorHandler = errorHandler;
    }

    /**
     * Processes one record to a terminal outcome.
     *
     * @throws DlqHandlerException if the record came from a dead-letter topic and the DLQ handler threw
     * @throws HookException       if a DLQ hook threw while handling a dead-letter record
     */
    public DispatchOutcome dispatch(ConsumerRecord<String, String> record) {
        if (topology.isDeadLetterTopic(record.topic(), logicalTopics)) {
            return dispatchDeadLetter(record);
        }
        return dispatchMain(record);
    }

    private DispatchOutcome dispatchMain(ConsumerRecord<String, String> record) {
        RetryMetadata metadata = RetryMetadata.fromRecord(record);
        long now = clock.millis();

        if (metadata.getRetryCount() > 0 && metadata.getNextRetryTimestamp() > now) {
            log.debug("⏳ Retry not due | Topic: {} | Partition: {} | Offset: {} | Due in: {}ms",
                    record.topic(), record.partition(), record.offset(), metadata.getNextRetryTimestamp() - now);
            scheduler.holdUntil(new TopicPartition(record.topic(), record.partition()), metadata.getNextRetryTimestamp());
            return DispatchOutcome.DEFERRED;
        }

        if (metadata.getRetryCount() > 0 && metadata.getNextRetryTimestamp() > 0) {
            metrics.recordRetryLatency(metadata.getOriginalTopic(), now - metadata.getNextRetryTimestamp());
        }

        log.debug("Processing message | Topic: {} | Partition: {} | Offset: {} | Attempt: {}",
                record.topic(), record.partition(), record.offset(), metadata.getRetryCount() + 1);

        JsonNode payload = null;
        RuntimeException failure = null;
        try {
            payload = decode(record.value());
            if (config.getValidator() != null) {
                config.getValidator().validate(payload);
            }
            if (messageHandler != null) {
                messageHandler.handle(payload);
            }
        } catch (ValidationException e) {
            failure = e;
        } catch (Exception e) {
            failure = new HandlerException(record.topic(), e);
        } finally {
            metrics.recordProcessingTime(record.topic(), clock.millis() - now);
        }

        if (failure == null) {
            return DispatchOutcome.DONE;
        }

        RetryableMessage message = new RetryableMessage(record.key(), payload, record.value(),
            RetryMetadata.headersOf(record.headers()), metadata);
        return onFailure(record, message, failure);
    }

    private DispatchOutcome onFailure(ConsumerRecord<String, String> record, RetryableMessage message, RuntimeException failure) {
        RetryMetadata metadata = message.getMetadata();
        String originalTopic = metadata.getOriginalTopic();
        TopicSet topicSet = topology.topologyFor(originalTopic);
        int retryCount = metadata.getRetryCount();
        int nextLevel = retryCount + 1;
        long now = clock.millis();

        RetryableMessage failed = message.withFailure(failure.getMessage(), null);
        HookRun hookRun = new HookRun();
        DispatchOutcome outcome;

        try {
            if (nextLevel > config.getMaxRetries()) {
                log.warn("⚠️ Sending to DLQ | Topic: {} | Offset: {} | Retries: {}/{} | Reason: {}",
                        originalTopic, record.offset(), retryCount, config.getMaxRetries(), failure.getMessage());

                hookRun.run(() -> hooks.beforeDlq(failed));
                router.sendToDeadLetterTopic(record, topicSet.getDlq(), originalTopic,
                        Math.min(retryCount, config.getMaxRetries()), failure, now);
                metrics.incrementDLQCount(originalTopic);
                hookRun.run(() -> hooks.afterDlq(failed));
                outcome = DispatchOutcome.ROUTED_TO_DLQ;
            } else {
                long delay = config.delayFor(retryCount);
                long nextRetry = saturatedAdd(now, delay);

                log.info("🔄 Will retry | Topic: {} | Offset: {} | Attempt: {}/{} | Delay: {}ms",
                        originalTopic, record.offset(), nextLevel, config.getMaxRetries(), delay);

                hookRun.run(() -> hooks.beforeRetry(failed));
                router.sendToRetryTopic(record, topicSet.retryTopic(nextLevel), originalTopic, nextLevel, nextRetry, failure, now);
                metrics.incrementRetryCount(originalTopic);
                hookRun.run(() -> hooks.afterRetry(failed, false));
                outcome = DispatchOutcome.RESCHEDULED;
            }
        } catch (PublishException e) {
            log.error("💥 Failed to republish message, it will be consumed again | Topic: {} | Offset: {} | Error: {}",
                    record.topic(), record.offset(), e.getMessage());
            e.addSuppressed(failure);
            hookRun.attachTo(e);
            report(e, record);
            return DispatchOutcome.FAILED;
        } catch (RuntimeException e) {
            log.error("💥 Unexpected error while routing failed message, it will be consumed again | Topic: {} | Offset: {} | Error: {}",
                    record.topic(), record.offset(), e.getMessage(), e);
            e.addSuppressed(failure);
            hookRun.attachTo(e);
            report(e, record);
            return DispatchOutcome.FAILED;
        }

        hookRun.attachTo(failure);
        report(failure, record);
        return outcome;
    }

    private DispatchOutcome dispatchDeadLetter(ConsumerRecord<String, String> record) {
        if (dlqHandler == null) {
            log.warn("DLQ handler not set, skipping DLQ message | Topic: {} | Offset: {}", record.topic(), record.offset());
            return DispatchOutcome.SKIPPED;
        }

        RetryableMessage message = new RetryableMessage(record.key(), decodeLenient(record), record.value(),
            RetryMetadata.headersOf(record.headers()), RetryMetadata.fromRecord(record));

        log.info("📮 [DLQ] Processing dead-lettered message | Topic: {} | Offset: {} | Original Topic: {} | Retries: {}",
                record.topic(), record.offset(), message.getMetadata().getOriginalTopic(), message.getMetadata().getRetryCount());

        hooks.beforeDlq(message);
        try {
            dlqHandler.handle(message);
        } catch (Exception e) {
            log.error("❌ [DLQ] Handler failed | Topic: {} | Offset: {} | Error: {}",
                    record.topic(), record.offset(), e.getMessage());
            throw new DlqHandlerException(record.topic(), e);
        }
        hooks.afterDlq(message);
        return DispatchOutcome.DONE;
    }

    private JsonNode decode(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readTree(value);
        } catch (JsonProcessingException e) {
            throw new ValidationException("payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode decodeLenient(ConsumerRecord<String, String> record) {
        try {
            return decode(record.value());
        } catch (ValidationException e) {
            log.debug("DLQ payload at {}-{}@{} is not JSON, passing raw value only",
                    record.topic(), record.partition(), record.offset());
            return null;
        }
    }

    private void report(Throwable error, ConsumerRecord<?, ?> record) {
        if (errorHandler == null) {
            return;
        }
        try {
            errorHandler.handleError(error, record);
        } catch (RuntimeException e) {
            log.error("❌ Error handler threw while reporting {} | Topic: {} | Offset: {}",
                    error.getClass().getSimpleName(), record.topic(), record.offset(), e);
        }
    }

    private static long saturatedAdd(long a, long b) {
        long sum = a + b;
        return ((a ^ sum) & (b ^ sum)) < 0 ? Long.MAX_VALUE : sum;
    }

    /**
     * Hook calls of one transition. After the first failure the remaining hooks of the
     * transition are skipped; routing goes ahead regardless.
     */
    private static final class HookRun {
        private HookException error;

        void run(Runnable step) {
            if (error != null) {
                return;
            }
            try {
                step.run();
            } catch (HookException e) {
                error = e;
            }
        }

        void attachTo(Throwable failure) {
            if (error != null) {
                failure.addSuppressed(error);
            }
        }
    }
}
