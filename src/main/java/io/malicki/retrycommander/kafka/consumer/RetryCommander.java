package io.malicki.retrycommander.kafka.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.malicki.retrycommander.exception.ProvisioningException;
import io.malicki.retrycommander.kafka.errorhandling.RetryErrorHandler;
import io.malicki.retrycommander.kafka.hook.RetryHook;
import io.malicki.retrycommander.kafka.metrics.RetryMetrics;
import io.malicki.retrycommander.kafka.retry.DlqHandler;
import io.malicki.retrycommander.kafka.retry.MessageHandler;
import io.malicki.retrycommander.kafka.retry.RetryConfig;
import io.malicki.retrycommander.kafka.retry.RetryOrchestrator;
import io.malicki.retrycommander.kafka.routing.RecordPublisher;
import io.malicki.retrycommander.kafka.routing.RetryRouter;
import io.malicki.retrycommander.kafka.scheduler.DelayScheduler;
import io.malicki.retrycommander.kafka.topology.TopicTopologyManager;
import io.malicki.retrycommander.kafka.validation.PayloadValidator;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.common.TopicPartition;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.listener.ContainerProperties;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point of the retry layer: registers handlers, provisions the topic sets of the
 * configured topics and consumes them through a spring-kafka listener container.
 * <p>
 * The {@link TopicTopologyManager} is derived from the {@link RetryConfig}, so provisioning
 * and routing always agree on topic names and retry depth.
 * <p>
 * Lifecycle: {@code CREATED -> CONNECTED -> RUNNING -> STOPPING -> STOPPED}.
 * {@code setMessageHandler}, {@code setDlqHandler}, {@code addHook}, {@code setMetrics},
 * {@code setValidator} and {@code setErrorHandler} are only accepted before {@link #start()};
 * afterwards they throw {@link IllegalStateException}.
 */
@Slf4j
public class RetryCommander {

    static final String CONTAINER_NAME = "retry-commander";

    private final RetryConfig baseConfig;
    private final List<String> topics;
    private final TopicTopologyManager topology;
    private final ConcurrentKafkaListenerContainerFactory<String, String> containerFactory;
    private final RetryRouter router;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final AtomicReference<LifecycleState> state = new AtomicReference<>(LifecycleState.CREATED);

    private final List<RetryHook> hooks = new ArrayList<>();
    private volatile MessageHandler messageHandler;
    private volatile DlqHandler dlqHandler;
    private volatile RetryMetrics metrics;
    private volatile PayloadValidator validator;
    private volatile RetryErrorHandler errorHandler;

    private ConcurrentMessageListenerContainer<String, String> container;
    private DelayScheduler scheduler;

    public RetryCommander(RetryConfig config,
                          List<String> topics,
                          Admin admin,
                          ConcurrentKafkaListenerContainerFactory<String, String> containerFactory,
                          RecordPublisher publisher,
                          ObjectMapper objectMapper,
                          Clock clock) {
        config.validate();
        if (topics == null || topics.isEmpty()) {
            throw new IllegalArgumentException("At least one topic is required");
        }
        this.baseConfig = config;
        this.topics = List.copyOf(topics);
        this.topology = new TopicTopologyManager(admin, config);
        this.containerFactory = containerFactory;
        this.router = new RetryRouter(publisher);
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.hooks.addAll(config.getHooks());
        this.metrics = config.getMetrics();
        this.validator = config.getValidator();
    }

    public void setMessageHandler(MessageHandler handler) {
        ensureRegistrationOpen("setMessageHandler");
        this.messageHandler = handler;
    }

    public void setDlqHandler(DlqHandler handler) {
        ensureRegistrationOpen("setDlqHandler");
        this.dlqHandler = handler;
    }

    public synchronized void addHook(RetryHook hook) {
        ensureRegistrationOpen("addHook");
        this.hooks.add(hook);
    }

    public void setMetrics(RetryMetrics metrics) {
        ensureRegistrationOpen("setMetrics");
        this.metrics = metrics;
    }

    public void setValidator(PayloadValidator validator) {
        ensureRegistrationOpen("setValidator");
        this.validator = validator;
    }

    public void setErrorHandler(RetryErrorHandler errorHandler) {
        ensureRegistrationOpen("setErrorHandler");
        this.errorHandler = errorHandler;
    }

    /**
     * Provisions the topic set of every configured topic and creates the container subscribed to all of them.
     *
     * @throws ProvisioningException if the broker rejects a topic; the commander stays {@code CREATED}
     */
    public synchronized void connect() {
        if (state.get() != LifecycleState.CREATED) {
            throw new IllegalStateException("connect() requires state CREATED, was " + state.get());
        }

        try {
            for (String topic : topics) {
                topology.provision(topology.topologyFor(topic));
            }
        } catch (ProvisioningException e) {
            log.error("❌ Failed to provision topics: {}", e.getMessage());
            throw e;
        }

        List<String> subscription = topology.subscriptionTopics(topics);
        this.container = containerFactory.createContainer(subscription.toArray(new String[0]));
        container.setBeanName(CONTAINER_NAME);
        ContainerProperties containerProperties = container.getContainerProperties();
        containerProperties.setAckMode(ContainerProperties.AckMode.MANUAL);
        containerProperties.setConsumerRebalanceListener(rebalanceListener());
        this.scheduler = new DelayScheduler(new ContainerPartitionPauser(container), clock);

        if (!state.compareAndSet(LifecycleState.CREATED, LifecycleState.CONNECTED)) {
            log.warn("Shutdown requested while connecting");
            return;
        }
        log.info("✅ Successfully connected to Kafka | Topics: {}", subscription);
    }

    /** Starts the listener container. */
    public synchronized void start() {
        if (!state.compareAndSet(LifecycleState.CONNECTED, LifecycleState.RUNNING)) {
            throw new IllegalStateException("start() requires state CONNECTED, was " + state.get());
        }

        RetryConfig config = baseConfig.toBuilder()
            .clearHooks()
            .hooks(hooks)
            .metrics(metrics)
            .validator(validator)
            .build();

        RetryOrchestrator orchestrator = RetryOrchestrator.builder()
            .config(config)
            .logicalTopics(topics)
            .topology(topology)
            .router(router)
            .scheduler(scheduler)
            .objectMapper(objectMapper)
            .clock(clock)
            .messageHandler(messageHandler)
            .dlqHandler(dlqHandler)
            .errorHandler(errorHandler)
            .build();

        container.setupMessageListener(new RetryRecordListener(orchestrator, errorHandler));
        container.start();

        log.info("Consumer started successfully | Hooks: {} | Max retries: {}", hooks.size(), config.getMaxRetries());
    }

    /**
     * Stops consuming. Pending resumes are cancelled, then the container is stopped: the record
     * in flight completes and acknowledged offsets are committed before the consumer closes.
     * Idempotent; concurrent callers return without stopping twice.
     */
    public void shutdown() {
        LifecycleState previous;
        do {
            previous = state.get();
            if (previous == LifecycleState.STOPPING || previous == LifecycleState.STOPPED) {
                return;
            }
        } while (!state.compareAndSet(previous, LifecycleState.STOPPING));

        log.info("Initiating graceful shutdown");
        synchronized (this) {
            try {
                if (scheduler != null) {
                    scheduler.shutdown();
                }
                if (container != null) {
                    container.stop();
                }
                log.info("Successfully disconnected from Kafka");
            } catch (RuntimeException e) {
                log.error("Error during shutdown", e);
                throw e;
            } finally {
                state.set(LifecycleState.STOPPED);
            }
        }
    }

    public LifecycleState getState() {
        return state.get();
    }

    public List<String> getTopics() {
        return topics;
    }

    public TopicTopologyManager getTopology() {
        return topology;
    }

    public RetryRouter getRouter() {
        return router;
    }

    public RetryMetrics getMetrics() {
        return metrics;
    }

    public Map<TopicPartition, Long> pendingResumes() {
        return scheduler == null ? Map.of() : scheduler.pendingResumes();
    }

    private static ConsumerRebalanceListener rebalanceListener() {
        return new ConsumerRebalanceListener() {
            @Override
            public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
                log.info("Partitions revoked: {}", partitions);
            }

            @Override
            public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
                log.info("Partitions assigned: {}", partitions);
            }
        };
    }

    private void ensureRegistrationOpen(String operation) {
        LifecycleState current = state.get();
        if (!current.acceptsRegistration()) {
            throw new IllegalStateException(operation + "() must be called before start(), state is " + current);
        }
    }
}
