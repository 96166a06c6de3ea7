package io.malicki.retrycommander.kafka.topology;

import io.malicki.retrycommander.exception.ProvisioningException;
import io.malicki.retrycommander.kafka.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;
import org.springframework.kafka.config.TopicBuilder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Computes and provisions the main / retry / dead-letter topics of each logical topic.
 * <p>
 * {@link #topologyFor(String)} is the only place topic names are derived. Provisioning,
 * teardown, subscription and record routing all go through it. Naming, retry depth and
 * topic parameters come from the same {@link RetryConfig} the orchestrator runs with.
 */
@Slf4j
public class TopicTopologyManager {

    private static final long ADMIN_TIMEOUT_SECONDS = 30;

    private final Admin admin;
    private final TopicNamingStrategy naming;
    private final int maxRetries;
    private final TopicProvisioning provisioning;

    public TopicTopologyManager(Admin admin, RetryConfig config) {
        config.validate();
        this.admin = admin;
        this.naming = config.getNaming();
        this.maxRetries = config.getMaxRetries();
        this.provisioning = config.getProvisioning();
    }

    /** Whether topic names and retry depth of this topology are the ones {@code config} routes with. */
    public boolean isBuiltFrom(RetryConfig config) {
        return naming == config.getNaming() && maxRetries == config.getMaxRetries();
    }

    public TopicSet topologyFor(String topic) {
        List<String> retry = new ArrayList<>(maxRetries);
        for (int level = 1; level <= maxRetries; level++) {
            retry.add(naming.retryTopic(topic, level));
        }
        return new TopicSet(topic, retry, naming.dlqTopic(topic));
    }

    /** Every topic (main, retry and DLQ) a consumer of the given logical topics must subscribe to. */
    public List<String> subscriptionTopics(Collection<String> logicalTopics) {
        List<String> topics = new ArrayList<>();
        for (String topic : logicalTopics) {
            for (String name : topologyFor(topic).allTopics()) {
                if (!topics.contains(name)) {
                    topics.add(name);
                }
            }
        }
        return topics;
    }

    public boolean isDeadLetterTopic(String topic, Collection<String> logicalTopics) {
        return logicalTopics.stream().anyMatch(t -> topologyFor(t).getDlq().equals(topic));
    }

    /**
     * Creates all topics of the set. Topics that already exist count as created.
     *
     * @throws ProvisioningException if the broker rejects at least one topic; nothing is rolled back
     */
    public void provision(TopicSet topicSet) {
        List<NewTopic> newTopics = newTopics(topicSet);

        log.info("🛠️ Provisioning topics for {} | Topics: {} | Partitions: {} | Replicas: {}",
                topicSet.getMain(),
                topicSet.allTopics(),
                provisioning.getPartitions(),
                provisioning.getReplicationFactor());

        Map<String, KafkaFuture<Void>> results = admin.createTopics(newTopics).values();

        List<String> created = new ArrayList<>();
        Map<String, Throwable> failed = new LinkedHashMap<>();
        results.forEach((name, future) -> {
            Throwable error = await(future);
            if (error == null) {
                created.add(name);
                log.debug("✅ Created topic {}", name);
            } else if (error instanceof TopicExistsException) {
                created.add(name);
                log.debug("Topic {} already exists", name);
            } else {
                failed.put(name, error);
                log.error("❌ Failed to create topic {}: {}", name, error.getMessage());
            }
        });

        if (!failed.isEmpty()) {
            throw new ProvisioningException("create", created, failed);
        }
    }

    /**
     * Deletes the full topic set of a logical topic. Administrative use only.
     *
     * @throws ProvisioningException if the broker rejects deleting at least one topic
     */
    public void teardown(String topic) {
        TopicSet topicSet = topologyFor(topic);
        List<String> names = topicSet.allTopics();

        log.warn("🗑️ Deleting topic set of {} | Topics: {}", topic, names);

        Map<String, KafkaFuture<Void>> results = admin.deleteTopics(names).topicNameValues();

        List<String> deleted = new ArrayList<>();
        Map<String, Throwable> failed = new LinkedHashMap<>();
        results.forEach((name, future) -> {
            Throwable error = await(future);
            if (error == null || error instanceof UnknownTopicOrPartitionException) {
                deleted.add(name);
            } else {
                failed.put(name, error);
                log.error("❌ Failed to delete topic {}: {}", name, error.getMessage());
            }
        });

        if (!failed.isEmpty()) {
            throw new ProvisioningException("delete", deleted, failed);
        }
    }

    List<NewTopic> newTopics(TopicSet topicSet) {
        List<NewTopic> topics = new ArrayList<>();
        for (String name : topicSet.allTopics()) {
            TopicBuilder builder = TopicBuilder.name(name)
                .partitions(provisioning.getPartitions())
                .replicas(provisioning.getReplicationFactor());

            if (name.equals(topicSet.getDlq()) && !name.equals(topicSet.getMain())) {
                if (provisioning.getDlqRetentionMs() != null) {
                    builder.config(TopicProvisioning.RETENTION_MS, provisioning.getDlqRetentionMs().toString());
                }
            } else if (topicSet.isRetryTopic(name) && !name.equals(topicSet.getMain())) {
                if (provisioning.getRetryRetentionMs() != null) {
                    builder.config(TopicProvisioning.RETENTION_MS, provisioning.getRetryRetentionMs().toString());
                }
            }
            topics.add(builder.build());
        }
        return topics;
    }

    private static Throwable await(KafkaFuture<Void> future) {
        try {
            future.get(ADMIN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            return null;
        } catch (ExecutionException e) {
            return e.getCause() != null ? e.getCause() : e;
        } catch (TimeoutException e) {
            return e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return e;
        }
    }
}
