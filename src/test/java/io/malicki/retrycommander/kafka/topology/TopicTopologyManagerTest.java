package io.malicki.retrycommander.kafka.topology;

import io.malicki.retrycommander.exception.ProvisioningException;
import io.malicki.retrycommander.kafka.hook.LoggingRetryHook;
import io.malicki.retrycommander.kafka.retry.RetryConfig;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.CreateTopicsResult;
import org.apache.kafka.clients.admin.DeleteTopicsResult;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.errors.TopicAuthorizationException;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;
import org.apache.kafka.common.internals.KafkaFutureImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TopicTopologyManagerTest {

    private Admin admin;
    private TopicTopologyManager manager;

    @BeforeEach
    void setUp() {
        admin = mock(Admin.class);
        TopicProvisioning provisioning = TopicProvisioning.builder()
            .partitions(3)
            .replicationFactor((short) 2)
            .retryRetentionMs(86_400_000L)
            .dlqRetentionMs(604_800_000L)
            .build();
        manager = new TopicTopologyManager(admin, RetryConfig.builder().maxRetries(3).provisioning(provisioning).build());
    }

    @Test
    void topologyForBuildsRetryLevelsAndDlq() {
        TopicSet set = manager.topologyFor("orders");

        assertThat(set.getMain()).isEqualTo("orders");
        assertThat(set.getRetry()).containsExactly("orders.retry.1", "orders.retry.2", "orders.retry.3");
        assertThat(set.getDlq()).isEqualTo("orders.dlq");
        assertThat(set.retryTopic(2)).isEqualTo("orders.retry.2");
        assertThat(set.maxRetries()).isEqualTo(3);
        assertThat(manager.topologyFor("orders")).isEqualTo(set);
    }

    @Test
    void subscriptionCoversEveryTopicOnce() {
        TopicTopologyManager shared = new TopicTopologyManager(admin, RetryConfig.builder()
            .maxRetries(2)
            .naming(TopicNamingStrategy.of("shared-retry", "shared-dlq"))
            .build());

        assertThat(shared.subscriptionTopics(List.of("orders", "payments")))
            .containsExactly("orders", "shared-retry", "shared-dlq", "payments");
    }

    @Test
    void recognisesDeadLetterTopics() {
        assertThat(manager.isDeadLetterTopic("orders.dlq", List.of("orders"))).isTrue();
        assertThat(manager.isDeadLetterTopic("orders.retry.1", List.of("orders"))).isFalse();
        assertThat(manager.isDeadLetterTopic("payments.dlq", List.of("orders"))).isFalse();
    }

    @Test
    @SuppressWarnings("unchecked")
    void provisionCreatesAllTopicsWithRetention() {
        Map<String, KafkaFuture<Void>> results = new LinkedHashMap<>();
        manager.topologyFor("orders").allTopics().forEach(name -> results.put(name, KafkaFuture.completedFuture(null)));
        CreateTopicsResult result = mock(CreateTopicsResult.class);
        when(result.values()).thenReturn(results);
        when(admin.createTopics(anyCollection())).thenReturn(result);

        manager.provision(manager.topologyFor("orders"));

        ArgumentCaptor<Collection<NewTopic>> captor = ArgumentCaptor.forClass(Collection.class);
        verify(admin).createTopics(captor.capture());
        Map<String, NewTopic> byName = new LinkedHashMap<>();
        captor.getValue().forEach(topic -> byName.put(topic.name(), topic));

        assertThat(byName).containsOnlyKeys("orders", "orders.retry.1", "orders.retry.2", "orders.retry.3", "orders.dlq");
        assertThat(byName.get("orders").numPartitions()).isEqualTo(3);
        assertThat(byName.get("orders").replicationFactor()).isEqualTo((short) 2);
        assertThat(byName.get("orders").configs()).doesNotContainKey(TopicProvisioning.RETENTION_MS);
        assertThat(byName.get("orders.retry.2").configs()).containsEntry(TopicProvisioning.RETENTION_MS, "86400000");
        assertThat(byName.get("orders.dlq").configs()).containsEntry(TopicProvisioning.RETENTION_MS, "604800000");
    }

    @Test
    void existingTopicsCountAsProvisioned() {
        Map<String, KafkaFuture<Void>> results = new LinkedHashMap<>();
        results.put("orders", failed(new TopicExistsException("orders exists")));
        results.put("orders.dlq", KafkaFuture.completedFuture(null));
        CreateTopicsResult result = mock(CreateTopicsResult.class);
        when(result.values()).thenReturn(results);
        when(admin.createTopics(anyCollection())).thenReturn(result);

        manager.provision(manager.topologyFor("orders"));
    }

    @Test
    void provisioningFailureReportsWhatSucceeded() {
        Map<String, KafkaFuture<Void>> results = new LinkedHashMap<>();
        results.put("orders", KafkaFuture.completedFuture(null));
        results.put("orders.retry.1", failed(new TopicAuthorizationException("denied")));
        CreateTopicsResult result = mock(CreateTopicsResult.class);
        when(result.values()).thenReturn(results);
        when(admin.createTopics(anyCollection())).thenReturn(result);

        assertThatThrownBy(() -> manager.provision(manager.topologyFor("orders")))
            .isInstanceOfSatisfying(ProvisioningException.class, e -> {
                assertThat(e.getSucceededTopics()).containsExactly("orders");
                assertThat(e.getFailedTopics()).containsOnlyKeys("orders.retry.1");
                assertThat(e.getFailedTopics().get("orders.retry.1")).isInstanceOf(TopicAuthorizationException.class);
            });
    }

    @Test
    void teardownIgnoresMissingTopics() {
        Map<String, KafkaFuture<Void>> results = new LinkedHashMap<>();
        results.put("orders", KafkaFuture.completedFuture(null));
        results.put("orders.dlq", failed(new UnknownTopicOrPartitionException("gone")));
        DeleteTopicsResult result = mock(DeleteTopicsResult.class);
        when(result.topicNameValues()).thenReturn(results);
        when(admin.deleteTopics(anyCollection())).thenReturn(result);

        manager.teardown("orders");

        verify(admin).deleteTopics(manager.topologyFor("orders").allTopics());
    }

    @Test
    void rejectsNegativeMaxRetries() {
        RetryConfig config = RetryConfig.builder().maxRetries(-1).build();

        assertThatThrownBy(() -> new TopicTopologyManager(admin, config))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void namingAndDepthComeFromRetryConfig() {
        RetryConfig config = RetryConfig.builder()
            .maxRetries(5)
            .naming(TopicNamingStrategy.of("custom-{topic}-r{n}", "custom-dlq"))
            .build();
        TopicTopologyManager custom = new TopicTopologyManager(admin, config);

        TopicSet set = custom.topologyFor("orders");

        assertThat(set.getRetry()).containsExactly(
            "custom-orders-r1", "custom-orders-r2", "custom-orders-r3", "custom-orders-r4", "custom-orders-r5");
        assertThat(set.getDlq()).isEqualTo("custom-dlq");
        assertThat(custom.isBuiltFrom(config)).isTrue();
        assertThat(custom.isBuiltFrom(config.toBuilder().hook(new LoggingRetryHook()).build())).isTrue();
        assertThat(custom.isBuiltFrom(config.toBuilder().maxRetries(3).build())).isFalse();
        assertThat(custom.isBuiltFrom(RetryConfig.builder().maxRetries(5).build())).isFalse();
    }

    private static KafkaFuture<Void> failed(Throwable error) {
        KafkaFutureImpl<Void> future = new KafkaFutureImpl<>();
        future.completeExceptionally(error);
        return future;
    }
}
