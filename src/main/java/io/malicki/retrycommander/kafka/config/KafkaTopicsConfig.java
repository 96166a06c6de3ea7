package io.malicki.retrycommander.kafka.config;

import io.malicki.retrycommander.kafka.topology.TopicNamingStrategy;
import io.malicki.retrycommander.kafka.topology.TopicProvisioning;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaAdmin;

import java.util.HashMap;
import java.util.Map;

@Configuration
public class KafkaTopicsConfig {

    @Bean
    public KafkaAdmin kafkaAdmin(RetryCommanderProperties properties) {
        Map<String, Object> config = new HashMap<>();
        config.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, String.join(",", properties.getBrokers()));
        config.put(AdminClientConfig.CLIENT_ID_CONFIG, properties.getClientId() + "-admin");
        return new KafkaAdmin(config);
    }

    @Bean(destroyMethod = "close")
    public Admin retryAdminClient(KafkaAdmin kafkaAdmin) {
        return Admin.create(kafkaAdmin.getConfigurationProperties());
    }

    @Bean
    public TopicNamingStrategy topicNamingStrategy(RetryCommanderProperties properties) {
        RetryCommanderProperties.Topics topics = properties.getRetry().getTopics();
        return TopicNamingStrategy.of(topics.getRetry(), topics.getDlq());
    }

    @Bean
    public TopicProvisioning topicProvisioning(RetryCommanderProperties properties) {
        RetryCommanderProperties.TopicConfig topicConfig = properties.getRetry().getTopicConfig();
        return TopicProvisioning.builder()
            .partitions(topicConfig.getPartitions())
            .replicationFactor(topicConfig.getReplicationFactor())
            .retryRetentionMs(topicConfig.getRetention().getRetryTopics())
            .dlqRetentionMs(topicConfig.getRetention().getDlq())
            .build();
    }
}
