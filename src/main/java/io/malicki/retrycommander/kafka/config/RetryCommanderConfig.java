package io.malicki.retrycommander.kafka.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.malicki.retrycommander.kafka.consumer.RetryCommander;
import io.malicki.retrycommander.kafka.consumer.RetryCommanderLifecycle;
import io.malicki.retrycommander.kafka.errorhandling.LoggingRetryErrorHandler;
import io.malicki.retrycommander.kafka.errorhandling.RetryErrorHandler;
import io.malicki.retrycommander.kafka.hook.LoggingRetryHook;
import io.malicki.retrycommander.kafka.hook.RetryHook;
import io.malicki.retrycommander.kafka.metrics.MetricsCollector;
import io.malicki.retrycommander.kafka.metrics.MicrometerRetryMetrics;
import io.malicki.retrycommander.kafka.metrics.RetryMetrics;
import io.malicki.retrycommander.kafka.retry.DlqHandler;
import io.malicki.retrycommander.kafka.retry.MessageHandler;
import io.malicki.retrycommander.kafka.retry.RetryConfig;
import io.malicki.retrycommander.kafka.routing.KafkaTemplateRecordPublisher;
import io.malicki.retrycommander.kafka.routing.RecordPublisher;
import io.malicki.retrycommander.kafka.topology.TopicNamingStrategy;
import io.malicki.retrycommander.kafka.topology.TopicProvisioning;
import io.malicki.retrycommander.kafka.validation.PayloadValidator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.Admin;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Wires the retry layer from {@link RetryCommanderProperties}.
 * <p>
 * Applications contribute behaviour by declaring beans: a {@link MessageHandler},
 * a {@link DlqHandler}, any number of {@link RetryHook}s (run in {@code @Order}),
 * an optional {@link PayloadValidator} and a custom {@link RetryErrorHandler}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RetryCommanderProperties.class)
public class RetryCommanderConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock retryClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryMetrics retryMetrics(RetryCommanderProperties properties,
                                     ObjectProvider<MeterRegistry> meterRegistry) {
        RetryCommanderProperties.Metrics metrics = properties.getMetrics();
        if (metrics.isEnabled() && metrics.getBackend() == RetryCommanderProperties.Backend.MICROMETER) {
            MeterRegistry registry = meterRegistry.getIfAvailable(SimpleMeterRegistry::new);
            log.info("📊 Retry metrics exported through Micrometer | Registry: {}", registry.getClass().getSimpleName());
            return new MicrometerRetryMetrics(registry, metrics.getPrefix(), metrics.getLabels());
        }
        return new MetricsCollector(metrics.isEnabled(), metrics.getPrefix(), metrics.getLabels());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryErrorHandler retryErrorHandler() {
        return new LoggingRetryErrorHandler();
    }

    @Bean
    public RecordPublisher recordPublisher(KafkaTemplate<String, String> retryKafkaTemplate,
                                           RetryCommanderProperties properties) {
        return new KafkaTemplateRecordPublisher(retryKafkaTemplate, properties.getSendTimeout());
    }

    @Bean
    public RetryConfig retryConfig(RetryCommanderProperties properties,
                                   TopicNamingStrategy topicNamingStrategy,
                                   TopicProvisioning topicProvisioning,
                                   ObjectProvider<RetryHook> hooks,
                                   ObjectProvider<PayloadValidator> validator,
                                   RetryMetrics retryMetrics) {
        RetryCommanderProperties.Retry retry = properties.getRetry();

        List<RetryHook> orderedHooks = hooks.orderedStream().collect(Collectors.toCollection(ArrayList::new));
        if (properties.isLoggingHook()) {
            orderedHooks.add(0, new LoggingRetryHook());
        }

        RetryConfig config = RetryConfig.builder()
            .maxRetries(retry.getMaxRetries())
            .initialDelay(retry.getInitialDelay())
            .backoffFactor(retry.getBackoffFactor())
            .maxDelay(retry.getMaxDelay())
            .naming(topicNamingStrategy)
            .provisioning(topicProvisioning)
            .hooks(orderedHooks)
            .validator(validator.getIfAvailable())
            .metrics(retryMetrics)
            .build();
        config.validate();
        return config;
    }

    @Bean
    public RetryCommander retryCommander(RetryConfig retryConfig,
                                         RetryCommanderProperties properties,
                                         Admin retryAdminClient,
                                         ConcurrentKafkaListenerContainerFactory<String, String> kafkaListenerContainerFactory,
                                         RecordPublisher recordPublisher,
                                         ObjectProvider<ObjectMapper> objectMapper,
                                         Clock retryClock,
                                         ObjectProvider<MessageHandler> messageHandler,
                                         ObjectProvider<DlqHandler> dlqHandler,
                                         RetryErrorHandler retryErrorHandler) {
        RetryCommander commander = new RetryCommander(
            retryConfig,
            properties.getTopics(),
            retryAdminClient,
            kafkaListenerContainerFactory,
            recordPublisher,
            objectMapper.getIfAvailable(ObjectMapper::new),
            retryClock);

        messageHandler.ifAvailable(commander::setMessageHandler);
        dlqHandler.ifAvailable(commander::setDlqHandler);
        commander.setErrorHandler(retryErrorHandler);
        return commander;
    }

    @Bean
    public RetryCommanderLifecycle retryCommanderLifecycle(RetryCommander retryCommander,
                                                           RetryCommanderProperties properties) {
        return new RetryCommanderLifecycle(retryCommander, properties.isAutoStartup());
    }
}
