package io.malicki.retrycommander.kafka.routing;

import io.malicki.retrycommander.exception.PublishException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class KafkaTemplateRecordPublisherTest {

    @SuppressWarnings("unchecked")
    private final KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);
    private final KafkaTemplateRecordPublisher publisher = new KafkaTemplateRecordPublisher(kafkaTemplate, Duration.ofMillis(200));
    private final ProducerRecord<String, String> record = new ProducerRecord<>("orders.retry.1", "k1", "{}");

    @Test
    void waitsForAcknowledgement() {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition("orders.retry.1", 0), 41, 0, 0L, 2, 2);
        when(kafkaTemplate.send(record)).thenReturn(CompletableFuture.completedFuture(new SendResult<>(record, metadata)));

        assertThatCode(() -> publisher.publish(record)).doesNotThrowAnyException();
    }

    @Test
    void brokerRejectionBecomesPublishException() {
        when(kafkaTemplate.send(record)).thenReturn(CompletableFuture.failedFuture(new RecordTooLargeException("too big")));

        assertThatThrownBy(() -> publisher.publish(record))
            .isInstanceOf(PublishException.class)
            .hasMessageContaining("orders.retry.1")
            .hasCauseInstanceOf(RecordTooLargeException.class);
    }

    @Test
    void missingAcknowledgementTimesOut() {
        when(kafkaTemplate.send(record)).thenReturn(new CompletableFuture<>());

        assertThatThrownBy(() -> publisher.publish(record))
            .isInstanceOf(PublishException.class)
            .extracting("destinationTopic").isEqualTo("orders.retry.1");
    }
}
