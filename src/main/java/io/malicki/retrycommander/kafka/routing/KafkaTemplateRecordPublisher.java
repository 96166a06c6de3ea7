package io.malicki.retrycommander.kafka.routing;

import io.malicki.retrycommander.exception.PublishException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
public class KafkaTemplateRecordPublisher implements RecordPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final Duration sendTimeout;

    public KafkaTemplateRecordPublisher(KafkaTemplate<String, String> kafkaTemplate, Duration sendTimeout) {
        this.kafkaTemplate = kafkaTemplate;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public void publish(ProducerRecord<String, String> record) {
        try {
            // Blocks until Kafka confirms
            SendResult<String, String> result = kafkaTemplate.send(record)
                .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);

            log.debug("✅ Sent to {} partition {} offset {}",
                    record.topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());

        } catch (ExecutionException e) {
            throw new PublishException(record.topic(), e.getCause() != null ? e.getCause() : e);
        } catch (TimeoutException e) {
            throw new PublishException(record.topic(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishException(record.topic(), e);
        }
    }
}
