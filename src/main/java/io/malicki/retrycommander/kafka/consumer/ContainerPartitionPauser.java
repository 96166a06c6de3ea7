package io.malicki.retrycommander.kafka.consumer;

import io.malicki.retrycommander.kafka.scheduler.PartitionPauser;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.TopicPartition;
import org.springframework.kafka.listener.MessageListenerContainer;

/**
 * Pauses and resumes partitions through the listener container. The container applies
 * the requests on its consumer thread before the next poll, so any thread may call this.
 */
@Slf4j
public class ContainerPartitionPauser implements PartitionPauser {

    private final MessageListenerContainer container;

    public ContainerPartitionPauser(MessageListenerContainer container) {
        this.container = container;
    }

    @Override
    public void pause(TopicPartition partition) {
        container.pausePartition(partition);
    }

    @Override
    public void resume(TopicPartition partition) {
        if (!container.isPartitionPauseRequested(partition)) {
            log.debug("Partition {} not paused, nothing to resume", partition);
            return;
        }
        container.resumePartition(partition);
    }
}
