package io.malicki.retrycommander.kafka.scheduler;

import org.apache.kafka.common.TopicPartition;

public interface PartitionPauser {

    void pause(TopicPartition partition);

    /** Resuming a partition that is not paused is a no-op. */
    void resume(TopicPartition partition);
}
