package io.malicki.retrycommander.kafka.topology;

import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Value
public class TopicSet {

    String main;
    List<String> retry;
    String dlq;

    public TopicSet(String main, List<String> retry, String dlq) {
        this.main = main;
        this.retry = List.copyOf(retry);
        this.dlq = dlq;
    }

    /**
     * @param level 1-based retry level
     */
    public String retryTopic(int level) {
        if (level < 1 || level > retry.size()) {
            throw new IllegalArgumentException("No retry topic for level " + level + " (max " + retry.size() + ")");
        }
        return retry.get(level - 1);
    }

    public int maxRetries() {
        return retry.size();
    }

    public boolean isRetryTopic(String topic) {
        return retry.contains(topic);
    }

    /** Distinct topic names: main first, then retry levels, then the DLQ. */
    public List<String> allTopics() {
        Set<String> names = new LinkedHashSet<>();
        names.add(main);
        names.addAll(retry);
        names.add(dlq);
        return new ArrayList<>(names);
    }
}
