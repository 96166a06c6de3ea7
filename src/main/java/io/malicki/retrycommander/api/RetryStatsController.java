package io.malicki.retrycommander.api;

import io.malicki.retrycommander.exception.ProvisioningException;
import io.malicki.retrycommander.kafka.config.RetryCommanderProperties;
import io.malicki.retrycommander.kafka.consumer.RetryCommander;
import io.malicki.retrycommander.kafka.metrics.MetricsCollector;
import io.malicki.retrycommander.kafka.metrics.RetryMetrics;
import io.malicki.retrycommander.kafka.topology.TopicSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/retry")
@Slf4j
public class RetryStatsController {

    private final RetryCommander retryCommander;
    private final long dlqWarningThreshold;

    public RetryStatsController(
        RetryCommander retryCommander,
        RetryCommanderProperties properties
    ) {
        this.retryCommander = retryCommander;
        this.dlqWarningThreshold = properties.getMetrics().getDlqWarningThreshold();
    }

    @GetMapping("/stats")
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new HashMap<>();

        stats.put("state", retryCommander.getState().name());
        stats.put("topics", retryCommander.getTopics());

        // Published by this instance since start
        stats.put("totalSentToRetry", retryCommander.getRouter().getRetryMessageCount());
        stats.put("totalSentToDlq", retryCommander.getRouter().getDltMessageCount());

        RetryMetrics metrics = retryCommander.getMetrics();
        if (metrics instanceof MetricsCollector) {
            stats.put("metrics", ((MetricsCollector) metrics).getMetrics());
        }

        // Partitions waiting for their next retry to become due
        Map<String, Long> pending = retryCommander.pendingResumes()
            .entrySet()
            .stream()
            .collect(Collectors.toMap(
                e -> e.getKey().toString(),
                Map.Entry::getValue
            ));
        stats.put("pendingResumes", pending);

        return stats;
    }

    @GetMapping("/health")
    public Map<String, Object> getHealth() {
        Map<String, Object> health = new HashMap<>();

        long totalDlq = retryCommander.getRouter().getDltMessageCount();

        health.put("status", totalDlq < dlqWarningThreshold ? "HEALTHY" : "WARNING");
        health.put("totalDlqMessages", totalDlq);
        health.put("threshold", dlqWarningThreshold);
        health.put("state", retryCommander.getState().name());

        if (totalDlq >= dlqWarningThreshold) {
            health.put("alert", "High number of DLQ messages - investigation required!");
        }

        return health;
    }

    @GetMapping("/topology/{topic}")
    public Map<String, Object> getTopology(@PathVariable String topic) {
        TopicSet topicSet = retryCommander.getTopology().topologyFor(topic);

        Map<String, Object> topology = new HashMap<>();
        topology.put("main", topicSet.getMain());
        topology.put("retry", topicSet.getRetry());
        topology.put("dlq", topicSet.getDlq());
        return topology;
    }

    @DeleteMapping("/topology/{topic}")
    public ResponseEntity<Map<String, Object>> deleteTopology(@PathVariable String topic) {
        log.warn("🗑️ DELETE /api/retry/topology/{}", topic);

        Map<String, Object> body = new HashMap<>();
        body.put("topic", topic);
        try {
            retryCommander.getTopology().teardown(topic);
            body.put("deleted", retryCommander.getTopology().topologyFor(topic).allTopics());
            return ResponseEntity.ok(body);
        } catch (ProvisioningException e) {
            body.put("deleted", e.getSucceededTopics());
            body.put("failed", e.getFailedTopics()
                .entrySet()
                .stream()
                .collect(Collectors.toMap(
                    Map.Entry::getKey,
                    entry -> String.valueOf(entry.getValue().getMessage())
                )));
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
        }
    }
}
