package io.malicki.retrycommander.kafka.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.TopicPartition;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds partitions whose next record is not due yet.
 * <p>
 * {@link #holdUntil} pauses the partition and queues a one-shot resume in a min-heap
 * drained by a single waiter thread. A partition has at most one pending resume; the
 * earliest due time wins. On {@link #shutdown()} pending resumes are dropped and
 * partitions stay paused.
 */
@Slf4j
public class DelayScheduler {

    private final PartitionPauser pauser;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final PriorityQueue<PendingResume> queue = new PriorityQueue<>(
        Comparator.comparingLong(PendingResume::dueAt).thenComparingLong(PendingResume::sequence));
    private final Map<TopicPartition, PendingResume> pending = new HashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    private Thread waiter;
    private boolean stopped;

    public DelayScheduler(PartitionPauser pauser, Clock clock) {
        this.pauser = pauser;
        this.clock = clock;
    }

    public void holdUntil(TopicPartition partition, long readyTimestamp) {
        lock.lock();
        try {
            if (stopped) {
                log.debug("Scheduler stopped, not holding {}", partition);
                return;
            }
            pauser.pause(partition);

            PendingResume existing = pending.get(partition);
            if (existing != null && existing.dueAt() <= readyTimestamp) {
                return;
            }
            if (existing != null) {
                queue.remove(existing);
            }
            PendingResume entry = new PendingResume(partition, readyTimestamp, sequence.incrementAndGet());
            pending.put(partition, entry);
            queue.add(entry);

            log.debug("⏸️ Holding {} until {}", partition, Instant.ofEpochMilli(readyTimestamp));

            startWaiterIfNeeded();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeld(TopicPartition partition) {
        lock.lock();
        try {
            return pending.containsKey(partition);
        } finally {
            lock.unlock();
        }
    }

    /** Pending resume times, keyed by partition. */
    public Map<TopicPartition, Long> pendingResumes() {
        lock.lock();
        try {
            Map<TopicPartition, Long> snapshot = new HashMap<>();
            pending.forEach((tp, entry) -> snapshot.put(tp, entry.dueAt()));
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    public void shutdown() {
        Thread toJoin;
        lock.lock();
        try {
            if (stopped) {
                return;
            }
            stopped = true;
            if (!pending.isEmpty()) {
                log.info("Cancelling {} pending resumes, partitions stay paused", pending.size());
            }
            queue.clear();
            pending.clear();
            changed.signalAll();
            toJoin = waiter;
        } finally {
            lock.unlock();
        }

        if (toJoin != null && toJoin != Thread.currentThread()) {
            try {
                toJoin.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void startWaiterIfNeeded() {
        if (waiter == null) {
            waiter = new Thread(this::runWaiter, "retry-delay-scheduler");
            waiter.setDaemon(true);
            waiter.start();
        }
    }

    private void runWaiter() {
        while (true) {
            TopicPartition due;
            lock.lock();
            try {
                PendingResume head = queue.peek();
                while (!stopped && (head == null || head.dueAt() > clock.millis())) {
                    if (head == null) {
                        changed.await();
                    } else {
                        changed.await(head.dueAt() - clock.millis(), TimeUnit.MILLISECONDS);
                    }
                    head = queue.peek();
                }
                if (stopped) {
                    return;
                }
                queue.poll();
                pending.remove(head.partition());
                due = head.partition();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("⚠️ Delay scheduler interrupted, pending resumes dropped");
                return;
            } finally {
                lock.unlock();
            }

            log.debug("▶️ Resuming {}", due);
            try {
                pauser.resume(due);
            } catch (RuntimeException e) {
                log.error("❌ Failed to resume {}: {}", due, e.getMessage(), e);
            }
        }
    }

    private static final class PendingResume {
        private final TopicPartition partition;
        private final long dueAt;
        private final long sequence;

        private PendingResume(TopicPartition partition, long dueAt, long sequence) {
            this.partition = partition;
            this.dueAt = dueAt;
            this.sequence = sequence;
        }

        TopicPartition partition() { return partition; }
        long dueAt() { return dueAt; }
        long sequence() { return sequence; }
    }
}
