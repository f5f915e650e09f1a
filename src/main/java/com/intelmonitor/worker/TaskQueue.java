package com.intelmonitor.worker;

import com.intelmonitor.domain.enums.TaskLane;
import com.intelmonitor.domain.enums.TaskType;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Lane-prioritized task queue shared by the scheduler, the orchestrator and the consumers.
 *
 * <p>Ordering is two-level:
 * <ol>
 *   <li>Lane level: CRITICAL(0) before HIGH(1) before NORMAL(2) before LOW(3)</li>
 *   <li>Sequence number: FIFO within a lane</li>
 * </ol>
 *
 * <p>Retries and rate-limited tasks re-enter through {@link #enqueueDelayed}, which parks
 * them on a single timer thread until their delay expires. At most one task per
 * (type, monitor) is in flight; {@link #enqueueIfAbsent} returns null for a second one.
 */
@Component
public class TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    private static final int INITIAL_CAPACITY = 64;

    private final AtomicLong sequenceCounter = new AtomicLong(0);
    private final AtomicInteger delayedCount = new AtomicInteger(0);
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private final PriorityBlockingQueue<MonitoringTask> queue = new PriorityBlockingQueue<>(
            INITIAL_CAPACITY,
            Comparator.<MonitoringTask>comparingInt(t -> t.getLane().getLevel())
                    .thenComparingLong(MonitoringTask::getSequenceNumber));

    private final ScheduledExecutorService delayScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "task-queue-delay");
        thread.setDaemon(true);
        return thread;
    });

    private final Clock clock;

    public TaskQueue(Clock clock) {
        this.clock = clock;
    }

    /** Enqueues a task unconditionally; it does not count towards the in-flight guard. */
    public MonitoringTask enqueue(TaskType taskType, TaskLane lane, Map<String, String> payload) {
        MonitoringTask task = newTask(taskType, lane, payload);
        put(task);
        return task;
    }

    /**
     * Enqueues a task unless one of the same type for the same monitor is still in flight.
     *
     * @return the new task, or null when skipped
     */
    public MonitoringTask enqueueIfAbsent(TaskType taskType, TaskLane lane, Map<String, String> payload) {
        MonitoringTask task = newTask(taskType, lane, payload);
        if (!inFlight.add(task.dedupKey())) {
            log.debug("Task {} already in flight, skipping", task.dedupKey());
            return null;
        }
        task.setTracked(true);
        put(task);
        return task;
    }

    /** Re-enters an existing task after {@code delay}. The task stays in flight meanwhile. */
    public void enqueueDelayed(MonitoringTask task, Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            put(task);
            return;
        }
        delayedCount.incrementAndGet();
        delayScheduler.schedule(
                () -> {
                    delayedCount.decrementAndGet();
                    put(task);
                },
                delay.toMillis(),
                TimeUnit.MILLISECONDS);
    }

    /** Blocks until a task is available. */
    public MonitoringTask take() throws InterruptedException {
        return queue.take();
    }

    /** Non-blocking take; null when empty. */
    public MonitoringTask poll() {
        return queue.poll();
    }

    /** Marks a task terminal so another one for the same monitor may be enqueued. */
    public void release(MonitoringTask task) {
        if (task.isTracked()) {
            inFlight.remove(task.dedupKey());
        }
    }

    public boolean isInFlight(TaskType taskType, String monitorId) {
        return inFlight.contains(taskType + ":" + monitorId);
    }

    public int size() {
        return queue.size();
    }

    public int getDelayedCount() {
        return delayedCount.get();
    }

    public void clear() {
        int cleared = queue.size();
        queue.clear();
        inFlight.clear();
        if (cleared > 0) {
            log.info("Task queue cleared: {} tasks removed", cleared);
        }
    }

    @PreDestroy
    public void shutdown() {
        delayScheduler.shutdownNow();
    }

    private MonitoringTask newTask(TaskType taskType, TaskLane lane, Map<String, String> payload) {
        return MonitoringTask.builder()
                .taskId(UUID.randomUUID().toString())
                .taskType(taskType)
                .lane(lane)
                .payload(payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>())
                .build();
    }

    private void put(MonitoringTask task) {
        task.setSequenceNumber(sequenceCounter.incrementAndGet());
        task.setEnqueuedAt(clock.millis());
        queue.put(task);
        log.debug("Task enqueued: type={}, lane={}, queueSize={}", task.getTaskType(), task.getLane(), queue.size());
    }
}
