package com.intelmonitor.unit.worker;

import static org.assertj.core.api.Assertions.assertThat;

import com.intelmonitor.domain.enums.TaskLane;
import com.intelmonitor.domain.enums.TaskType;
import com.intelmonitor.worker.MonitoringTask;
import com.intelmonitor.worker.TaskQueue;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for TaskQueue verifying lane ordering, FIFO within a lane,
 * the in-flight guard and delayed re-entry.
 */
class TaskQueueTest {

    private TaskQueue taskQueue;

    @BeforeEach
    void setUp() {
        taskQueue = new TaskQueue(Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        taskQueue.shutdown();
    }

    private static Map<String, String> monitor(String id) {
        return Map.of(MonitoringTask.MONITOR_ID, id);
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("Lower lane level is dequeued first regardless of arrival order")
        void laneOrdering() {
            taskQueue.enqueue(TaskType.AGGREGATION, TaskLane.LOW, Map.of());
            taskQueue.enqueue(TaskType.MONITOR_CHECK, TaskLane.NORMAL, monitor("m1"));
            taskQueue.enqueue(TaskType.ALERT_DELIVERY, TaskLane.HIGH, Map.of(MonitoringTask.ALERT_ID, "a1"));
            taskQueue.enqueue(TaskType.MONITOR_CHECK, TaskLane.CRITICAL, monitor("m2"));

            assertThat(taskQueue.poll().getLane()).isEqualTo(TaskLane.CRITICAL);
            assertThat(taskQueue.poll().getLane()).isEqualTo(TaskLane.HIGH);
            assertThat(taskQueue.poll().getLane()).isEqualTo(TaskLane.NORMAL);
            assertThat(taskQueue.poll().getLane()).isEqualTo(TaskLane.LOW);
            assertThat(taskQueue.poll()).isNull();
        }

        @Test
        @DisplayName("Same lane is FIFO by sequence number")
        void fifoWithinLane() {
            taskQueue.enqueue(TaskType.MONITOR_CHECK, TaskLane.NORMAL, monitor("m1"));
            taskQueue.enqueue(TaskType.MONITOR_CHECK, TaskLane.NORMAL, monitor("m2"));
            taskQueue.enqueue(TaskType.MONITOR_CHECK, TaskLane.NORMAL, monitor("m3"));

            assertThat(taskQueue.poll().getMonitorId()).isEqualTo("m1");
            assertThat(taskQueue.poll().getMonitorId()).isEqualTo("m2");
            assertThat(taskQueue.poll().getMonitorId()).isEqualTo("m3");
        }

        @Test
        @DisplayName("Payload is copied on enqueue")
        void payloadCopied() {
            MonitoringTask task = taskQueue.enqueue(TaskType.MONITOR_CHECK, TaskLane.NORMAL, monitor("m1"));

            task.getPayload().put("extra", "x");

            assertThat(task.getPayload()).containsEntry(MonitoringTask.MONITOR_ID, "m1");
        }
    }

    @Nested
    @DisplayName("In-Flight Guard")
    class InFlightGuard {

        @Test
        @DisplayName("Second check for the same monitor is skipped until released")
        void skipsWhileInFlight() {
            MonitoringTask first = taskQueue.enqueueIfAbsent(TaskType.MONITOR_CHECK, TaskLane.NORMAL, monitor("m1"));
            MonitoringTask second = taskQueue.enqueueIfAbsent(TaskType.MONITOR_CHECK, TaskLane.CRITICAL, monitor("m1"));

            assertThat(first).isNotNull();
            assertThat(second).isNull();
            assertThat(taskQueue.isInFlight(TaskType.MONITOR_CHECK, "m1")).isTrue();
            assertThat(taskQueue.size()).isEqualTo(1);

            taskQueue.release(first);

            assertThat(taskQueue.isInFlight(TaskType.MONITOR_CHECK, "m1")).isFalse();
            assertThat(taskQueue.enqueueIfAbsent(TaskType.MONITOR_CHECK, TaskLane.NORMAL, monitor("m1")))
                    .isNotNull();
        }

        @Test
        @DisplayName("Different task types for the same monitor do not block each other")
        void typesAreIndependent() {
            taskQueue.enqueueIfAbsent(TaskType.MONITOR_CHECK, TaskLane.NORMAL, monitor("m1"));

            assertThat(taskQueue.enqueueIfAbsent(TaskType.MODEL_TRAINING, TaskLane.LOW, monitor("m1")))
                    .isNotNull();
        }

        @Test
        @DisplayName("Untracked tasks do not touch the in-flight set on release")
        void untrackedRelease() {
            MonitoringTask tracked = taskQueue.enqueueIfAbsent(TaskType.MONITOR_CHECK, TaskLane.NORMAL, monitor("m1"));
            MonitoringTask plain = taskQueue.enqueue(TaskType.MONITOR_CHECK, TaskLane.NORMAL, monitor("m1"));

            taskQueue.release(plain);

            assertThat(tracked.isTracked()).isTrue();
            assertThat(taskQueue.isInFlight(TaskType.MONITOR_CHECK, "m1")).isTrue();
        }
    }

    @Nested
    @DisplayName("Delayed Re-entry")
    class DelayedReentry {

        @Test
        @DisplayName("Zero delay re-enters immediately")
        void zeroDelay() {
            MonitoringTask task = taskQueue.enqueue(TaskType.AGGREGATION, TaskLane.LOW, Map.of());
            taskQueue.poll();

            taskQueue.enqueueDelayed(task, Duration.ZERO);

            assertThat(taskQueue.poll()).isSameAs(task);
        }

        @Test
        @DisplayName("Delayed task is counted until it re-enters the queue")
        void delayedReentry() throws InterruptedException {
            MonitoringTask task = taskQueue.enqueue(TaskType.AGGREGATION, TaskLane.LOW, Map.of());
            taskQueue.poll();

            taskQueue.enqueueDelayed(task, Duration.ofMillis(100));

            assertThat(taskQueue.getDelayedCount()).isEqualTo(1);
            assertThat(taskQueue.size()).isZero();
            long deadline = System.currentTimeMillis() + 2000;
            while (taskQueue.size() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertThat(taskQueue.poll()).isSameAs(task);
            assertThat(taskQueue.getDelayedCount()).isZero();
        }
    }
}
