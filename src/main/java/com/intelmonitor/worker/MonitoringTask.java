package com.intelmonitor.worker;

import com.intelmonitor.domain.enums.TaskLane;
import com.intelmonitor.domain.enums.TaskType;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import lombok.Builder;
import lombok.Data;

/**
 * A unit of work on the {@link TaskQueue}.
 *
 * <p>Tasks sort by lane level, then by sequence number (FIFO within a lane). A retried
 * task gets a fresh sequence number when it re-enters the queue. {@code completion}
 * finishes once the task reaches a terminal state: success, or dead-lettered after
 * its last attempt.
 */
@Data
@Builder
public class MonitoringTask {

    public static final String MONITOR_ID = "monitorId";
    public static final String ALERT_ID = "alertId";
    public static final String DEAD_LETTER_ID = "deadLetterId";

    private String taskId;
    private TaskType taskType;
    private TaskLane lane;
    private Map<String, String> payload;

    /** Failed attempts so far. */
    private int attempt;

    private long sequenceNumber;
    private long enqueuedAt;

    /** Registered in the queue's in-flight set. */
    private boolean tracked;

    @Builder.Default
    private CompletableFuture<Void> completion = new CompletableFuture<>();

    public String getMonitorId() {
        return payload != null ? payload.get(MONITOR_ID) : null;
    }

    /** Identity used to keep one in-flight task per (type, monitor). */
    String dedupKey() {
        return taskType + ":" + (getMonitorId() != null ? getMonitorId() : taskId);
    }
}
