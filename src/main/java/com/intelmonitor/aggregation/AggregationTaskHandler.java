package com.intelmonitor.aggregation;

import com.intelmonitor.domain.enums.TaskType;
import com.intelmonitor.worker.MonitoringTask;
import com.intelmonitor.worker.TaskHandler;
import org.springframework.stereotype.Component;

/** Runs the nightly daily-aggregation batch over all active monitors. */
@Component
public class AggregationTaskHandler implements TaskHandler {

    private final SnapshotAggregator snapshotAggregator;

    public AggregationTaskHandler(SnapshotAggregator snapshotAggregator) {
        this.snapshotAggregator = snapshotAggregator;
    }

    @Override
    public TaskType getTaskType() {
        return TaskType.AGGREGATION;
    }

    @Override
    public void handle(MonitoringTask task) {
        snapshotAggregator.runDailyAggregation();
    }
}
