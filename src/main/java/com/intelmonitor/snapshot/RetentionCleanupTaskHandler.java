package com.intelmonitor.snapshot;

import com.intelmonitor.config.SnapshotStoreConfig;
import com.intelmonitor.domain.enums.TaskType;
import com.intelmonitor.domain.model.RetentionResult;
import com.intelmonitor.worker.MonitoringTask;
import com.intelmonitor.worker.TaskHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Deletes snapshots and aggregations older than the configured retention period. */
@Component
public class RetentionCleanupTaskHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(RetentionCleanupTaskHandler.class);

    private final SnapshotStore snapshotStore;
    private final SnapshotStoreConfig snapshotStoreConfig;

    public RetentionCleanupTaskHandler(SnapshotStore snapshotStore, SnapshotStoreConfig snapshotStoreConfig) {
        this.snapshotStore = snapshotStore;
        this.snapshotStoreConfig = snapshotStoreConfig;
    }

    @Override
    public TaskType getTaskType() {
        return TaskType.RETENTION_CLEANUP;
    }

    @Override
    public void handle(MonitoringTask task) {
        RetentionResult result = snapshotStore.cleanupOldSnapshots(snapshotStoreConfig.getRetentionDays(), false);
        log.info("Retention cleanup removed {} snapshots and {} aggregations older than {}",
                result.getSnapshotsAffected(), result.getAggregationsDeleted(), result.getCutoff());
    }
}
