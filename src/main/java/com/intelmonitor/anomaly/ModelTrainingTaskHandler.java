package com.intelmonitor.anomaly;

import com.intelmonitor.domain.enums.TaskType;
import com.intelmonitor.worker.MonitoringTask;
import com.intelmonitor.worker.TaskHandler;
import org.springframework.stereotype.Component;

/**
 * Retrains forecast models. A task carrying a monitorId retrains that monitor only;
 * otherwise every active monitor is retrained.
 */
@Component
public class ModelTrainingTaskHandler implements TaskHandler {

    private final ModelTrainingService modelTrainingService;

    public ModelTrainingTaskHandler(ModelTrainingService modelTrainingService) {
        this.modelTrainingService = modelTrainingService;
    }

    @Override
    public TaskType getTaskType() {
        return TaskType.MODEL_TRAINING;
    }

    @Override
    public void handle(MonitoringTask task) {
        if (task.getMonitorId() != null) {
            modelTrainingService.retrain(task.getMonitorId());
        } else {
            modelTrainingService.retrainAll();
        }
    }
}
