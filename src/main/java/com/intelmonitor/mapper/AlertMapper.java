package com.intelmonitor.mapper;

import com.intelmonitor.domain.model.Alert;
import com.intelmonitor.domain.model.AlertPriority;
import com.intelmonitor.domain.model.AnomalyScore;
import com.intelmonitor.domain.model.Change;
import com.intelmonitor.domain.model.RootCauseExplanation;
import com.intelmonitor.entity.AlertEntity;
import java.util.ArrayList;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between the Alert domain model and AlertEntity.
 *
 * <p>Changes, anomaly scores, priority and root cause are JSON columns. Priority
 * score and urgency are copied into their own columns on the way in and ignored on
 * the way out (the JSON priority is authoritative).
 */
@Mapper
public interface AlertMapper {

    @Mapping(source = "changes", target = "changes", qualifiedByName = "changesToJson")
    @Mapping(source = "anomalyScores", target = "anomalyScores", qualifiedByName = "anomaliesToJson")
    @Mapping(source = "priority", target = "priority", qualifiedByName = "priorityToJson")
    @Mapping(source = "priority.score", target = "priorityScore")
    @Mapping(source = "priority.urgencyLevel", target = "urgencyLevel")
    @Mapping(source = "rootCause", target = "rootCause", qualifiedByName = "rootCauseToJson")
    AlertEntity toEntity(Alert alert);

    @Mapping(source = "changes", target = "changes", qualifiedByName = "jsonToChanges")
    @Mapping(source = "anomalyScores", target = "anomalyScores", qualifiedByName = "jsonToAnomalies")
    @Mapping(source = "priority", target = "priority", qualifiedByName = "jsonToPriority")
    @Mapping(source = "rootCause", target = "rootCause", qualifiedByName = "jsonToRootCause")
    Alert toDomain(AlertEntity entity);

    List<Alert> toDomainList(List<AlertEntity> entities);

    @Named("changesToJson")
    default String changesToJson(List<Change> changes) {
        return JsonHelper.toJson(changes);
    }

    @Named("jsonToChanges")
    default List<Change> jsonToChanges(String json) {
        return new ArrayList<>(JsonHelper.fromJsonList(json, Change.class));
    }

    @Named("anomaliesToJson")
    default String anomaliesToJson(List<AnomalyScore> anomalyScores) {
        return JsonHelper.toJson(anomalyScores);
    }

    @Named("jsonToAnomalies")
    default List<AnomalyScore> jsonToAnomalies(String json) {
        return new ArrayList<>(JsonHelper.fromJsonList(json, AnomalyScore.class));
    }

    @Named("priorityToJson")
    default String priorityToJson(AlertPriority priority) {
        return JsonHelper.toJson(priority);
    }

    @Named("jsonToPriority")
    default AlertPriority jsonToPriority(String json) {
        return JsonHelper.fromJson(json, AlertPriority.class);
    }

    @Named("rootCauseToJson")
    default String rootCauseToJson(RootCauseExplanation rootCause) {
        return JsonHelper.toJson(rootCause);
    }

    @Named("jsonToRootCause")
    default RootCauseExplanation jsonToRootCause(String json) {
        return JsonHelper.fromJson(json, RootCauseExplanation.class);
    }
}
