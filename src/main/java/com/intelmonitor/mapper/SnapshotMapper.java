package com.intelmonitor.mapper;

import com.intelmonitor.domain.model.Snapshot;
import com.intelmonitor.entity.SnapshotEntity;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between the Snapshot domain model and SnapshotEntity.
 *
 * <p>Produces and consumes plain JSON only. Compression of large sections happens in
 * the snapshot store after {@link #toEntity} and before {@link #toDomain}.
 */
@Mapper
public interface SnapshotMapper {

    @Mapping(source = "financialMetrics", target = "financialMetrics", qualifiedByName = "toJson")
    @Mapping(source = "marketTrends", target = "marketTrends", qualifiedByName = "toJson")
    @Mapping(source = "competitiveForces", target = "competitiveForces", qualifiedByName = "toJson")
    @Mapping(source = "strategicPosition", target = "strategicPosition", qualifiedByName = "toJson")
    @Mapping(source = "competitorMentions", target = "competitorMentions", qualifiedByName = "toJson")
    SnapshotEntity toEntity(Snapshot snapshot);

    @Mapping(source = "financialMetrics", target = "financialMetrics", qualifiedByName = "jsonToObjectMap")
    @Mapping(source = "marketTrends", target = "marketTrends", qualifiedByName = "jsonToStrings")
    @Mapping(source = "competitiveForces", target = "competitiveForces", qualifiedByName = "jsonToStringMap")
    @Mapping(source = "strategicPosition", target = "strategicPosition", qualifiedByName = "jsonToObjectMap")
    @Mapping(source = "competitorMentions", target = "competitorMentions", qualifiedByName = "jsonToIntegerMap")
    Snapshot toDomain(SnapshotEntity entity);

    @Named("toJson")
    default String toJson(Object value) {
        return JsonHelper.toJson(value);
    }

    @Named("jsonToObjectMap")
    default Map<String, Object> jsonToObjectMap(String json) {
        return JsonHelper.fromJsonMap(json, Object.class);
    }

    @Named("jsonToStringMap")
    default Map<String, String> jsonToStringMap(String json) {
        return JsonHelper.fromJsonMap(json, String.class);
    }

    @Named("jsonToIntegerMap")
    default Map<String, Integer> jsonToIntegerMap(String json) {
        return JsonHelper.fromJsonMap(json, Integer.class);
    }

    @Named("jsonToStrings")
    default List<String> jsonToStrings(String json) {
        return new ArrayList<>(JsonHelper.fromJsonList(json, String.class));
    }
}
