package com.intelmonitor.mapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.intelmonitor.domain.enums.TrendDirection;
import com.intelmonitor.domain.model.Aggregation;
import com.intelmonitor.domain.model.MetricStatistics;
import com.intelmonitor.domain.model.SignificantChange;
import com.intelmonitor.entity.AggregationEntity;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between the Aggregation domain model and AggregationEntity.
 * All statistical sections are JSON columns.
 */
@Mapper
public interface AggregationMapper {

    @Mapping(source = "metrics", target = "metrics", qualifiedByName = "toJson")
    @Mapping(source = "trends", target = "trends", qualifiedByName = "toJson")
    @Mapping(source = "movingAverages", target = "movingAverages", qualifiedByName = "toJson")
    @Mapping(source = "significantChanges", target = "significantChanges", qualifiedByName = "toJson")
    @Mapping(source = "mostCommonTrends", target = "mostCommonTrends", qualifiedByName = "toJson")
    AggregationEntity toEntity(Aggregation aggregation);

    @Mapping(source = "metrics", target = "metrics", qualifiedByName = "jsonToMetrics")
    @Mapping(source = "trends", target = "trends", qualifiedByName = "jsonToTrends")
    @Mapping(source = "movingAverages", target = "movingAverages", qualifiedByName = "jsonToMovingAverages")
    @Mapping(source = "significantChanges", target = "significantChanges", qualifiedByName = "jsonToChanges")
    @Mapping(source = "mostCommonTrends", target = "mostCommonTrends", qualifiedByName = "jsonToStrings")
    Aggregation toDomain(AggregationEntity entity);

    @Named("toJson")
    default String toJson(Object value) {
        return JsonHelper.toJson(value);
    }

    @Named("jsonToMetrics")
    default Map<String, MetricStatistics> jsonToMetrics(String json) {
        return JsonHelper.fromJsonMap(json, MetricStatistics.class);
    }

    @Named("jsonToTrends")
    default Map<String, TrendDirection> jsonToTrends(String json) {
        return JsonHelper.fromJsonMap(json, TrendDirection.class);
    }

    @Named("jsonToMovingAverages")
    default Map<String, Double> jsonToMovingAverages(String json) {
        Map<String, Double> values = JsonHelper.fromJson(json, new TypeReference<LinkedHashMap<String, Double>>() {});
        return values != null ? values : new LinkedHashMap<>();
    }

    @Named("jsonToChanges")
    default List<SignificantChange> jsonToChanges(String json) {
        return new ArrayList<>(JsonHelper.fromJsonList(json, SignificantChange.class));
    }

    @Named("jsonToStrings")
    default List<String> jsonToStrings(String json) {
        return new ArrayList<>(JsonHelper.fromJsonList(json, String.class));
    }
}
