package com.intelmonitor.mapper;

import com.intelmonitor.domain.model.Monitor;
import com.intelmonitor.domain.model.MonitorSettings;
import com.intelmonitor.entity.MonitorEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between the Monitor domain model and MonitorEntity.
 * Settings are held as a JSON document in the entity.
 */
@Mapper
public interface MonitorMapper {

    @Mapping(source = "settings", target = "settings", qualifiedByName = "settingsToJson")
    MonitorEntity toEntity(Monitor monitor);

    @Mapping(source = "settings", target = "settings", qualifiedByName = "jsonToSettings")
    Monitor toDomain(MonitorEntity entity);

    List<Monitor> toDomainList(List<MonitorEntity> entities);

    @Named("settingsToJson")
    default String settingsToJson(MonitorSettings settings) {
        return JsonHelper.toJson(settings);
    }

    @Named("jsonToSettings")
    default MonitorSettings jsonToSettings(String json) {
        MonitorSettings settings = JsonHelper.fromJson(json, MonitorSettings.class);
        return settings != null ? settings : MonitorSettings.defaults();
    }
}
