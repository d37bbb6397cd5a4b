package com.tradeagent.mapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tradeagent.domain.model.Execution;
import com.tradeagent.entity.ExecutionEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between Execution and ExecutionEntity.
 *
 * <p>The details map is stored as a JSON string via {@link JsonHelper}.
 */
@Mapper
public interface ExecutionMapper {

    @Mapping(source = "details", target = "details", qualifiedByName = "mapToJson")
    ExecutionEntity toEntity(Execution execution);

    @Mapping(source = "details", target = "details", qualifiedByName = "jsonToMap")
    Execution toDomain(ExecutionEntity entity);

    List<Execution> toDomainList(List<ExecutionEntity> entities);

    @Named("mapToJson")
    default String mapToJson(Map<String, Object> details) {
        return JsonHelper.toJson(details);
    }

    @Named("jsonToMap")
    default Map<String, Object> jsonToMap(String json) {
        Map<String, Object> details = JsonHelper.fromJson(json, new TypeReference<Map<String, Object>>() {});
        return details != null ? details : Map.of();
    }
}
