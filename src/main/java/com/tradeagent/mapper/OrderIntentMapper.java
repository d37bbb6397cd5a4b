package com.tradeagent.mapper;

import com.tradeagent.domain.model.OrderIntent;
import com.tradeagent.entity.OrderIntentEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between OrderIntent and OrderIntentEntity.
 *
 * <p>intent_json and updated_at are owned by the store and never come from the domain model.
 */
@Mapper
public interface OrderIntentMapper {

    @Mapping(target = "intentJson", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    OrderIntentEntity toEntity(OrderIntent intent);

    OrderIntent toDomain(OrderIntentEntity entity);

    List<OrderIntent> toDomainList(List<OrderIntentEntity> entities);
}
