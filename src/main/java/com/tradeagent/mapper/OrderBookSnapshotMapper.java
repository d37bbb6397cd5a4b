package com.tradeagent.mapper;

import com.tradeagent.domain.model.OrderBookSnapshot;
import com.tradeagent.entity.OrderBookSnapshotEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper
public interface OrderBookSnapshotMapper {

    @Mapping(target = "id", ignore = true)
    OrderBookSnapshotEntity toEntity(OrderBookSnapshot snapshot);

    OrderBookSnapshot toDomain(OrderBookSnapshotEntity entity);
}
