package com.tradeagent.mapper;

import com.tradeagent.domain.model.TradeResult;
import com.tradeagent.entity.TradeResultEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface TradeResultMapper {

    TradeResultEntity toEntity(TradeResult tradeResult);

    TradeResult toDomain(TradeResultEntity entity);

    List<TradeResult> toDomainList(List<TradeResultEntity> entities);
}
