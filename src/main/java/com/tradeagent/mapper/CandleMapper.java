package com.tradeagent.mapper;

import com.tradeagent.domain.model.Candle;
import com.tradeagent.entity.CandleEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper
public interface CandleMapper {

    @Mapping(target = "id", ignore = true)
    CandleEntity toEntity(Candle candle);

    Candle toDomain(CandleEntity entity);

    List<Candle> toDomainList(List<CandleEntity> entities);
}
