package com.tradeagent.mapper;

import com.tradeagent.domain.model.Fill;
import com.tradeagent.entity.FillEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface FillMapper {

    FillEntity toEntity(Fill fill);

    Fill toDomain(FillEntity entity);

    List<Fill> toDomainList(List<FillEntity> entities);
}
