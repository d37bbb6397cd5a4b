package com.tradeagent.mapper;

import com.tradeagent.domain.model.Approval;
import com.tradeagent.entity.ApprovalEntity;
import org.mapstruct.Mapper;

@Mapper
public interface ApprovalMapper {

    ApprovalEntity toEntity(Approval approval);

    Approval toDomain(ApprovalEntity entity);
}
