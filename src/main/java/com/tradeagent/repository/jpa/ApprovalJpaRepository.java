package com.tradeagent.repository.jpa;

import com.tradeagent.entity.ApprovalEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ApprovalJpaRepository extends JpaRepository<ApprovalEntity, String> {}
