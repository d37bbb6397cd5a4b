package com.tradeagent.repository.jpa;

import com.tradeagent.entity.AuditLogEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AuditLogJpaRepository extends JpaRepository<AuditLogEntity, Long> {

    List<AuditLogEntity> findByEntityIdOrderByTimestampAsc(String entityId);
}
