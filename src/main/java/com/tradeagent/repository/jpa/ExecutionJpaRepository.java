package com.tradeagent.repository.jpa;

import com.tradeagent.entity.ExecutionEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ExecutionJpaRepository extends JpaRepository<ExecutionEntity, String> {

    List<ExecutionEntity> findByIntentIdOrderByTimestampAsc(String intentId);
}
