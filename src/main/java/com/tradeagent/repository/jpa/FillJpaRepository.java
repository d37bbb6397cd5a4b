package com.tradeagent.repository.jpa;

import com.tradeagent.entity.FillEntity;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the fills table.
 * Filled orders per day and the last fill time feed the order-frequency and cooldown checks.
 */
@Repository
public interface FillJpaRepository extends JpaRepository<FillEntity, String> {

    List<FillEntity> findBySymbolOrderByTimestampAsc(String symbol);

    List<FillEntity> findByExecId(String execId);

    @Query("SELECT COUNT(f) FROM FillEntity f WHERE f.timestamp >= :from AND f.timestamp < :to")
    long countBetween(@Param("from") Instant from, @Param("to") Instant to);

    Optional<FillEntity> findFirstByOrderByTimestampDesc();
}
