package com.tradeagent.repository.jpa;

import com.tradeagent.entity.OrderBookSnapshotEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface OrderBookSnapshotJpaRepository extends JpaRepository<OrderBookSnapshotEntity, Long> {

    Optional<OrderBookSnapshotEntity> findFirstBySymbolOrderByTimestampDesc(String symbol);
}
