package com.tradeagent.repository.jpa;

import com.tradeagent.domain.enums.TradingMode;
import com.tradeagent.entity.TradeResultEntity;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface TradeResultJpaRepository extends JpaRepository<TradeResultEntity, String> {

    @Query("SELECT COALESCE(SUM(t.realizedPnl), 0) FROM TradeResultEntity t "
            + "WHERE t.timestamp >= :from AND t.timestamp < :to")
    BigDecimal sumRealizedPnlBetween(@Param("from") Instant from, @Param("to") Instant to);

    List<TradeResultEntity> findAllByOrderByTimestampAsc();

    List<TradeResultEntity> findByModeOrderByTimestampAsc(TradingMode mode);
}
