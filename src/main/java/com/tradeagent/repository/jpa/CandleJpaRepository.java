package com.tradeagent.repository.jpa;

import com.tradeagent.entity.CandleEntity;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface CandleJpaRepository extends JpaRepository<CandleEntity, Long> {

    Optional<CandleEntity> findBySymbolAndTimeframeAndTimestamp(String symbol, String timeframe, Instant timestamp);

    /** Newest first; callers reverse to get chronological order. */
    List<CandleEntity> findBySymbolAndTimeframeOrderByTimestampDesc(
            String symbol, String timeframe, Pageable pageable);

    @Query("SELECT c FROM CandleEntity c WHERE c.symbol = :symbol AND c.timeframe = :timeframe "
            + "AND c.timestamp BETWEEN :from AND :to ORDER BY c.timestamp ASC")
    List<CandleEntity> findRange(
            @Param("symbol") String symbol,
            @Param("timeframe") String timeframe,
            @Param("from") Instant from,
            @Param("to") Instant to);
}
