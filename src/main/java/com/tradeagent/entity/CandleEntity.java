package com.tradeagent.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the candles table.
 * One row per (symbol, timeframe, open time); re-ingesting a bar updates it in place.
 */
@Entity
@Table(name = "candles",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_candles_symbol_tf_ts",
                columnNames = {"symbol", "timeframe", "ts"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CandleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 30, nullable = false)
    private String symbol;

    @Column(length = 10, nullable = false)
    private String timeframe;

    @Column(name = "ts", nullable = false)
    private Instant timestamp;

    @Column(precision = 30, scale = 12)
    private BigDecimal open;

    @Column(precision = 30, scale = 12)
    private BigDecimal high;

    @Column(precision = 30, scale = 12)
    private BigDecimal low;

    @Column(precision = 30, scale = 12)
    private BigDecimal close;

    @Column(precision = 30, scale = 12)
    private BigDecimal volume;
}
