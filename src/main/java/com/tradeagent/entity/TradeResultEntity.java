package com.tradeagent.entity;

import com.tradeagent.domain.enums.TradeSide;
import com.tradeagent.domain.enums.TradingMode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trade_results table. Daily realized PnL is the sum of realized_pnl
 * over one UTC day.
 */
@Entity
@Table(name = "trade_results")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeResultEntity {

    @Id
    @Column(name = "trade_id", length = 36)
    private String tradeId;

    @Column(name = "exec_id", length = 36, nullable = false)
    private String execId;

    @Column(name = "intent_id", length = 36)
    private String intentId;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private TradingMode mode;

    @Column(length = 30, nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private TradeSide side;

    @Column(precision = 30, scale = 12)
    private BigDecimal size;

    @Column(precision = 30, scale = 12)
    private BigDecimal price;

    @Column(precision = 30, scale = 12)
    private BigDecimal fee;

    @Column(name = "realized_pnl", precision = 30, scale = 12)
    private BigDecimal realizedPnl;

    @Column(name = "ts", nullable = false)
    private Instant timestamp;
}
