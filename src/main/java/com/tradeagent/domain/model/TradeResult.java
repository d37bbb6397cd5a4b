package com.tradeagent.domain.model;

import com.tradeagent.domain.enums.TradeSide;
import com.tradeagent.domain.enums.TradingMode;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * Realized outcome of a fill. Buys carry zero realized PnL; sells carry
 * {@code (price - avgCost) * size - fee} against the position before the fill.
 */
@Data
@Builder
public class TradeResult {

    private String tradeId;
    private String execId;
    private String intentId;

    /** Null for backtest trades, which never reach the store. */
    private TradingMode mode;

    private String symbol;
    private TradeSide side;
    private BigDecimal size;
    private BigDecimal price;
    private BigDecimal fee;
    private BigDecimal realizedPnl;
    private Instant timestamp;
}
