package com.tradeagent.reporting;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Trade-based performance metrics.
 *
 * <p>Ratios (return, CAGR, win rate) are fractions, not percentages. Sharpe is computed from
 * per-trade returns on capital and is not annualized.
 */
@Data
@Builder
public class PerformanceReport {

    private BigDecimal totalPnl;
    private BigDecimal totalReturn;
    private BigDecimal cagr;
    private BigDecimal sharpe;
    private BigDecimal maxDrawdown;
    private BigDecimal winRate;
    private BigDecimal profitFactor;
    private BigDecimal turnover;
    private BigDecimal fees;
    private int numTrades;
}
