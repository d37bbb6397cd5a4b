package com.tradeagent.risk;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Global risk limits, in quote currency unless stated otherwise.
 *
 * <p>Loaded from {@code tradeagent.risk.*} on startup. The backtest uses the same
 * instance as live proposal and execution.
 */
@Data
@Builder
public class RiskLimits {

    // ==================== Sizing ====================

    private BigDecimal capital;

    /** Fraction of capital a single symbol position may hold, e.g. 0.2. */
    private BigDecimal maxPositionPct;

    private BigDecimal maxOrderNotional;

    /** Also caps notional, since a full loss of the order is the worst case per trade. */
    private BigDecimal maxLossPerTrade;

    // ==================== Day-scoped ====================

    private BigDecimal maxLossPerDay;
    private int maxOrdersPerDay;

    // ==================== Cooldown ====================

    private int cooldownMinutes;

    /** Relative close-to-close move that lifts an active cooldown, e.g. 0.02 = 2%. */
    private BigDecimal cooldownBypassPct;
}
