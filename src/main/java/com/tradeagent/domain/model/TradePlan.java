package com.tradeagent.domain.model;

import com.tradeagent.domain.enums.TradeSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Candidate trade produced by a strategy, before risk gating.
 *
 * <p>Ephemeral: only the risk-approved version is frozen into an {@link OrderIntent}.
 * A HOLD plan always carries zero size, price and confidence.
 */
@Data
@Builder(toBuilder = true)
public class TradePlan {

    private String symbol;
    private TradeSide side;

    /** Base-asset units. */
    private BigDecimal size;

    /** Quote per base unit. */
    private BigDecimal price;

    private BigDecimal confidence;
    private String rationale;
    private String strategy;

    public static TradePlan hold(String symbol, String strategy, String rationale) {
        return TradePlan.builder()
                .symbol(symbol)
                .side(TradeSide.HOLD)
                .size(BigDecimal.ZERO)
                .price(BigDecimal.ZERO)
                .confidence(BigDecimal.ZERO)
                .rationale(rationale)
                .strategy(strategy)
                .build();
    }

    public boolean isHold() {
        return side == TradeSide.HOLD;
    }

    public BigDecimal notional() {
        return size.multiply(price);
    }
}
