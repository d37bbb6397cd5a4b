package com.tradeagent.domain.model;

import com.tradeagent.domain.enums.IntentStatus;
import com.tradeagent.domain.enums.OrderType;
import com.tradeagent.domain.enums.TimeInForce;
import com.tradeagent.domain.enums.TradeSide;
import com.tradeagent.domain.enums.TradingMode;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * Frozen, hashed and expiring form of a risk-approved trade plan.
 *
 * <p>Every field except {@code status} is immutable once the intent is stored. The
 * {@code intentHash} is the SHA-256 of the canonical JSON of those fields and is the
 * target both approvals and live executions bind to.
 */
@Data
@Builder(toBuilder = true)
public class OrderIntent {

    private String intentId;
    private Instant createdAt;
    private String symbol;
    private TradeSide side;
    private BigDecimal size;
    private BigDecimal price;
    private OrderType orderType;
    private TimeInForce timeInForce;
    private String strategy;
    private BigDecimal confidence;
    private String rationale;

    /** Id of the feature snapshot the strategy saw, if any. */
    private String rationaleFeaturesRef;

    private Instant expiresAt;
    private TradingMode mode;

    private IntentStatus status;
    private String intentHash;

    public BigDecimal notional() {
        return size.multiply(price);
    }

    /** Plan view of this intent, used to re-run risk checks right before execution. */
    public TradePlan toPlan() {
        return TradePlan.builder()
                .symbol(symbol)
                .side(side)
                .size(size)
                .price(price)
                .confidence(confidence)
                .rationale(rationale)
                .strategy(strategy)
                .build();
    }
}
