package com.tradeagent.intent;

import com.tradeagent.domain.enums.IntentStatus;
import com.tradeagent.domain.enums.OrderType;
import com.tradeagent.domain.enums.TimeInForce;
import com.tradeagent.domain.enums.TradingMode;
import com.tradeagent.domain.model.OrderIntent;
import com.tradeagent.domain.model.TradePlan;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Freezes a risk-approved plan into a new {@link OrderIntent}.
 *
 * <p>Timestamps are truncated to milliseconds so the in-memory intent and its stored
 * canonical JSON hash identically. Numbers are cut to the storage scale for the same reason;
 * size is rounded down so the stored size never exceeds what risk approved.
 */
@Component
public class IntentFactory {

    /** Decimal places kept for size, price and confidence. Matches the column scale. */
    static final int SCALE = 12;

    private final Clock clock;

    public IntentFactory(Clock clock) {
        this.clock = clock;
    }

    public OrderIntent fromPlan(TradePlan plan, TradingMode mode, int expirySeconds, String featuresRef) {
        if (plan.isHold()) {
            throw new IllegalArgumentException("HOLD plans cannot become intents");
        }
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        OrderIntent intent = OrderIntent.builder()
                .intentId(UUID.randomUUID().toString())
                .createdAt(now)
                .symbol(plan.getSymbol())
                .side(plan.getSide())
                .size(CanonicalJson.normalizeNumber(plan.getSize().setScale(SCALE, RoundingMode.DOWN)))
                .price(CanonicalJson.normalizeNumber(plan.getPrice().setScale(SCALE, RoundingMode.HALF_EVEN)))
                .orderType(OrderType.LIMIT)
                .timeInForce(TimeInForce.GTC)
                .strategy(plan.getStrategy())
                .confidence(CanonicalJson.normalizeNumber(plan.getConfidence().setScale(SCALE, RoundingMode.HALF_EVEN)))
                .rationale(plan.getRationale())
                .rationaleFeaturesRef(featuresRef)
                .expiresAt(now.plusSeconds(expirySeconds))
                .mode(mode)
                .status(IntentStatus.PROPOSED)
                .build();
        intent.setIntentHash(IntentHasher.hash(intent));
        return intent;
    }

    public static boolean isExpired(OrderIntent intent, Instant now) {
        return !now.isBefore(intent.getExpiresAt());
    }
}
