package com.tradeagent.execution;

import com.tradeagent.domain.enums.TradeSide;
import com.tradeagent.domain.model.OrderBookSnapshot;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes a resting (non-crossing) limit price for exchanges without native post-only.
 *
 * <p>A buy is clamped to at most the best bid, a sell to at least the best ask. If the
 * clamped price would still cross, it is padded one tick away from the touch, or by
 * {@code bufferBps} of the reference price when the tick is unknown.
 */
public final class MakerPriceEmulator {

    private static final BigDecimal BPS = new BigDecimal("10000");

    private MakerPriceEmulator() {}

    public static MakerPrice emulate(
            TradeSide side, BigDecimal requestedPrice, OrderBookSnapshot book, BigDecimal tick, BigDecimal bufferBps) {
        BigDecimal bid = positiveOrZero(book.getBid());
        BigDecimal ask = positiveOrZero(book.getAsk());
        BigDecimal reference = bid.signum() > 0 ? bid : ask.signum() > 0 ? ask : requestedPrice;
        BigDecimal pad = tick != null && tick.signum() > 0
                ? tick
                : reference.multiply(bufferBps).divide(BPS, MathContext.DECIMAL64);

        BigDecimal price = requestedPrice;
        if (side == TradeSide.BUY && bid.signum() > 0) {
            price = price.min(bid);
            if (ask.signum() > 0 && price.compareTo(ask) >= 0) {
                price = bid.subtract(pad).max(BigDecimal.ZERO);
            }
        } else if (side == TradeSide.SELL && ask.signum() > 0) {
            price = price.max(ask);
            if (bid.signum() > 0 && price.compareTo(bid) <= 0) {
                price = ask.add(pad);
            }
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("maker_emulation", true);
        details.put("requested_price", requestedPrice.toPlainString());
        details.put("best_bid", bid.toPlainString());
        details.put("best_ask", ask.toPlainString());
        details.put("tick_size", tick != null ? tick.toPlainString() : null);
        details.put("placed_price", price.toPlainString());
        return new MakerPrice(price, details);
    }

    private static BigDecimal positiveOrZero(BigDecimal value) {
        return value != null && value.signum() > 0 ? value : BigDecimal.ZERO;
    }

    /** Price to place plus the inputs that produced it, for the execution details. */
    public static final class MakerPrice {
        private final BigDecimal price;
        private final Map<String, Object> details;

        MakerPrice(BigDecimal price, Map<String, Object> details) {
            this.price = price;
            this.details = details;
        }

        public BigDecimal getPrice() {
            return price;
        }

        public Map<String, Object> getDetails() {
            return details;
        }
    }
}
