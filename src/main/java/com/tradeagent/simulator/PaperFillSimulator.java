package com.tradeagent.simulator;

import com.tradeagent.domain.enums.ExecutionStatus;
import com.tradeagent.domain.enums.TradeSide;
import com.tradeagent.domain.model.OrderBookSnapshot;
import com.tradeagent.domain.model.OrderIntent;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.Random;

/**
 * Paper fill model for a single limit order against top of book.
 *
 * <p>Fill logic:
 * <ul>
 *   <li>BUY crossing (limit &gt;= ask): fills at ask * (1 + slippage) unless that is above the
 *       limit, in which case the order stays open</li>
 *   <li>SELL crossing (limit &lt;= bid): fills at bid * (1 - slippage) unless that is below the
 *       limit, in which case the order stays open</li>
 *   <li>otherwise: fills at the limit price with a fixed probability per attempt</li>
 * </ul>
 * Fees are {@code price * size * feeBps / 10000}.
 *
 * <p>Deterministic for a given seed and sequence of calls. Not thread-safe; the execution
 * engine serializes access.
 */
public class PaperFillSimulator {

    private static final BigDecimal BPS = new BigDecimal("10000");
    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final MathContext MC = MathContext.DECIMAL64;

    private final Random random;
    private final BigDecimal slippageRate;
    private final BigDecimal feeRate;
    private final double fillProbability;
    private final String feeCurrency;

    public PaperFillSimulator(
            long seed, BigDecimal slippageBps, BigDecimal feeBps, double fillProbability, String feeCurrency) {
        this.random = new Random(seed);
        this.slippageRate = slippageBps.divide(BPS, MC);
        this.feeRate = feeBps.divide(BPS, MC);
        this.fillProbability = fillProbability;
        this.feeCurrency = feeCurrency;
    }

    /** Synthetic book of {@code price} plus or minus half the spread, used when no snapshot is stored. */
    public static OrderBookSnapshot syntheticBook(String symbol, BigDecimal price, BigDecimal spreadBps, Instant ts) {
        BigDecimal halfSpread = price.multiply(spreadBps).divide(BPS, MC).divide(TWO, MC);
        return OrderBookSnapshot.builder()
                .symbol(symbol)
                .timestamp(ts)
                .bid(price.subtract(halfSpread).max(BigDecimal.ZERO))
                .ask(price.add(halfSpread))
                .lastPrice(price)
                .build();
    }

    public PaperFill simulate(OrderIntent intent, OrderBookSnapshot book) {
        BigDecimal limit = intent.getPrice();
        BigDecimal size = intent.getSize();

        if (intent.getSide() == TradeSide.BUY && book.getAsk() != null && limit.compareTo(book.getAsk()) >= 0) {
            BigDecimal fillPrice = book.getAsk().multiply(BigDecimal.ONE.add(slippageRate), MC);
            if (fillPrice.compareTo(limit) > 0) {
                return PaperFill.notFilled("limit too low");
            }
            return filled(fillPrice, size, "crossed spread");
        }

        if (intent.getSide() == TradeSide.SELL && book.getBid() != null && limit.compareTo(book.getBid()) <= 0) {
            BigDecimal fillPrice = book.getBid().multiply(BigDecimal.ONE.subtract(slippageRate), MC);
            if (fillPrice.compareTo(limit) < 0) {
                return PaperFill.notFilled("limit too high");
            }
            return filled(fillPrice, size, "crossed spread");
        }

        if (intent.getSide() == TradeSide.HOLD) {
            return new PaperFill(
                    false, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, ExecutionStatus.REJECTED, "invalid side");
        }

        if (random.nextDouble() <= fillProbability) {
            return filled(limit, size, "probabilistic fill");
        }
        return PaperFill.notFilled("not filled");
    }

    public String getFeeCurrency() {
        return feeCurrency;
    }

    private PaperFill filled(BigDecimal price, BigDecimal size, String message) {
        BigDecimal fee = price.multiply(size).multiply(feeRate, MC);
        return new PaperFill(true, price, size, fee, ExecutionStatus.FILLED, message);
    }
}
