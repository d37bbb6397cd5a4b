package com.tradeagent.pnl;

import com.tradeagent.domain.model.PositionState;
import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Average-cost position ledger for a single symbol.
 *
 * <p>Buys add {@code price * size + fee} to the cost basis. Sells remove
 * {@code avgCost * size} from it and realize {@code (price - avgCost) * size - fee}.
 * A sell against a flat position is ignored. Used both when rebuilding position state from
 * stored fills and inside the backtest, so both paths account identically.
 *
 * <p>Not thread-safe.
 */
public class PositionLedger {

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal DUST = new BigDecimal("1e-12");

    private BigDecimal position = BigDecimal.ZERO;
    private BigDecimal costTotal = BigDecimal.ZERO;
    private BigDecimal realizedPnl = BigDecimal.ZERO;
    private BigDecimal feesPaid = BigDecimal.ZERO;

    public void applyBuy(BigDecimal size, BigDecimal price, BigDecimal fee) {
        costTotal = costTotal.add(price.multiply(size)).add(fee);
        position = position.add(size);
        feesPaid = feesPaid.add(fee);
    }

    /**
     * @return realized PnL of this sell, or zero when there was no position to sell
     */
    public BigDecimal applySell(BigDecimal size, BigDecimal price, BigDecimal fee) {
        if (position.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal avgCost = getAvgCost();
        BigDecimal pnl = price.subtract(avgCost).multiply(size).subtract(fee);
        costTotal = costTotal.subtract(avgCost.multiply(size));
        position = position.subtract(size);
        if (position.abs().compareTo(DUST) <= 0) {
            position = BigDecimal.ZERO;
            costTotal = BigDecimal.ZERO;
        }
        realizedPnl = realizedPnl.add(pnl);
        feesPaid = feesPaid.add(fee);
        return pnl;
    }

    public BigDecimal getPosition() {
        return position;
    }

    public BigDecimal getAvgCost() {
        return position.signum() > 0 ? costTotal.divide(position, MC) : BigDecimal.ZERO;
    }

    public BigDecimal getRealizedPnl() {
        return realizedPnl;
    }

    public BigDecimal getFeesPaid() {
        return feesPaid;
    }

    /** Mark-to-market PnL of the open long position; zero when flat. */
    public BigDecimal unrealizedPnl(BigDecimal markPrice) {
        if (position.signum() <= 0 || markPrice == null) {
            return BigDecimal.ZERO;
        }
        return markPrice.subtract(getAvgCost()).multiply(position);
    }

    public PositionState snapshot(String symbol) {
        return PositionState.builder()
                .symbol(symbol)
                .position(position)
                .avgCost(getAvgCost())
                .realizedPnl(realizedPnl)
                .build();
    }
}
