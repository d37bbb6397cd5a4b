package com.tradeagent.risk;

import com.tradeagent.domain.enums.TradeSide;
import com.tradeagent.domain.model.Candle;
import com.tradeagent.domain.model.TradePlan;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Pre-trade risk gate shared by proposal, execution and backtest.
 *
 * <p>Pure: no I/O, no clock. Everything it needs (position, day state, the time, the
 * point-in-time candles used for the volatility bypass) is passed in. Checks run in a fixed
 * order and the first failing check wins:
 * <ol>
 *   <li>HOLD plans are never approved</li>
 *   <li>kill switch</li>
 *   <li>symbol whitelist</li>
 *   <li>positive size and price</li>
 *   <li>daily loss: realized + min(unrealized, 0) at or below -|maxLossPerDay|</li>
 *   <li>max orders per day</li>
 *   <li>cooldown since the last execution, lifted by a large enough close-to-close move</li>
 *   <li>no selling without a position (degrades to HOLD when long-only)</li>
 *   <li>position cap: buys are truncated to the remaining headroom</li>
 *   <li>notional cap: min(maxOrderNotional, maxLossPerTrade)</li>
 *   <li>a plan truncated to zero is rejected</li>
 * </ol>
 *
 * <p>Truncation only ever reduces size.
 */
@Component
public class RiskEngine {

    /** Tolerance for size equality, e.g. when re-validating an intent at execution time. */
    public static final BigDecimal SIZE_EPSILON = new BigDecimal("1e-9");

    static final MathContext MC = MathContext.DECIMAL64;

    public RiskDecision evaluate(
            TradePlan plan,
            RiskLimits limits,
            TradingRules rules,
            BigDecimal currentPosition,
            RiskState state,
            Instant now,
            List<Candle> recentCandles) {

        if (plan.isHold()) {
            return RiskDecision.rejected(RiskViolation.of("NO_TRADE", "no trade"), plan);
        }

        if (rules.isKillSwitch()) {
            return RiskDecision.rejected(RiskViolation.of("KILL_SWITCH", "kill switch enabled"));
        }

        if (rules.getWhitelist() == null || !rules.getWhitelist().contains(plan.getSymbol())) {
            return RiskDecision.rejected(RiskViolation.of("SYMBOL_NOT_WHITELISTED", "symbol not whitelisted"));
        }

        if (!isPositive(plan.getSize()) || !isPositive(plan.getPrice())) {
            return RiskDecision.rejected(RiskViolation.of("INVALID_SIZE_OR_PRICE", "invalid size or price"));
        }

        BigDecimal dailyLossFloor = limits.getMaxLossPerDay().abs().negate();
        if (state.lossProxy().compareTo(dailyLossFloor) <= 0) {
            return RiskDecision.rejected(RiskViolation.of("DAILY_LOSS_LIMIT", "daily loss limit reached"));
        }

        if (state.getExecutionsToday() >= limits.getMaxOrdersPerDay()) {
            return RiskDecision.rejected(RiskViolation.of("MAX_ORDERS_PER_DAY", "max orders per day reached"));
        }

        if (isCoolingDown(state, limits, now) && !volatilityBypass(recentCandles, limits.getCooldownBypassPct())) {
            return RiskDecision.rejected(RiskViolation.of("COOLDOWN", "cooldown active"));
        }

        BigDecimal position = currentPosition != null ? currentPosition : BigDecimal.ZERO;
        if (plan.getSide() == TradeSide.SELL && position.signum() <= 0) {
            if (rules.isLongOnly()) {
                String reason = "long-only: no position to sell";
                return RiskDecision.rejected(
                        RiskViolation.of("LONG_ONLY", reason),
                        TradePlan.hold(plan.getSymbol(), plan.getStrategy(), reason));
            }
            return RiskDecision.rejected(RiskViolation.of("NO_POSITION", "no position to sell"));
        }

        BigDecimal size = plan.getSize();

        BigDecimal maxPositionSize =
                limits.getCapital().multiply(limits.getMaxPositionPct()).divide(plan.getPrice(), MC);
        if (plan.getSide() == TradeSide.BUY && position.add(size).compareTo(maxPositionSize) > 0) {
            size = maxPositionSize.subtract(position).max(BigDecimal.ZERO);
        }

        BigDecimal notionalCap = limits.getMaxOrderNotional().min(limits.getMaxLossPerTrade());
        if (size.multiply(plan.getPrice()).compareTo(notionalCap) > 0) {
            size = notionalCap.divide(plan.getPrice(), MC).min(size);
        }

        if (size.signum() <= 0) {
            return RiskDecision.rejected(RiskViolation.of("SIZE_ZERO", "size reduced to zero"));
        }

        return RiskDecision.approved(plan.toBuilder().size(size).build());
    }

    /** True when the two sizes differ by no more than {@link #SIZE_EPSILON}. */
    public static boolean sameSize(BigDecimal a, BigDecimal b) {
        return a.subtract(b).abs().compareTo(SIZE_EPSILON) <= 0;
    }

    // ========================
    // COOLDOWN
    // ========================

    private boolean isCoolingDown(RiskState state, RiskLimits limits, Instant now) {
        Instant lastExecution = state.getLastExecutionTime();
        if (lastExecution == null || limits.getCooldownMinutes() <= 0) {
            return false;
        }
        return now.isBefore(lastExecution.plus(Duration.ofMinutes(limits.getCooldownMinutes())));
    }

    /**
     * Compares the two most recent closes in {@code recentCandles} (ordered oldest first).
     * Callers pass only candles visible at decision time, so a backtest never peeks ahead.
     */
    boolean volatilityBypass(List<Candle> recentCandles, BigDecimal bypassPct) {
        if (bypassPct == null || bypassPct.signum() <= 0 || recentCandles == null || recentCandles.size() < 2) {
            return false;
        }
        BigDecimal previous = recentCandles.get(recentCandles.size() - 2).getClose();
        BigDecimal latest = recentCandles.get(recentCandles.size() - 1).getClose();
        if (previous == null || latest == null || previous.signum() <= 0) {
            return false;
        }
        BigDecimal move = latest.subtract(previous).abs().divide(previous, MC);
        return move.compareTo(bypassPct) >= 0;
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
