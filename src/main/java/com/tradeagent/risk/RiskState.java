package com.tradeagent.risk;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import lombok.Getter;
import lombok.ToString;

/**
 * Day-scoped risk state: realized PnL, execution count, last execution time and the
 * unrealized PnL of the open position.
 *
 * <p>Always scoped to one UTC calendar day. Live paths rebuild it from storage with
 * {@link #fromStorageSnapshot}; the backtest starts each day with {@link #freshForDay} and
 * carries it forward through {@link #afterExecution}. Instances are immutable.
 */
@Getter
@ToString
public final class RiskState {

    private final LocalDate day;
    private final BigDecimal dailyRealizedPnl;
    private final int executionsToday;
    private final Instant lastExecutionTime;
    private final BigDecimal unrealizedPnl;

    private RiskState(
            LocalDate day,
            BigDecimal dailyRealizedPnl,
            int executionsToday,
            Instant lastExecutionTime,
            BigDecimal unrealizedPnl) {
        this.day = day;
        this.dailyRealizedPnl = dailyRealizedPnl != null ? dailyRealizedPnl : BigDecimal.ZERO;
        this.executionsToday = executionsToday;
        this.lastExecutionTime = lastExecutionTime;
        this.unrealizedPnl = unrealizedPnl != null ? unrealizedPnl : BigDecimal.ZERO;
    }

    public static RiskState fromStorageSnapshot(
            LocalDate day,
            BigDecimal dailyRealizedPnl,
            int executionsToday,
            Instant lastExecutionTime,
            BigDecimal unrealizedPnl) {
        return new RiskState(day, dailyRealizedPnl, executionsToday, lastExecutionTime, unrealizedPnl);
    }

    /**
     * Empty state for a new day. The last execution time survives the reset so a cooldown
     * that started just before midnight still applies.
     */
    public static RiskState freshForDay(LocalDate day, Instant lastExecutionTime) {
        return new RiskState(day, BigDecimal.ZERO, 0, lastExecutionTime, BigDecimal.ZERO);
    }

    public static LocalDate utcDay(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).toLocalDate();
    }

    public boolean isFor(LocalDate otherDay) {
        return day.equals(otherDay);
    }

    public RiskState withUnrealizedPnl(BigDecimal unrealized) {
        return new RiskState(day, dailyRealizedPnl, executionsToday, lastExecutionTime, unrealized);
    }

    public RiskState afterExecution(Instant executedAt, BigDecimal realizedPnl) {
        return new RiskState(
                day,
                dailyRealizedPnl.add(realizedPnl != null ? realizedPnl : BigDecimal.ZERO),
                executionsToday + 1,
                executedAt,
                unrealizedPnl);
    }

    /** Realized PnL plus any unrealized loss; unrealized gains never offset realized losses. */
    public BigDecimal lossProxy() {
        return dailyRealizedPnl.add(unrealizedPnl.min(BigDecimal.ZERO));
    }
}
