package com.tradeagent.reporting;

import com.tradeagent.domain.enums.TradeSide;
import com.tradeagent.domain.model.TradeResult;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Computes performance metrics from a time-ordered list of trades.
 *
 * <p>The equity curve is the running sum of realized PnL, one point per trade (buys add a
 * flat point). Drawdown is measured on that curve starting from its first point.
 */
@Component
public class PerformanceCalculator {

    private static final Logger log = LoggerFactory.getLogger(PerformanceCalculator.class);

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final int RATIO_SCALE = 6;
    private static final double SECONDS_PER_YEAR = 365.25 * 24 * 3600;

    public List<BigDecimal> equityCurve(List<TradeResult> trades) {
        List<BigDecimal> equity = new ArrayList<>(trades.size());
        BigDecimal running = BigDecimal.ZERO;
        for (TradeResult trade : trades) {
            running = running.add(pnl(trade));
            equity.add(running);
        }
        return equity;
    }

    /**
     * @param capital starting capital, used for return, CAGR and Sharpe
     * @param start start of the evaluated period, may be null
     * @param end end of the evaluated period, may be null
     */
    public PerformanceReport calculate(List<TradeResult> trades, BigDecimal capital, Instant start, Instant end) {
        List<BigDecimal> equity = equityCurve(trades);
        int numTrades = trades.size();

        BigDecimal totalPnl = BigDecimal.ZERO;
        BigDecimal grossProfit = BigDecimal.ZERO;
        BigDecimal grossLoss = BigDecimal.ZERO;
        BigDecimal turnover = BigDecimal.ZERO;
        BigDecimal fees = BigDecimal.ZERO;
        int wins = 0;
        for (TradeResult trade : trades) {
            BigDecimal pnl = pnl(trade);
            totalPnl = totalPnl.add(pnl);
            if (pnl.signum() > 0) {
                wins++;
                grossProfit = grossProfit.add(pnl);
            } else if (pnl.signum() < 0) {
                grossLoss = grossLoss.add(pnl.abs());
            }
            turnover = turnover.add(trade.getPrice().multiply(trade.getSize()));
            fees = fees.add(trade.getFee() != null ? trade.getFee() : BigDecimal.ZERO);
        }

        boolean hasCapital = capital != null && capital.signum() > 0;
        BigDecimal totalReturn = hasCapital ? totalPnl.divide(capital, MC) : BigDecimal.ZERO;
        BigDecimal winRate = numTrades > 0
                ? BigDecimal.valueOf(wins).divide(BigDecimal.valueOf(numTrades), RATIO_SCALE, RoundingMode.HALF_EVEN)
                : BigDecimal.ZERO;
        BigDecimal profitFactor = grossLoss.signum() > 0
                ? grossProfit.divide(grossLoss, RATIO_SCALE, RoundingMode.HALF_EVEN)
                : BigDecimal.ZERO;

        PerformanceReport report = PerformanceReport.builder()
                .totalPnl(totalPnl)
                .totalReturn(totalReturn)
                .cagr(hasCapital ? cagr(trades, totalReturn, start, end) : BigDecimal.ZERO)
                .sharpe(hasCapital ? sharpe(trades, capital) : BigDecimal.ZERO)
                .maxDrawdown(maxDrawdown(equity))
                .winRate(winRate)
                .profitFactor(profitFactor)
                .turnover(turnover)
                .fees(fees)
                .numTrades(numTrades)
                .build();

        log.debug("Performance over {} trades: pnl={}, maxDD={}", numTrades, totalPnl, report.getMaxDrawdown());
        return report;
    }

    /** Largest peak-to-trough fall of the equity curve. */
    BigDecimal maxDrawdown(List<BigDecimal> equity) {
        if (equity.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal peak = equity.get(0);
        BigDecimal maxDrawdown = BigDecimal.ZERO;
        for (BigDecimal value : equity) {
            peak = peak.max(value);
            maxDrawdown = maxDrawdown.max(peak.subtract(value));
        }
        return maxDrawdown;
    }

    /**
     * Mean over sample standard deviation of per-trade returns on capital, times sqrt(n).
     * Only sells realize PnL, so buys are not return observations. Zero with fewer than two
     * sells or no dispersion.
     */
    BigDecimal sharpe(List<TradeResult> trades, BigDecimal capital) {
        double capitalValue = capital.doubleValue();
        double[] returns = trades.stream()
                .filter(t -> t.getSide() == TradeSide.SELL)
                .mapToDouble(t -> pnl(t).doubleValue() / capitalValue)
                .toArray();
        int n = returns.length;
        if (n < 2) {
            return BigDecimal.ZERO;
        }
        double mean = 0;
        for (double r : returns) {
            mean += r;
        }
        mean /= n;
        double sumSquares = 0;
        for (double r : returns) {
            sumSquares += Math.pow(r - mean, 2);
        }
        double stdDev = Math.sqrt(sumSquares / (n - 1));
        if (stdDev == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(mean / stdDev * Math.sqrt(n)).setScale(RATIO_SCALE, RoundingMode.HALF_EVEN);
    }

    /** Annualized growth over the span covering the period bounds and every trade. */
    BigDecimal cagr(List<TradeResult> trades, BigDecimal totalReturn, Instant start, Instant end) {
        List<Instant> points = new ArrayList<>();
        trades.stream().map(TradeResult::getTimestamp).filter(ts -> ts != null).forEach(points::add);
        if (start != null) {
            points.add(start);
        }
        if (end != null) {
            points.add(end);
        }
        if (points.isEmpty()) {
            return BigDecimal.ZERO;
        }
        Instant first = points.stream().min(Instant::compareTo).get();
        Instant last = points.stream().max(Instant::compareTo).get();
        double years = Duration.between(first, last).getSeconds() / SECONDS_PER_YEAR;
        double growth = 1 + totalReturn.doubleValue();
        if (years <= 0 || growth <= 0) {
            return BigDecimal.ZERO;
        }
        double cagr = Math.pow(growth, 1 / years) - 1;
        if (!Double.isFinite(cagr)) {
            // Spans of minutes annualize to overflow; there is no meaningful rate to report.
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(cagr).setScale(RATIO_SCALE, RoundingMode.HALF_EVEN);
    }

    private static BigDecimal pnl(TradeResult trade) {
        return trade.getRealizedPnl() != null ? trade.getRealizedPnl() : BigDecimal.ZERO;
    }
}
