package com.tradeagent.backtest;

import com.tradeagent.config.TradeAgentProperties;
import com.tradeagent.domain.enums.TradeSide;
import com.tradeagent.domain.model.Candle;
import com.tradeagent.domain.model.NewsFeatures;
import com.tradeagent.domain.model.NewsItem;
import com.tradeagent.domain.model.TradePlan;
import com.tradeagent.domain.model.TradeResult;
import com.tradeagent.news.FeatureSource;
import com.tradeagent.news.PointInTimeNewsFilter;
import com.tradeagent.pnl.PositionLedger;
import com.tradeagent.reporting.PerformanceCalculator;
import com.tradeagent.risk.RiskDecision;
import com.tradeagent.risk.RiskEngine;
import com.tradeagent.risk.RiskState;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Replays a strategy over historical candles through the same {@link RiskEngine} used live.
 *
 * <p>At each candle time {@code T}, in order:
 * <ol>
 *   <li>news items whose availability time has passed are released, then narrowed to the
 *       lookback window and aggregated into features</li>
 *   <li>the strategy sees the candles up to and including the current one</li>
 *   <li>the day-scoped risk state is reset when {@code T} enters a new UTC day</li>
 *   <li>unrealized PnL is marked at the current close</li>
 *   <li>the plan is risk-checked and, if approved, filled at the close adjusted by slippage</li>
 * </ol>
 *
 * <p>Buys only open from a flat position; sells close at most the open position. No clock and
 * no randomness: the same request always produces the same result.
 */
@Component
public class BacktestEngine {

    private static final Logger log = LoggerFactory.getLogger(BacktestEngine.class);

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal BPS = new BigDecimal("10000");

    private final RiskEngine riskEngine;
    private final FeatureSource featureSource;
    private final PerformanceCalculator performanceCalculator;

    public BacktestEngine(
            RiskEngine riskEngine, FeatureSource featureSource, PerformanceCalculator performanceCalculator) {
        this.riskEngine = riskEngine;
        this.featureSource = featureSource;
        this.performanceCalculator = performanceCalculator;
    }

    public BacktestResult run(BacktestRequest request) {
        List<Candle> candles = request.getCandles().stream()
                .sorted(Comparator.comparing(Candle::getTimestamp))
                .toList();
        PointInTimeNewsFilter newsFilter = request.getNewsFilter();
        List<NewsItem> pending = newsFilter.byAvailability(request.getNews());
        List<NewsItem> released = new ArrayList<>();
        int newsCursor = 0;

        TradeAgentProperties.Backtest costs = request.getCosts();
        BigDecimal feeRate = (costs.isAssumeTaker() ? costs.getTakerFeeBps() : costs.getMakerFeeBps())
                .divide(BPS, MC);
        BigDecimal slippage = costs.getSlippageBps().divide(BPS, MC);

        PositionLedger ledger = new PositionLedger();
        List<TradeResult> trades = new ArrayList<>();
        RiskState state = null;
        int rejections = 0;

        for (int idx = 0; idx < candles.size(); idx++) {
            Candle candle = candles.get(idx);
            Instant now = candle.getTimestamp();

            while (newsCursor < pending.size() && newsFilter.isAvailable(pending.get(newsCursor), now)) {
                released.add(pending.get(newsCursor++));
            }
            NewsFeatures features = featureSource.aggregate(newsFilter.usableAt(released, now));

            List<Candle> history = candles.subList(0, idx + 1);
            TradePlan plan = request.getStrategy()
                    .generatePlan(request.getSymbol(), history, request.getLimits(), features);

            LocalDate day = RiskState.utcDay(now);
            if (state == null || !state.isFor(day)) {
                state = RiskState.freshForDay(day, state != null ? state.getLastExecutionTime() : null);
            }

            BigDecimal price = candle.getClose();
            state = state.withUnrealizedPnl(ledger.unrealizedPnl(price));

            List<Candle> recent = history.subList(Math.max(0, history.size() - 2), history.size());
            RiskDecision decision = riskEngine.evaluate(
                    plan, request.getLimits(), request.getRules(), ledger.getPosition(), state, now, recent);
            if (decision.isRejected()) {
                if (!plan.isHold()) {
                    rejections++;
                }
                continue;
            }

            TradePlan approved = decision.getPlan();
            if (approved.getSide() == TradeSide.BUY && ledger.getPosition().signum() <= 0) {
                BigDecimal size = approved.getSize();
                BigDecimal execPrice = price.multiply(BigDecimal.ONE.add(slippage), MC);
                BigDecimal fee = execPrice.multiply(size).multiply(feeRate, MC);
                ledger.applyBuy(size, execPrice, fee);
                state = state.afterExecution(now, BigDecimal.ZERO);
                trades.add(trade(trades.size(), request.getSymbol(), TradeSide.BUY, size, execPrice, fee,
                        BigDecimal.ZERO, now));
            } else if (approved.getSide() == TradeSide.SELL && ledger.getPosition().signum() > 0) {
                BigDecimal size = approved.getSize().min(ledger.getPosition());
                BigDecimal execPrice = price.multiply(BigDecimal.ONE.subtract(slippage), MC);
                BigDecimal fee = execPrice.multiply(size).multiply(feeRate, MC);
                BigDecimal pnl = ledger.applySell(size, execPrice, fee);
                state = state.afterExecution(now, pnl);
                trades.add(trade(trades.size(), request.getSymbol(), TradeSide.SELL, size, execPrice, fee, pnl, now));
            }
        }

        log.info(
                "Backtest {} on {}: {} candles, {} trades, {} risk rejections",
                request.getStrategy().getName(),
                request.getSymbol(),
                candles.size(),
                trades.size(),
                rejections);

        return BacktestResult.builder()
                .symbol(request.getSymbol())
                .strategy(request.getStrategy().getName())
                .candlesProcessed(candles.size())
                .riskRejections(rejections)
                .report(performanceCalculator.calculate(
                        trades, request.getLimits().getCapital(), request.getFrom(), request.getTo()))
                .equityCurve(performanceCalculator.equityCurve(trades))
                .trades(trades)
                .build();
    }

    private static TradeResult trade(
            int sequence,
            String symbol,
            TradeSide side,
            BigDecimal size,
            BigDecimal price,
            BigDecimal fee,
            BigDecimal pnl,
            Instant timestamp) {
        return TradeResult.builder()
                .tradeId("bt-" + (sequence + 1))
                .symbol(symbol)
                .side(side)
                .size(size)
                .price(price)
                .fee(fee)
                .realizedPnl(pnl)
                .timestamp(timestamp)
                .build();
    }
}
