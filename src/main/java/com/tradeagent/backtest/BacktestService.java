package com.tradeagent.backtest;

import com.tradeagent.config.TradeAgentProperties;
import com.tradeagent.domain.model.Candle;
import com.tradeagent.domain.model.NewsItem;
import com.tradeagent.exception.BusinessException;
import com.tradeagent.exception.ErrorCode;
import com.tradeagent.news.PointInTimeNewsFilter;
import com.tradeagent.reporting.ReportWriter;
import com.tradeagent.risk.RiskLimits;
import com.tradeagent.risk.TradingRules;
import com.tradeagent.store.TradeStore;
import com.tradeagent.strategy.StrategyRegistry;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Loads history from the store, runs {@link BacktestEngine} and writes the report files.
 *
 * <p>The date range is inclusive in UTC: {@code from} 00:00:00 to {@code to} 23:59:59.
 */
@Service
public class BacktestService {

    private static final Logger log = LoggerFactory.getLogger(BacktestService.class);

    private final TradeStore tradeStore;
    private final BacktestEngine backtestEngine;
    private final StrategyRegistry strategyRegistry;
    private final PointInTimeNewsFilter newsFilter;
    private final ReportWriter reportWriter;
    private final RiskLimits riskLimits;
    private final TradingRules tradingRules;
    private final TradeAgentProperties properties;

    public BacktestService(
            TradeStore tradeStore,
            BacktestEngine backtestEngine,
            StrategyRegistry strategyRegistry,
            PointInTimeNewsFilter newsFilter,
            ReportWriter reportWriter,
            RiskLimits riskLimits,
            TradingRules tradingRules,
            TradeAgentProperties properties) {
        this.tradeStore = tradeStore;
        this.backtestEngine = backtestEngine;
        this.strategyRegistry = strategyRegistry;
        this.newsFilter = newsFilter;
        this.reportWriter = reportWriter;
        this.riskLimits = riskLimits;
        this.tradingRules = tradingRules;
        this.properties = properties;
    }

    /**
     * @throws BusinessException when the range is inverted or holds no candles
     */
    public BacktestResult run(String symbol, String strategyName, LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Backtest range ends before it starts");
        }
        Instant start = from.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant end = to.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusSeconds(1);
        String timeframe = properties.getTrading().primaryTimeframe();

        List<Candle> candles = tradeStore.candlesBetween(symbol, timeframe, start, end);
        if (candles.isEmpty()) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR, "No " + timeframe + " candles for " + symbol + " between " + from + " and " + to);
        }
        List<NewsItem> news = tradeStore.newsCandidates(start.minus(newsFilter.getLookback()), end);

        log.info("Backtesting {} on {} {} from {} to {} ({} candles, {} news items)",
                strategyName, symbol, timeframe, from, to, candles.size(), news.size());

        BacktestResult result = backtestEngine.run(BacktestRequest.builder()
                .symbol(symbol)
                .candles(candles)
                .news(news)
                .strategy(strategyRegistry.get(strategyName))
                .limits(riskLimits)
                .rules(tradingRules)
                .newsFilter(newsFilter)
                .costs(properties.getBacktest())
                .from(start)
                .to(end)
                .build());

        ReportWriter.ReportFiles files = reportWriter.write(
                result.getReport(),
                result.getEquityCurve(),
                Path.of(properties.getBacktest().getOutputDirectory()),
                "backtest_" + result.getStrategy());
        return result.toBuilder().reportFiles(files).build();
    }
}
