package com.tradeagent.backtest;

import com.tradeagent.config.TradeAgentProperties;
import com.tradeagent.domain.model.Candle;
import com.tradeagent.domain.model.NewsItem;
import com.tradeagent.news.PointInTimeNewsFilter;
import com.tradeagent.risk.RiskLimits;
import com.tradeagent.risk.TradingRules;
import com.tradeagent.strategy.TradingStrategy;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Everything a backtest reads. The engine touches nothing outside this object. */
@Data
@Builder
public class BacktestRequest {

    private String symbol;
    private List<Candle> candles;

    /** Every candidate news item; availability is decided per candle. */
    private List<NewsItem> news;

    private TradingStrategy strategy;
    private RiskLimits limits;
    private TradingRules rules;
    private PointInTimeNewsFilter newsFilter;
    private TradeAgentProperties.Backtest costs;

    /** Period bounds, used for CAGR. */
    private Instant from;

    private Instant to;
}
