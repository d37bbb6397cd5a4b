package com.tradeagent.strategy;

import com.tradeagent.domain.model.Candle;
import com.tradeagent.domain.model.NewsFeatures;
import com.tradeagent.domain.model.TradePlan;
import com.tradeagent.risk.RiskLimits;
import java.util.List;

/**
 * Produces a candidate {@link TradePlan} from a candle history.
 *
 * <p>Implementations must only look at the candles and features they are given. The backtest
 * hands them a history that ends at the candle being decided, so reading anything else
 * would leak future data into past decisions.
 */
public interface TradingStrategy {

    String getName();

    /**
     * @param candles history oldest first, ending with the latest closed candle
     * @param features point-in-time news features, never null
     */
    TradePlan generatePlan(String symbol, List<Candle> candles, RiskLimits limits, NewsFeatures features);
}
