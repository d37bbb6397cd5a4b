package com.tradeagent.strategy;

import com.tradeagent.config.TradeAgentProperties;
import com.tradeagent.domain.model.Candle;
import com.tradeagent.domain.model.NewsFeatures;
import com.tradeagent.domain.model.TradePlan;
import com.tradeagent.risk.RiskLimits;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Baseline signal scaled by news sentiment.
 *
 * <p>Strong positive sentiment boosts size and confidence, strong negative sentiment cuts both.
 * Confidence stays within [0.1, 0.95]. A baseline HOLD is passed through untouched.
 */
public class NewsOverlayStrategy implements TradingStrategy {

    public static final String NAME = "news_overlay";

    private static final BigDecimal MIN_CONFIDENCE = new BigDecimal("0.1");
    private static final BigDecimal MAX_CONFIDENCE = new BigDecimal("0.95");

    private final BaselineStrategy baseline;
    private final TradeAgentProperties.Strategy config;

    public NewsOverlayStrategy(BaselineStrategy baseline, TradeAgentProperties.Strategy config) {
        this.baseline = baseline;
        this.config = config;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public TradePlan generatePlan(String symbol, List<Candle> candles, RiskLimits limits, NewsFeatures features) {
        TradePlan base = baseline.generatePlan(symbol, candles, limits, features);
        if (base.isHold()) {
            return base;
        }

        BigDecimal sentiment = features.getSentimentWeighted() != null
                ? features.getSentimentWeighted()
                : BigDecimal.ZERO;
        BigDecimal size = base.getSize();
        BigDecimal confidence = base.getConfidence();
        String rationale = base.getRationale();
        String sentimentText = sentiment.setScale(2, RoundingMode.HALF_EVEN).toPlainString();

        if (sentiment.compareTo(config.getSentimentBoostThreshold()) >= 0) {
            size = size.multiply(config.getBoostMultiplier());
            confidence = confidence.add(config.getConfidenceStep()).min(MAX_CONFIDENCE);
            rationale = rationale + "; sentiment boost " + sentimentText;
        } else if (sentiment.compareTo(config.getSentimentCutThreshold()) <= 0) {
            size = size.multiply(config.getCutMultiplier());
            confidence = confidence.subtract(config.getConfidenceStep()).max(MIN_CONFIDENCE);
            rationale = rationale + "; sentiment cut " + sentimentText;
        }

        return base.toBuilder()
                .size(size)
                .confidence(confidence)
                .rationale(rationale)
                .strategy(NAME)
                .build();
    }
}
