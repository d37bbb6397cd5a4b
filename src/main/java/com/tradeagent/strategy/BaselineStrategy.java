package com.tradeagent.strategy;

import com.tradeagent.config.TradeAgentProperties;
import com.tradeagent.domain.enums.TradeSide;
import com.tradeagent.domain.model.Candle;
import com.tradeagent.domain.model.NewsFeatures;
import com.tradeagent.domain.model.TradePlan;
import com.tradeagent.risk.RiskLimits;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

/**
 * SMA plus momentum trend follower.
 *
 * <p>Buys when the last close is above its SMA and momentum is positive, sells when both are
 * negative, otherwise holds. Size targets {@code capital * basePositionPct} of notional at the
 * last close. Needs {@code max(smaWindow, momentumWindow) + 1} candles.
 */
public class BaselineStrategy implements TradingStrategy {

    public static final String NAME = "baseline";

    private static final MathContext MC = MathContext.DECIMAL64;

    private final TradeAgentProperties.Strategy config;

    public BaselineStrategy(TradeAgentProperties.Strategy config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public TradePlan generatePlan(String symbol, List<Candle> candles, RiskLimits limits, NewsFeatures features) {
        int smaWindow = config.getSmaWindow();
        int momentumWindow = config.getMomentumWindow();
        if (candles.size() < Math.max(smaWindow, momentumWindow) + 1) {
            return TradePlan.hold(symbol, NAME, "insufficient data");
        }

        int last = candles.size() - 1;
        BigDecimal current = candles.get(last).getClose();
        BigDecimal sma = sma(candles, smaWindow);
        BigDecimal momentum = current.subtract(candles.get(last - momentumWindow).getClose());

        if (current.signum() <= 0) {
            return TradePlan.hold(symbol, NAME, "non-positive price");
        }
        BigDecimal size = limits.getCapital()
                .multiply(config.getBasePositionPct())
                .divide(current, MC);

        String smaText = sma.setScale(2, RoundingMode.HALF_EVEN).toPlainString();
        String momentumText = momentum.setScale(2, RoundingMode.HALF_EVEN).toPlainString();

        if (current.compareTo(sma) > 0 && momentum.signum() > 0) {
            return plan(symbol, TradeSide.BUY, size, current, "price>" + smaText + ", momentum=" + momentumText);
        }
        if (current.compareTo(sma) < 0 && momentum.signum() < 0) {
            return plan(symbol, TradeSide.SELL, size, current, "price<" + smaText + ", momentum=" + momentumText);
        }
        return TradePlan.hold(
                symbol,
                NAME,
                "no signal (price=" + current.setScale(2, RoundingMode.HALF_EVEN).toPlainString() + ", sma=" + smaText
                        + ")");
    }

    private TradePlan plan(String symbol, TradeSide side, BigDecimal size, BigDecimal price, String rationale) {
        return TradePlan.builder()
                .symbol(symbol)
                .side(side)
                .size(size)
                .price(price)
                .confidence(config.getBaseConfidence())
                .rationale(rationale)
                .strategy(NAME)
                .build();
    }

    static BigDecimal sma(List<Candle> candles, int window) {
        BigDecimal sum = BigDecimal.ZERO;
        for (int i = candles.size() - window; i < candles.size(); i++) {
            sum = sum.add(candles.get(i).getClose());
        }
        return sum.divide(BigDecimal.valueOf(window), MC);
    }
}
