package com.tradeagent.strategy;

import com.tradeagent.config.TradeAgentProperties;
import com.tradeagent.exception.ConfigurationException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Resolves strategies by name. */
@Component
public class StrategyRegistry {

    private final Map<String, TradingStrategy> strategies = new LinkedHashMap<>();

    public StrategyRegistry(TradeAgentProperties properties) {
        BaselineStrategy baseline = new BaselineStrategy(properties.getStrategy());
        register(baseline);
        register(new NewsOverlayStrategy(baseline, properties.getStrategy()));
    }

    private void register(TradingStrategy strategy) {
        strategies.put(strategy.getName(), strategy);
    }

    /**
     * @throws ConfigurationException when no strategy has that name
     */
    public TradingStrategy get(String name) {
        TradingStrategy strategy = strategies.get(name);
        if (strategy == null) {
            throw new ConfigurationException("Unknown strategy: " + name + " (known: " + strategies.keySet() + ")");
        }
        return strategy;
    }

    public Set<String> names() {
        return strategies.keySet();
    }
}
