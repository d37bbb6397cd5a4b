package com.tradeagent.config;

import com.tradeagent.risk.RiskLimits;
import com.tradeagent.risk.TradingRules;
import java.util.Set;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the global {@link RiskLimits} and {@link TradingRules} beans from
 * {@code tradeagent.risk.*} and {@code tradeagent.trading.*}.
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskLimits riskLimits(TradeAgentProperties properties) {
        TradeAgentProperties.Risk risk = properties.getRisk();
        return RiskLimits.builder()
                .capital(risk.getCapital())
                .maxPositionPct(risk.getMaxPositionPct())
                .maxOrderNotional(risk.getMaxOrderNotional())
                .maxLossPerTrade(risk.getMaxLossPerTrade())
                .maxLossPerDay(risk.getMaxLossPerDay())
                .maxOrdersPerDay(risk.getMaxOrdersPerDay())
                .cooldownMinutes(risk.getCooldownMinutes())
                .cooldownBypassPct(risk.getCooldownBypassPct())
                .build();
    }

    @Bean
    public TradingRules tradingRules(TradeAgentProperties properties) {
        TradeAgentProperties.Trading trading = properties.getTrading();
        return TradingRules.builder()
                .killSwitch(trading.isKillSwitch())
                .whitelist(Set.copyOf(trading.getWhitelist()))
                .longOnly(trading.isLongOnly())
                .build();
    }
}
