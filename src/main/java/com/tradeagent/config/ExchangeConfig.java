package com.tradeagent.config;

import com.tradeagent.exception.ConfigurationException;
import com.tradeagent.market.MarketClient;
import com.tradeagent.market.PaperMarketClient;
import com.tradeagent.simulator.PaperFillSimulator;
import java.time.Clock;
import java.util.Locale;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link MarketClient} named by {@code tradeagent.exchange.name} and the seeded
 * {@link PaperFillSimulator} used for paper-mode execution.
 *
 * <p>An unsupported name fails context startup with a {@link ConfigurationException}
 * rather than surfacing later inside a runner cycle.
 */
@Configuration
public class ExchangeConfig {

    @Bean
    public MarketClient marketClient(TradeAgentProperties properties, Clock clock) {
        TradeAgentProperties.Exchange exchange = properties.getExchange();
        String name = exchange.getName() == null ? "" : exchange.getName().trim().toLowerCase(Locale.ROOT);
        if (PaperMarketClient.NAME.equals(name)) {
            return new PaperMarketClient(
                    clock,
                    properties.getPaper().getSeed(),
                    exchange.getPaperStartPrice(),
                    exchange.getPaperVolatilityBps(),
                    properties.getPaper().getSpreadBps(),
                    exchange.getPaperPriceTick(),
                    hasText(exchange.getApiKey()) && hasText(exchange.getApiSecret()));
        }
        throw new ConfigurationException("Unsupported exchange: '" + exchange.getName() + "' (supported: paper)");
    }

    @Bean
    public PaperFillSimulator paperFillSimulator(TradeAgentProperties properties) {
        TradeAgentProperties.Paper paper = properties.getPaper();
        return new PaperFillSimulator(
                paper.getSeed(),
                paper.getSlippageBps(),
                paper.getFeeBps(),
                paper.getFillProbability(),
                paper.getFeeCurrency());
    }

    static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
