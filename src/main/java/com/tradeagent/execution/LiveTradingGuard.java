package com.tradeagent.execution;

import com.tradeagent.config.TradeAgentProperties;
import com.tradeagent.market.MarketClient;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Extra preconditions for live orders: dry run off, live trading acknowledged in both the
 * configuration and the {@code I_UNDERSTAND_LIVE_TRADING} environment variable, and API
 * credentials present.
 */
@Component
public class LiveTradingGuard {

    public static final String ACK_ENV = "I_UNDERSTAND_LIVE_TRADING";

    private final TradeAgentProperties.Trading trading;
    private final MarketClient marketClient;
    private final UnaryOperator<String> environment;

    @Autowired
    public LiveTradingGuard(TradeAgentProperties properties, MarketClient marketClient) {
        this(properties, marketClient, System::getenv);
    }

    LiveTradingGuard(TradeAgentProperties properties, MarketClient marketClient, UnaryOperator<String> environment) {
        this.trading = properties.getTrading();
        this.marketClient = marketClient;
        this.environment = environment;
    }

    /** @return the reason live trading is refused, or empty when it is allowed */
    public Optional<String> refusal() {
        if (trading.isDryRun()) {
            return Optional.of("dry_run enabled");
        }
        boolean envAck = "true".equalsIgnoreCase(String.valueOf(environment.apply(ACK_ENV)).trim());
        if (!trading.isLiveTradingAcknowledged() || !envAck) {
            return Optional.of("live trading not acknowledged");
        }
        if (!marketClient.hasCredentials()) {
            return Optional.of("missing API credentials");
        }
        return Optional.empty();
    }
}
