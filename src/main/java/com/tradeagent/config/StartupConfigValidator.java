package com.tradeagent.config;

import com.tradeagent.domain.enums.TradingMode;
import com.tradeagent.exception.ConfigurationException;
import com.tradeagent.market.CandleSynthesizer;
import com.tradeagent.market.PaperMarketClient;
import com.tradeagent.strategy.StrategyRegistry;
import jakarta.annotation.PostConstruct;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Validates configuration once at startup, before the runner or any request can act on it.
 *
 * <p>All problems are collected and reported together in one {@link ConfigurationException},
 * which fails context startup.
 */
@Component
public class StartupConfigValidator {

    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    private static final Pattern SYMBOL = Pattern.compile("^[A-Z0-9]+/[A-Z0-9]+$");
    private static final Pattern SHA256_HEX = Pattern.compile("^[0-9a-fA-F]{64}$");

    private final TradeAgentProperties properties;
    private final StrategyRegistry strategyRegistry;

    public StartupConfigValidator(TradeAgentProperties properties, StrategyRegistry strategyRegistry) {
        this.properties = properties;
        this.strategyRegistry = strategyRegistry;
    }

    @PostConstruct
    public void validate() {
        List<String> problems = problems(properties, strategyRegistry);
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new ConfigurationException(problems);
        }
        TradeAgentProperties.Trading trading = properties.getTrading();
        log.info(
                "Configuration valid: exchange={}, whitelist={}, dryRun={}, requireApproval={}, killSwitch={}",
                properties.getExchange().getName(),
                trading.getWhitelist(),
                trading.isDryRun(),
                trading.isRequireApproval(),
                trading.isKillSwitch());
        if (!trading.isRequireApproval()) {
            log.warn("Approval is NOT required: intents can execute without a human approval phrase");
        }
    }

    public static List<String> problems(TradeAgentProperties properties, StrategyRegistry strategyRegistry) {
        List<String> problems = new ArrayList<>();
        TradeAgentProperties.Trading trading = properties.getTrading();
        TradeAgentProperties.Risk risk = properties.getRisk();

        if (trading.getWhitelist().isEmpty()) {
            problems.add("trading.whitelist must name at least one symbol");
        }
        trading.getWhitelist().stream()
                .filter(symbol -> !SYMBOL.matcher(symbol).matches())
                .forEach(symbol -> problems.add("trading.whitelist symbol '" + symbol + "' is not BASE/QUOTE"));
        properties.getAutopilot().getWhitelist().stream()
                .filter(symbol -> !SYMBOL.matcher(symbol).matches())
                .forEach(symbol -> problems.add("autopilot.whitelist symbol '" + symbol + "' is not BASE/QUOTE"));

        if (trading.getTimeframes().isEmpty()) {
            problems.add("trading.timeframes must name at least one timeframe");
        }
        for (String timeframe : trading.getTimeframes()) {
            try {
                CandleSynthesizer.timeframeDuration(timeframe);
            } catch (IllegalArgumentException e) {
                problems.add("trading.timeframes: unsupported timeframe '" + timeframe + "'");
            }
        }

        if (trading.isRequireApproval() && !hasApprovalTarget(trading)) {
            problems.add("trading.approvalPhraseHash (64 hex chars) or trading.approvalPhrase is required when approval is required");
        }
        if (trading.getOrderTimeoutSeconds() <= 0) {
            problems.add("trading.orderTimeoutSeconds must be positive");
        }
        if (trading.getIntentExpirySeconds() <= 0) {
            problems.add("trading.intentExpirySeconds must be positive");
        }

        if (risk.getCapital() == null || risk.getCapital().signum() <= 0) {
            problems.add("risk.capital must be positive");
        } else if (risk.getMaxOrderNotional().compareTo(risk.getCapital()) > 0) {
            problems.add("risk.maxOrderNotional must not exceed risk.capital");
        }
        requireFraction(problems, "risk.maxPositionPct", risk.getMaxPositionPct());
        requireFraction(problems, "risk.cooldownBypassPct", risk.getCooldownBypassPct());
        if (risk.getMaxOrdersPerDay() < 0 || risk.getCooldownMinutes() < 0) {
            problems.add("risk.maxOrdersPerDay and risk.cooldownMinutes must not be negative");
        }

        double fillProbability = properties.getPaper().getFillProbability();
        if (fillProbability < 0 || fillProbability > 1) {
            problems.add("paper.fillProbability must be within [0, 1]");
        }

        String exchange = properties.getExchange().getName();
        if (exchange == null || !PaperMarketClient.NAME.equals(exchange.trim().toLowerCase(Locale.ROOT))) {
            problems.add("exchange.name '" + exchange + "' is not supported");
        }

        TradeAgentProperties.Runner runner = properties.getRunner();
        try {
            TradingMode.fromWire(runner.getMode());
        } catch (IllegalArgumentException | NullPointerException e) {
            problems.add("runner.mode must be paper or live");
        }
        if (!strategyRegistry.names().contains(runner.getStrategy())) {
            problems.add("runner.strategy '" + runner.getStrategy() + "' is unknown; known: " + strategyRegistry.names());
        }
        if (runner.getMaxBackoffSeconds() < 1) {
            problems.add("runner.maxBackoffSeconds must be at least 1");
        }
        return problems;
    }

    private static boolean hasApprovalTarget(TradeAgentProperties.Trading trading) {
        String hash = trading.getApprovalPhraseHash();
        if (hash != null && !hash.isBlank()) {
            return SHA256_HEX.matcher(hash.trim()).matches();
        }
        return trading.getApprovalPhrase() != null && !trading.getApprovalPhrase().isBlank();
    }

    private static void requireFraction(List<String> problems, String key, BigDecimal value) {
        if (value == null || value.signum() <= 0 || value.compareTo(BigDecimal.ONE) > 0) {
            problems.add(key + " must be within (0, 1]");
        }
    }
}
