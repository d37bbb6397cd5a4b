package com.tradeagent.unit.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradeagent.config.StartupConfigValidator;
import com.tradeagent.config.TradeAgentProperties;
import com.tradeagent.exception.ConfigurationException;
import com.tradeagent.strategy.StrategyRegistry;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StartupConfigValidatorTest {

    private TradeAgentProperties properties;
    private StrategyRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new TradeAgentProperties();
        registry = new StrategyRegistry(properties);
    }

    @Test
    @DisplayName("Defaults are valid")
    void defaultsValid() {
        assertThat(StartupConfigValidator.problems(properties, registry)).isEmpty();
    }

    @Test
    @DisplayName("Malformed symbols and timeframes are reported")
    void symbolsAndTimeframes() {
        properties.getTrading().setWhitelist(List.of("BTCJPY"));
        properties.getTrading().setTimeframes(List.of("1m", "abc"));

        assertThat(StartupConfigValidator.problems(properties, registry))
                .anyMatch(p -> p.contains("'BTCJPY' is not BASE/QUOTE"))
                .anyMatch(p -> p.contains("unsupported timeframe 'abc'"));
    }

    @Test
    @DisplayName("Approval needs a phrase or a well-formed hash")
    void approvalTarget() {
        properties.getTrading().setApprovalPhrase(" ");
        assertThat(StartupConfigValidator.problems(properties, registry))
                .anyMatch(p -> p.startsWith("trading.approvalPhraseHash"));

        properties.getTrading().setApprovalPhraseHash("not-a-hash");
        assertThat(StartupConfigValidator.problems(properties, registry))
                .anyMatch(p -> p.startsWith("trading.approvalPhraseHash"));

        properties.getTrading().setApprovalPhraseHash("a".repeat(64));
        assertThat(StartupConfigValidator.problems(properties, registry)).isEmpty();

        properties.getTrading().setApprovalPhraseHash(null);
        properties.getTrading().setRequireApproval(false);
        assertThat(StartupConfigValidator.problems(properties, registry)).isEmpty();
    }

    @Test
    @DisplayName("Risk limits are range checked")
    void riskRanges() {
        properties.getRisk().setMaxPositionPct(new BigDecimal("1.5"));
        properties.getRisk().setMaxOrderNotional(new BigDecimal("600000"));
        properties.getPaper().setFillProbability(1.2);

        assertThat(StartupConfigValidator.problems(properties, registry)).containsExactlyInAnyOrder(
                "risk.maxOrderNotional must not exceed risk.capital",
                "risk.maxPositionPct must be within (0, 1]",
                "paper.fillProbability must be within [0, 1]");
    }

    @Test
    @DisplayName("Unknown exchange, mode and strategy are reported together")
    void runnerSettings() {
        properties.getExchange().setName("kraken");
        properties.getRunner().setMode("margin");
        properties.getRunner().setStrategy("martingale");

        List<String> problems = StartupConfigValidator.problems(properties, registry);

        assertThat(problems).hasSize(3);
        assertThat(problems).anyMatch(p -> p.contains("runner.strategy 'martingale' is unknown"));
    }

    @Test
    @DisplayName("Validation fails startup with every problem in the message")
    void validateThrows() {
        properties.getTrading().setOrderTimeoutSeconds(0);
        properties.getRunner().setMaxBackoffSeconds(0);
        StartupConfigValidator validator = new StartupConfigValidator(properties, registry);

        assertThatThrownBy(validator::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("trading.orderTimeoutSeconds must be positive")
                .hasMessageContaining("runner.maxBackoffSeconds must be at least 1");
    }
}
