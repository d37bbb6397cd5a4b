package com.tradeagent.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the trade agent, bound from {@code tradeagent.*}.
 *
 * <p>Defaults are conservative: paper mode, dry run, approval required, kill switch off,
 * autopilot and background runner disabled.
 */
@Configuration
@ConfigurationProperties(prefix = "tradeagent")
@Getter
@Setter
public class TradeAgentProperties {

    private Trading trading = new Trading();
    private Risk risk = new Risk();
    private Paper paper = new Paper();
    private Backtest backtest = new Backtest();
    private Reporting reporting = new Reporting();
    private Autopilot autopilot = new Autopilot();
    private Runner runner = new Runner();
    private News news = new News();
    private Exchange exchange = new Exchange();
    private Strategy strategy = new Strategy();

    @Getter
    @Setter
    public static class Trading {

        /** Plain approval phrase; hashed at startup when no hash is configured. */
        private String approvalPhrase = "I APPROVE";

        /** SHA-256 hex of the approval phrase. Takes precedence over the plain phrase. */
        private String approvalPhraseHash;

        private int orderTimeoutSeconds = 30;
        private int intentExpirySeconds = 900;
        private boolean postOnly = true;
        private boolean longOnly = true;
        private boolean dryRun = true;
        private boolean requireApproval = true;
        private boolean killSwitch = false;

        /** Must be true, together with the I_UNDERSTAND_LIVE_TRADING environment variable, for live orders. */
        private boolean liveTradingAcknowledged = false;

        private List<String> whitelist = new ArrayList<>(List.of("BTC/JPY"));
        private List<String> timeframes = new ArrayList<>(List.of("1m"));
        private int candleLimit = 500;
        private MakerEmulation makerEmulation = new MakerEmulation();

        public String primaryTimeframe() {
            return timeframes.isEmpty() ? "1m" : timeframes.get(0);
        }
    }

    @Getter
    @Setter
    public static class MakerEmulation {

        /** Pad from the touch in bps, used when the exchange does not report a price tick. */
        private BigDecimal bufferBps = new BigDecimal("0.1");

        private boolean useTick = true;
    }

    @Getter
    @Setter
    public static class Risk {
        private BigDecimal capital = new BigDecimal("500000");
        private BigDecimal maxPositionPct = new BigDecimal("0.2");
        private BigDecimal maxOrderNotional = new BigDecimal("50000");
        private BigDecimal maxLossPerTrade = new BigDecimal("5000");
        private BigDecimal maxLossPerDay = new BigDecimal("15000");
        private int maxOrdersPerDay = 5;
        private int cooldownMinutes = 5;
        private BigDecimal cooldownBypassPct = new BigDecimal("0.02");
    }

    @Getter
    @Setter
    public static class Paper {
        private long seed = 42L;
        private BigDecimal slippageBps = new BigDecimal("5");
        private BigDecimal feeBps = new BigDecimal("10");
        private double fillProbability = 0.7;
        private BigDecimal spreadBps = new BigDecimal("2");
        private String feeCurrency = "JPY";
    }

    @Getter
    @Setter
    public static class Backtest {
        private BigDecimal makerFeeBps = new BigDecimal("5");
        private BigDecimal takerFeeBps = new BigDecimal("10");
        private BigDecimal slippageBps = new BigDecimal("5");
        private boolean assumeTaker = true;

        /** Directory the report, equity curve and summary are written to. */
        private String outputDirectory = "data/backtest";
    }

    @Getter
    @Setter
    public static class Reporting {
        /** Directory reports over stored paper and live trades are written to. */
        private String outputDirectory = "data/reports";
    }

    @Getter
    @Setter
    public static class Autopilot {
        private boolean enabled = false;
        private BigDecimal maxNotional = new BigDecimal("10000");
        private BigDecimal maxLossPerTrade = new BigDecimal("2000");
        private BigDecimal minConfidence = new BigDecimal("0.6");
        private List<String> whitelist = new ArrayList<>(List.of("BTC/JPY"));
    }

    @Getter
    @Setter
    public static class Runner {
        private boolean enabled = false;
        private String symbol = "BTC/JPY";
        private String mode = "paper";
        private String strategy = "baseline";
        private boolean autoExecute = false;
        private boolean orderbook = true;
        private int marketIntervalSeconds = 30;
        private int newsIntervalSeconds = 120;
        private int proposeIntervalSeconds = 60;
        private int proposeCooldownSeconds = 300;
        private int jitterSeconds = 2;
        private int maxBackoffSeconds = 300;
    }

    @Getter
    @Setter
    public static class News {
        private int sentimentLookbackHours = 12;
        private int newsLatencySeconds = 600;
    }

    @Getter
    @Setter
    public static class Exchange {
        private String name = "paper";
        private String apiKey;
        private String apiSecret;

        /** Opening price of the simulated paper market. */
        private BigDecimal paperStartPrice = new BigDecimal("5000000");

        /** Standard deviation of one simulated trade-to-trade move, in bps. */
        private BigDecimal paperVolatilityBps = new BigDecimal("5");

        private BigDecimal paperPriceTick = BigDecimal.ONE;
    }

    @Getter
    @Setter
    public static class Strategy {
        private int smaWindow = 20;
        private int momentumWindow = 10;
        private BigDecimal basePositionPct = new BigDecimal("0.1");
        private BigDecimal baseConfidence = new BigDecimal("0.55");
        private BigDecimal sentimentBoostThreshold = new BigDecimal("0.2");
        private BigDecimal sentimentCutThreshold = new BigDecimal("-0.2");
        private BigDecimal boostMultiplier = new BigDecimal("1.3");
        private BigDecimal cutMultiplier = new BigDecimal("0.5");
        private BigDecimal confidenceStep = new BigDecimal("0.1");
    }
}
