package com.tradeagent.proposal;

import com.tradeagent.config.TradeAgentProperties;
import com.tradeagent.domain.enums.TradeSide;
import com.tradeagent.domain.enums.TradingMode;
import com.tradeagent.domain.model.Candle;
import com.tradeagent.domain.model.NewsFeatures;
import com.tradeagent.domain.model.NewsItem;
import com.tradeagent.domain.model.OrderIntent;
import com.tradeagent.domain.model.PositionState;
import com.tradeagent.domain.model.TradePlan;
import com.tradeagent.exception.BusinessException;
import com.tradeagent.exception.ErrorCode;
import com.tradeagent.intent.IntentService;
import com.tradeagent.news.FeatureSource;
import com.tradeagent.news.NewsFeatureAggregator;
import com.tradeagent.news.PointInTimeNewsFilter;
import com.tradeagent.observability.AuditService;
import com.tradeagent.observability.TradeAgentMetrics;
import com.tradeagent.risk.RiskDecision;
import com.tradeagent.risk.RiskEngine;
import com.tradeagent.risk.RiskLimits;
import com.tradeagent.risk.RiskState;
import com.tradeagent.risk.RiskStateService;
import com.tradeagent.risk.TradingRules;
import com.tradeagent.store.TradeStore;
import com.tradeagent.strategy.StrategyRegistry;
import com.tradeagent.strategy.TradingStrategy;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs a strategy on stored market data and turns a risk-approved plan into an intent.
 *
 * <p>Split in two so the runner can suppress unchanged proposals:
 * <ul>
 *   <li>{@link #prepare}: candles, point-in-time news features, strategy, risk check. Stores
 *       the feature snapshot but no intent.</li>
 *   <li>{@link #finalizeProposal}: freezes a PROPOSED candidate into a stored intent.</li>
 * </ul>
 *
 * <p>{@link #closePosition} skips the strategy and plans a sell of the open position.
 */
@Service
public class ProposalService {

    private static final Logger log = LoggerFactory.getLogger(ProposalService.class);

    /** Strategy name stamped on close-position intents. */
    public static final String MANUAL_CLOSE = "manual_close";

    static final String NO_POSITION = "no position to close";

    private final TradeStore tradeStore;
    private final StrategyRegistry strategyRegistry;
    private final FeatureSource featureSource;
    private final PointInTimeNewsFilter newsFilter;
    private final RiskEngine riskEngine;
    private final RiskStateService riskStateService;
    private final RiskLimits riskLimits;
    private final TradingRules tradingRules;
    private final IntentService intentService;
    private final TradeAgentProperties properties;
    private final AuditService auditService;
    private final TradeAgentMetrics metrics;
    private final Clock clock;

    public ProposalService(
            TradeStore tradeStore,
            StrategyRegistry strategyRegistry,
            FeatureSource featureSource,
            PointInTimeNewsFilter newsFilter,
            RiskEngine riskEngine,
            RiskStateService riskStateService,
            RiskLimits riskLimits,
            TradingRules tradingRules,
            IntentService intentService,
            TradeAgentProperties properties,
            AuditService auditService,
            TradeAgentMetrics metrics,
            Clock clock) {
        this.tradeStore = tradeStore;
        this.strategyRegistry = strategyRegistry;
        this.featureSource = featureSource;
        this.newsFilter = newsFilter;
        this.riskEngine = riskEngine;
        this.riskStateService = riskStateService;
        this.riskLimits = riskLimits;
        this.tradingRules = tradingRules;
        this.intentService = intentService;
        this.properties = properties;
        this.auditService = auditService;
        this.metrics = metrics;
        this.clock = clock;
    }

    public ProposalOutcome propose(String symbol, String strategyName, TradingMode mode) {
        return finalizeProposal(prepare(symbol, strategyName), mode);
    }

    /**
     * @throws BusinessException when there are no stored candles for the symbol
     */
    public ProposalCandidate prepare(String symbol, String strategyName) {
        TradingStrategy strategy = strategyRegistry.get(strategyName);
        String timeframe = properties.getTrading().primaryTimeframe();
        List<Candle> candles = tradeStore.latestCandles(symbol, timeframe, properties.getTrading().getCandleLimit());
        if (candles.isEmpty()) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR, "No candles available for " + symbol + " " + timeframe + "; run ingest first");
        }

        Instant now = clock.instant();
        NewsFeatures features = pointInTimeFeatures(now);
        Map<String, Object> snapshot = NewsFeatureAggregator.toSnapshot(features);
        snapshot.put("candle_ts", candles.get(candles.size() - 1).getTimestamp().toString());
        snapshot.put("window_start", now.minus(newsFilter.getLookback()).toString());
        snapshot.put("window_end", now.toString());
        String featuresRef = tradeStore.saveFeatureSnapshot(symbol, now, snapshot);

        TradePlan plan = strategy.generatePlan(symbol, candles, riskLimits, features);

        PositionState position = tradeStore.positionState(symbol);
        RiskState riskState =
                riskStateService.snapshot(position, RiskStateService.markPrice(candles, plan.getPrice()), now);
        RiskDecision decision = riskEngine.evaluate(
                plan, riskLimits, tradingRules, position.getPosition(), riskState, now, lastTwo(candles));

        auditRiskCheck(symbol, plan, decision);

        if (decision.isApproved()) {
            return ProposalCandidate.builder()
                    .status(ProposalStatus.PROPOSED)
                    .plan(decision.getPlan())
                    .featuresRef(featuresRef)
                    .reason(decision.getReason())
                    .build();
        }
        if (decision.getPlan() != null && decision.getPlan().isHold()) {
            log.info("Proposal for {} is a hold: {}", symbol, decision.getPlan().getRationale());
            return ProposalCandidate.builder()
                    .status(ProposalStatus.HOLD)
                    .plan(decision.getPlan())
                    .featuresRef(featuresRef)
                    .reason(decision.getReason())
                    .build();
        }
        metrics.riskRejected();
        log.warn("Proposal for {} rejected by risk: {}", symbol, decision.getReason());
        return ProposalCandidate.builder()
                .status(ProposalStatus.REJECTED)
                .featuresRef(featuresRef)
                .reason(decision.getReason())
                .build();
    }

    public ProposalOutcome finalizeProposal(ProposalCandidate candidate, TradingMode mode) {
        if (!candidate.isProposed()) {
            return ProposalOutcome.builder()
                    .status(candidate.getStatus())
                    .plan(candidate.getPlan())
                    .reason(candidate.getReason())
                    .featuresRef(candidate.getFeaturesRef())
                    .build();
        }
        OrderIntent intent = intentService.propose(
                candidate.getPlan(),
                mode,
                properties.getTrading().getIntentExpirySeconds(),
                candidate.getFeaturesRef());
        return ProposalOutcome.builder()
                .status(ProposalStatus.PROPOSED)
                .plan(candidate.getPlan())
                .reason(candidate.getReason())
                .featuresRef(candidate.getFeaturesRef())
                .intent(intent)
                .build();
    }

    /**
     * Proposes a sell of the whole long position at the latest close. The plan goes through the
     * same risk check as any strategy plan, so cooldown and kill switch still apply, and the
     * notional cap may shrink it to a partial close.
     *
     * @throws BusinessException when there is no stored candle to price the close
     */
    public ProposalOutcome closePosition(String symbol, TradingMode mode) {
        PositionState position = tradeStore.positionState(symbol);
        if (position.getPosition().signum() <= 0) {
            log.info("Close requested for {} but there is no long position", symbol);
            return ProposalOutcome.builder()
                    .status(ProposalStatus.REJECTED)
                    .reason(NO_POSITION)
                    .build();
        }
        List<Candle> candles = tradeStore.latestCandles(symbol, properties.getTrading().primaryTimeframe(), 2);
        if (candles.isEmpty()) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "No latest price available for " + symbol);
        }
        BigDecimal close = candles.get(candles.size() - 1).getClose();
        TradePlan plan = TradePlan.builder()
                .symbol(symbol)
                .side(TradeSide.SELL)
                .size(position.getPosition())
                .price(close)
                .confidence(BigDecimal.ONE)
                .rationale("manual close position")
                .strategy(MANUAL_CLOSE)
                .build();

        Instant now = clock.instant();
        RiskState riskState = riskStateService.snapshot(position, close, now);
        RiskDecision decision = riskEngine.evaluate(
                plan, riskLimits, tradingRules, position.getPosition(), riskState, now, lastTwo(candles));
        auditRiskCheck(symbol, plan, decision);

        if (!decision.isApproved()) {
            metrics.riskRejected();
            log.warn("Close of {} rejected by risk: {}", symbol, decision.getReason());
            return ProposalOutcome.builder()
                    .status(ProposalStatus.REJECTED)
                    .plan(plan)
                    .reason(decision.getReason())
                    .build();
        }
        OrderIntent intent = intentService.propose(
                decision.getPlan(), mode, properties.getTrading().getIntentExpirySeconds(), null);
        log.info("Close of {} proposed as intent {} for {}", symbol, intent.getIntentId(), intent.getSize());
        return ProposalOutcome.builder()
                .status(ProposalStatus.PROPOSED)
                .plan(decision.getPlan())
                .reason(decision.getReason())
                .intent(intent)
                .build();
    }

    private void auditRiskCheck(String symbol, TradePlan plan, RiskDecision decision) {
        Map<String, Object> audit = new LinkedHashMap<>();
        audit.put("strategy", plan.getStrategy());
        audit.put("side", plan.getSide().wireValue());
        audit.put("status", decision.isApproved() ? "approved" : "rejected");
        audit.put("reason", decision.getReason());
        audit.put("originalSize", plan.getSize().toPlainString());
        audit.put("adjustedSize", decision.getPlan() != null ? decision.getPlan().getSize().toPlainString() : "0");
        auditService.log("RISK_CHECK", "Symbol", symbol, audit);
    }

    private NewsFeatures pointInTimeFeatures(Instant now) {
        List<NewsItem> candidates = tradeStore.newsCandidates(now.minus(newsFilter.getLookback()), now);
        return featureSource.aggregate(newsFilter.usableAt(candidates, now));
    }

    private static List<Candle> lastTwo(List<Candle> candles) {
        return candles.size() <= 2 ? candles : candles.subList(candles.size() - 2, candles.size());
    }
}
