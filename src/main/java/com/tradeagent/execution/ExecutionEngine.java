package com.tradeagent.execution;

import com.tradeagent.approval.ApprovalGate;
import com.tradeagent.config.TradeAgentProperties;
import com.tradeagent.domain.enums.ExecutionStatus;
import com.tradeagent.domain.enums.IntentStatus;
import com.tradeagent.domain.enums.TradeSide;
import com.tradeagent.domain.enums.TradingMode;
import com.tradeagent.domain.model.Candle;
import com.tradeagent.domain.model.Execution;
import com.tradeagent.domain.model.Fill;
import com.tradeagent.domain.model.OrderBookSnapshot;
import com.tradeagent.domain.model.OrderIntent;
import com.tradeagent.domain.model.PositionState;
import com.tradeagent.domain.model.TradeResult;
import com.tradeagent.intent.IntentFactory;
import com.tradeagent.intent.IntentService;
import com.tradeagent.market.ExchangeOrder;
import com.tradeagent.market.MarketClient;
import com.tradeagent.observability.AuditService;
import com.tradeagent.observability.TradeAgentMetrics;
import com.tradeagent.risk.RiskDecision;
import com.tradeagent.risk.RiskEngine;
import com.tradeagent.risk.RiskLimits;
import com.tradeagent.risk.RiskState;
import com.tradeagent.risk.RiskStateService;
import com.tradeagent.risk.TradingRules;
import com.tradeagent.simulator.PaperFill;
import com.tradeagent.simulator.PaperFillSimulator;
import com.tradeagent.store.TradeStore;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns an approved intent into a paper fill or a live order.
 *
 * <p>Preconditions, in order (the first failure is returned as a rejection):
 * <ol>
 *   <li>intent exists and is not terminal</li>
 *   <li>stored fields still hash to the stored intent hash</li>
 *   <li>intent not expired (an expired intent is marked EXPIRED)</li>
 *   <li>requested mode matches the mode the intent was frozen with</li>
 *   <li>a valid approval bound to the current hash, unless autopilot permits it</li>
 *   <li>risk re-evaluation against the live position approves the same size
 *       (otherwise the intent is marked REJECTED and must be re-proposed)</li>
 *   <li>live only: dry run off, live trading acknowledged, credentials present</li>
 * </ol>
 *
 * <p>Executions are serialized by a single lock so the position and day state read for the
 * risk re-check cannot change underneath a concurrent execution. The execution row, its fill,
 * its trade result and the intent status are written in one transaction.
 */
@Service
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private static final Duration POLL_INTERVAL = Duration.ofSeconds(1);

    private final TradeStore tradeStore;
    private final IntentService intentService;
    private final ApprovalGate approvalGate;
    private final AutopilotPolicy autopilotPolicy;
    private final LiveTradingGuard liveTradingGuard;
    private final RiskEngine riskEngine;
    private final RiskStateService riskStateService;
    private final RiskLimits riskLimits;
    private final TradingRules tradingRules;
    private final MarketClient marketClient;
    private final PaperFillSimulator paperFillSimulator;
    private final TradeAgentProperties properties;
    private final AuditService auditService;
    private final TradeAgentMetrics metrics;
    private final Clock clock;
    private final Sleeper sleeper;

    private final ReentrantLock executionLock = new ReentrantLock();

    public ExecutionEngine(
            TradeStore tradeStore,
            IntentService intentService,
            ApprovalGate approvalGate,
            AutopilotPolicy autopilotPolicy,
            LiveTradingGuard liveTradingGuard,
            RiskEngine riskEngine,
            RiskStateService riskStateService,
            RiskLimits riskLimits,
            TradingRules tradingRules,
            MarketClient marketClient,
            PaperFillSimulator paperFillSimulator,
            TradeAgentProperties properties,
            AuditService auditService,
            TradeAgentMetrics metrics,
            Clock clock,
            Sleeper sleeper) {
        this.tradeStore = tradeStore;
        this.intentService = intentService;
        this.approvalGate = approvalGate;
        this.autopilotPolicy = autopilotPolicy;
        this.liveTradingGuard = liveTradingGuard;
        this.riskEngine = riskEngine;
        this.riskStateService = riskStateService;
        this.riskLimits = riskLimits;
        this.tradingRules = tradingRules;
        this.marketClient = marketClient;
        this.paperFillSimulator = paperFillSimulator;
        this.properties = properties;
        this.auditService = auditService;
        this.metrics = metrics;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public ExecutionResult execute(String intentId, TradingMode mode) {
        executionLock.lock();
        try {
            ExecutionResult result = executeLocked(intentId, mode);
            if (result.isRejected()) {
                metrics.executionRecorded(ExecutionStatus.REJECTED);
                log.warn("Execution of intent {} rejected: {}", intentId, result.getMessage());
                auditService.log(
                        "EXECUTION_REJECTED", "OrderIntent", intentId, Map.of("reason", result.getMessage()));
            }
            return result;
        } finally {
            executionLock.unlock();
        }
    }

    // ========================
    // PRECONDITIONS
    // ========================

    private ExecutionResult executeLocked(String intentId, TradingMode mode) {
        Optional<OrderIntent> found = tradeStore.findIntent(intentId);
        if (found.isEmpty()) {
            return ExecutionResult.rejected("intent not found");
        }
        OrderIntent intent = found.get();
        Instant now = clock.instant();

        if (intent.getStatus().isTerminal()) {
            return ExecutionResult.rejected("intent already " + intent.getStatus().wireValue());
        }

        if (!IntentService.isIntact(intent)) {
            return ExecutionResult.rejected("intent hash mismatch");
        }

        if (IntentFactory.isExpired(intent, now)) {
            intentService.transition(intentId, IntentStatus.EXPIRED);
            return ExecutionResult.rejected("intent expired");
        }

        if (intent.getMode() != mode) {
            return ExecutionResult.rejected(
                    "mode mismatch: intent is " + intent.getMode().wireValue() + ", requested " + mode.wireValue());
        }

        if (properties.getTrading().isRequireApproval()
                && !autopilotPolicy.permits(intent)
                && !approvalGate.isApprovalValid(intent)) {
            return ExecutionResult.rejected("approval required");
        }

        PositionState position = tradeStore.positionState(intent.getSymbol());
        List<Candle> candles =
                tradeStore.latestCandles(intent.getSymbol(), properties.getTrading().primaryTimeframe(), 2);
        BigDecimal mark = RiskStateService.markPrice(candles, intent.getPrice());
        RiskState riskState = riskStateService.snapshot(position, mark, now);
        RiskDecision decision = riskEngine.evaluate(
                intent.toPlan(), riskLimits, tradingRules, position.getPosition(), riskState, now, candles);
        if (decision.isRejected()) {
            intentService.transition(intentId, IntentStatus.REJECTED);
            return ExecutionResult.rejected("risk re-check failed: " + decision.getReason() + "; re-propose");
        }
        if (!RiskEngine.sameSize(decision.getPlan().getSize(), intent.getSize())) {
            intentService.transition(intentId, IntentStatus.REJECTED);
            return ExecutionResult.rejected("risk-approved size "
                    + decision.getPlan().getSize().toPlainString() + " differs from intent size "
                    + intent.getSize().toPlainString() + "; re-propose");
        }

        if (mode == TradingMode.LIVE) {
            Optional<String> refusal = liveTradingGuard.refusal();
            if (refusal.isPresent()) {
                return ExecutionResult.rejected(refusal.get());
            }
            return executeLive(intent, position);
        }
        return executePaper(intent, position);
    }

    // ========================
    // PAPER
    // ========================

    private ExecutionResult executePaper(OrderIntent intent, PositionState position) {
        Instant now = clock.instant();
        OrderBookSnapshot book = tradeStore
                .latestOrderBook(intent.getSymbol())
                .orElseGet(() -> PaperFillSimulator.syntheticBook(
                        intent.getSymbol(), intent.getPrice(), properties.getPaper().getSpreadBps(), now));

        PaperFill paperFill = paperFillSimulator.simulate(intent, book);
        String execId = UUID.randomUUID().toString();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("message", paperFill.getMessage());
        details.put("best_bid", book.getBid() != null ? book.getBid().toPlainString() : null);
        details.put("best_ask", book.getAsk() != null ? book.getAsk().toPlainString() : null);

        Execution execution = Execution.builder()
                .execId(execId)
                .intentId(intent.getIntentId())
                .intentHash(intent.getIntentHash())
                .timestamp(now)
                .mode(TradingMode.PAPER)
                .status(paperFill.getStatus())
                .fee(paperFill.getFee())
                .slippageModel("paper_bps")
                .details(details)
                .build();

        Fill fill = null;
        TradeResult tradeResult = null;
        if (paperFill.isFilled()) {
            fill = buildFill(execId, intent, paperFill.getSize(), paperFill.getPrice(), paperFill.getFee(), now);
            tradeResult = buildTradeResult(fill, position, intent, TradingMode.PAPER);
        }

        tradeStore.recordExecution(execution, fill, tradeResult, paperFill.getStatus().toIntentStatus());
        recorded(execution, intent);
        return ExecutionResult.of(paperFill.getStatus(), paperFill.getMessage(), execId);
    }

    // ========================
    // LIVE
    // ========================

    private ExecutionResult executeLive(OrderIntent intent, PositionState position) {
        String execId = UUID.randomUUID().toString();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requested_price", intent.getPrice().toPlainString());
        details.put("maker_emulation", false);

        String orderId = null;
        try {
            BigDecimal orderPrice = intent.getPrice();
            boolean postOnly = properties.getTrading().isPostOnly();
            if (postOnly && !marketClient.supportsPostOnly()) {
                orderPrice = emulateMakerPrice(intent, details);
            }

            ExchangeOrder order = marketClient.createLimitOrder(
                    intent.getSymbol(), intent.getSide(), intent.getSize(), orderPrice, postOnly);
            orderId = order.getOrderId();
            details.put("order_id", orderId);
            log.info("Live order {} placed for intent {} at {}", orderId, intent.getIntentId(), orderPrice);

            Instant deadline = clock.instant().plusSeconds(properties.getTrading().getOrderTimeoutSeconds());
            ExchangeOrder latest = order;
            while (clock.instant().isBefore(deadline)) {
                latest = marketClient.fetchOrder(orderId, intent.getSymbol());
                if (latest.isDone()) {
                    break;
                }
                sleeper.sleep(POLL_INTERVAL);
            }

            ExecutionStatus status = ExecutionStatus.FILLED;
            if (!latest.isDone()) {
                marketClient.cancelOrder(orderId, intent.getSymbol());
                status = ExecutionStatus.CANCELED;
                log.info("Live order {} still {} at timeout, canceled", orderId, latest.getStatus());
            }

            BigDecimal filled = latest.getFilled() != null ? latest.getFilled() : BigDecimal.ZERO;
            BigDecimal avgPrice = latest.getAverage() != null
                    ? latest.getAverage()
                    : latest.getPrice() != null ? latest.getPrice() : intent.getPrice();
            details.put("exchange_status", latest.getStatus());
            details.put("filled", filled.toPlainString());
            details.put("avg_price", avgPrice.toPlainString());
            details.put("fee_reported", false);

            return recordLive(intent, position, execId, status, filled, avgPrice, details);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return recordLiveError(intent, execId, orderId, details, e);
        } catch (RuntimeException e) {
            return recordLiveError(intent, execId, orderId, details, e);
        }
    }

    /**
     * Falls back to the intent price when the book cannot be read, and to the bps buffer when
     * the tick cannot be read. Either failure is kept in {@code maker_emulation_error}.
     */
    private BigDecimal emulateMakerPrice(OrderIntent intent, Map<String, Object> details) {
        TradeAgentProperties.MakerEmulation emulation = properties.getTrading().getMakerEmulation();
        OrderBookSnapshot book;
        try {
            book = marketClient.fetchOrderBook(intent.getSymbol());
        } catch (RuntimeException e) {
            log.warn("Maker emulation for intent {} could not read the book, placing at {}: {}",
                    intent.getIntentId(), intent.getPrice(), e.getMessage());
            details.put("maker_emulation", true);
            details.put("maker_emulation_error", String.valueOf(e.getMessage()));
            return intent.getPrice();
        }
        BigDecimal tick = null;
        if (emulation.isUseTick()) {
            try {
                tick = marketClient.priceTick(intent.getSymbol()).orElse(null);
            } catch (RuntimeException e) {
                log.warn("Price tick for {} unavailable, padding by {} bps: {}",
                        intent.getSymbol(), emulation.getBufferBps(), e.getMessage());
                details.put("maker_emulation_error", String.valueOf(e.getMessage()));
            }
        }
        MakerPriceEmulator.MakerPrice makerPrice = MakerPriceEmulator.emulate(
                intent.getSide(), intent.getPrice(), book, tick, emulation.getBufferBps());
        details.putAll(makerPrice.getDetails());
        return makerPrice.getPrice();
    }

    /**
     * The wrapped exchange API does not report fees, so live fills are recorded with a zero
     * fee and {@code fee_reported=false} in the execution details.
     */
    private ExecutionResult recordLive(
            OrderIntent intent,
            PositionState position,
            String execId,
            ExecutionStatus status,
            BigDecimal filled,
            BigDecimal avgPrice,
            Map<String, Object> details) {
        Instant now = clock.instant();
        Execution execution = Execution.builder()
                .execId(execId)
                .intentId(intent.getIntentId())
                .intentHash(intent.getIntentHash())
                .timestamp(now)
                .mode(TradingMode.LIVE)
                .status(status)
                .fee(BigDecimal.ZERO)
                .slippageModel("live")
                .details(details)
                .build();

        Fill fill = null;
        TradeResult tradeResult = null;
        if (filled.signum() > 0) {
            fill = buildFill(execId, intent, filled, avgPrice, BigDecimal.ZERO, now);
            tradeResult = buildTradeResult(fill, position, intent, TradingMode.LIVE);
        }
        tradeStore.recordExecution(execution, fill, tradeResult, status.toIntentStatus());
        recorded(execution, intent);
        return ExecutionResult.of(status, "live execution", execId);
    }

    private ExecutionResult recordLiveError(
            OrderIntent intent, String execId, String orderId, Map<String, Object> details, Exception error) {
        log.error("Live execution of intent {} failed (order {})", intent.getIntentId(), orderId, error);
        details.put("error", String.valueOf(error.getMessage()));
        Execution execution = Execution.builder()
                .execId(execId)
                .intentId(intent.getIntentId())
                .intentHash(intent.getIntentHash())
                .timestamp(clock.instant())
                .mode(TradingMode.LIVE)
                .status(ExecutionStatus.ERROR)
                .fee(BigDecimal.ZERO)
                .slippageModel("live")
                .details(details)
                .build();
        tradeStore.recordExecution(execution, null, null, IntentStatus.ERROR);
        recorded(execution, intent);
        return ExecutionResult.of(ExecutionStatus.ERROR, String.valueOf(error.getMessage()), execId);
    }

    // ========================
    // RECORDS
    // ========================

    private Fill buildFill(
            String execId, OrderIntent intent, BigDecimal size, BigDecimal price, BigDecimal fee, Instant now) {
        return Fill.builder()
                .fillId(UUID.randomUUID().toString())
                .execId(execId)
                .symbol(intent.getSymbol())
                .side(intent.getSide())
                .size(size)
                .price(price)
                .fee(fee)
                .feeCurrency(quoteCurrency(intent.getSymbol()))
                .timestamp(now)
                .build();
    }

    /** Buys realize nothing; sells realize against the average cost before this fill. */
    private TradeResult buildTradeResult(Fill fill, PositionState position, OrderIntent intent, TradingMode mode) {
        BigDecimal pnl = BigDecimal.ZERO;
        if (fill.getSide() == TradeSide.SELL && position.getPosition().signum() > 0) {
            pnl = fill.getPrice()
                    .subtract(position.getAvgCost())
                    .multiply(fill.getSize())
                    .subtract(fill.getFee());
        }
        return TradeResult.builder()
                .tradeId(UUID.randomUUID().toString())
                .execId(fill.getExecId())
                .intentId(intent.getIntentId())
                .mode(mode)
                .symbol(fill.getSymbol())
                .side(fill.getSide())
                .size(fill.getSize())
                .price(fill.getPrice())
                .fee(fill.getFee())
                .realizedPnl(pnl)
                .timestamp(fill.getTimestamp())
                .build();
    }

    private void recorded(Execution execution, OrderIntent intent) {
        metrics.executionRecorded(execution.getStatus());
        auditService.log(
                "EXECUTION_RECORDED",
                "OrderIntent",
                intent.getIntentId(),
                Map.of(
                        "execId", execution.getExecId(),
                        "mode", execution.getMode().wireValue(),
                        "status", execution.getStatus().wireValue()));
        log.info(
                "Intent {} executed ({}): {}",
                intent.getIntentId(),
                execution.getMode(),
                execution.getStatus());
    }

    private String quoteCurrency(String symbol) {
        int slash = symbol.indexOf('/');
        return slash >= 0 ? symbol.substring(slash + 1) : properties.getPaper().getFeeCurrency();
    }
}
