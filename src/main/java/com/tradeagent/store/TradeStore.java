package com.tradeagent.store;

import com.tradeagent.domain.enums.IntentStatus;
import com.tradeagent.domain.enums.TradingMode;
import com.tradeagent.domain.model.Approval;
import com.tradeagent.domain.model.Candle;
import com.tradeagent.domain.model.Execution;
import com.tradeagent.domain.model.Fill;
import com.tradeagent.domain.model.NewsItem;
import com.tradeagent.domain.model.OrderBookSnapshot;
import com.tradeagent.domain.model.OrderIntent;
import com.tradeagent.domain.model.PositionState;
import com.tradeagent.domain.model.RunnerState;
import com.tradeagent.domain.model.TradeResult;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable storage facade for everything the pipeline reads and writes.
 *
 * <p>Inserts are idempotent where a natural key exists (candles, news items, intents).
 * {@link #recordExecution} is the only multi-row write and is atomic.
 */
public interface TradeStore {

    // ========================
    // MARKET DATA
    // ========================

    /** Upserts by (symbol, timeframe, timestamp). Returns the number of new rows. */
    int saveCandles(List<Candle> candles);

    /** The newest {@code limit} candles, oldest first. */
    List<Candle> latestCandles(String symbol, String timeframe, int limit);

    /** Candles with open time in [from, to], oldest first. */
    List<Candle> candlesBetween(String symbol, String timeframe, Instant from, Instant to);

    void saveOrderBook(OrderBookSnapshot snapshot);

    Optional<OrderBookSnapshot> latestOrderBook(String symbol);

    // ========================
    // NEWS & FEATURES
    // ========================

    /** Inserts items whose id is not yet stored. Returns the number inserted. */
    int saveNewsItems(List<NewsItem> items);

    /** Items observed at or before {@code to} and published no earlier than {@code from}. */
    List<NewsItem> newsCandidates(Instant from, Instant to);

    /** Stores the feature vector a plan was built from and returns its reference id. */
    String saveFeatureSnapshot(String symbol, Instant timestamp, Map<String, Object> features);

    // ========================
    // INTENTS & APPROVALS
    // ========================

    /**
     * Inserts the intent unless one with the same id already exists.
     *
     * @return true when a row was written, false for a no-op
     */
    boolean insertIntent(OrderIntent intent);

    Optional<OrderIntent> findIntent(String intentId);

    List<OrderIntent> recentIntents();

    /** Applies a status change if the transition is allowed. Returns false when refused. */
    boolean updateIntentStatus(String intentId, IntentStatus status);

    void saveApproval(Approval approval);

    Optional<Approval> findApproval(String intentId);

    // ========================
    // EXECUTIONS
    // ========================

    /**
     * Writes the execution, its optional fill and trade result, and the intent's new status in
     * one transaction.
     */
    void recordExecution(Execution execution, Fill fill, TradeResult tradeResult, IntentStatus intentStatus);

    List<Execution> executionsForIntent(String intentId);

    List<Fill> fillsForExecution(String execId);

    /** Stored trade results in the given mode, or in every mode when null, oldest first. */
    List<TradeResult> tradeResults(TradingMode mode);

    // ========================
    // RISK SNAPSHOT
    // ========================

    PositionState positionState(String symbol);

    BigDecimal dailyRealizedPnl(LocalDate day);

    /** Executions that produced a fill during the UTC day. */
    int dailyExecutionCount(LocalDate day);

    /** Time of the most recent fill. */
    Optional<Instant> lastExecutionTime();

    // ========================
    // RUNNER
    // ========================

    Optional<RunnerState> loadRunnerState(String runnerName);

    void saveRunnerState(String runnerName, RunnerState state);
}
