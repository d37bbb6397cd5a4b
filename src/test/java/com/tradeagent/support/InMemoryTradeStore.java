package com.tradeagent.support;

import com.tradeagent.domain.enums.IntentStatus;
import com.tradeagent.domain.enums.TradeSide;
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
import com.tradeagent.pnl.PositionLedger;
import com.tradeagent.risk.RiskState;
import com.tradeagent.store.TradeStore;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Map-backed {@link TradeStore} with the same idempotency and transition rules as the JPA store.
 * Position state is rebuilt by replaying fills, as in production.
 */
public class InMemoryTradeStore implements TradeStore {

    private final Map<String, Candle> candles = new LinkedHashMap<>();
    private final Map<String, OrderBookSnapshot> orderBooks = new HashMap<>();
    private final Map<String, NewsItem> news = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> featureSnapshots = new LinkedHashMap<>();
    private final Map<String, OrderIntent> intents = new LinkedHashMap<>();
    private final Map<String, Approval> approvals = new HashMap<>();
    private final List<Execution> executions = new ArrayList<>();
    private final List<Fill> fills = new ArrayList<>();
    private final List<TradeResult> tradeResults = new ArrayList<>();
    private final Map<String, RunnerState> runnerStates = new HashMap<>();

    // ========================
    // MARKET DATA
    // ========================

    @Override
    public int saveCandles(List<Candle> batch) {
        int inserted = 0;
        for (Candle candle : batch) {
            String key = candle.getSymbol() + "|" + candle.getTimeframe() + "|" + candle.getTimestamp();
            if (candles.put(key, candle) == null) {
                inserted++;
            }
        }
        return inserted;
    }

    @Override
    public List<Candle> latestCandles(String symbol, String timeframe, int limit) {
        List<Candle> matching = candlesFor(symbol, timeframe);
        return new ArrayList<>(matching.subList(Math.max(0, matching.size() - limit), matching.size()));
    }

    @Override
    public List<Candle> candlesBetween(String symbol, String timeframe, Instant from, Instant to) {
        return candlesFor(symbol, timeframe).stream()
                .filter(c -> !c.getTimestamp().isBefore(from) && !c.getTimestamp().isAfter(to))
                .toList();
    }

    private List<Candle> candlesFor(String symbol, String timeframe) {
        return candles.values().stream()
                .filter(c -> c.getSymbol().equals(symbol) && c.getTimeframe().equals(timeframe))
                .sorted(Comparator.comparing(Candle::getTimestamp))
                .toList();
    }

    @Override
    public void saveOrderBook(OrderBookSnapshot snapshot) {
        orderBooks.put(snapshot.getSymbol(), snapshot);
    }

    @Override
    public Optional<OrderBookSnapshot> latestOrderBook(String symbol) {
        return Optional.ofNullable(orderBooks.get(symbol));
    }

    // ========================
    // NEWS & FEATURES
    // ========================

    @Override
    public int saveNewsItems(List<NewsItem> items) {
        int inserted = 0;
        for (NewsItem item : items) {
            if (news.putIfAbsent(item.getId(), item) == null) {
                inserted++;
            }
        }
        return inserted;
    }

    @Override
    public List<NewsItem> newsCandidates(Instant from, Instant to) {
        return news.values().stream()
                .filter(n -> n.getObservedAt() == null || !n.getObservedAt().isAfter(to))
                .filter(n -> n.getPublishedAt() == null || !n.getPublishedAt().isBefore(from))
                .toList();
    }

    @Override
    public String saveFeatureSnapshot(String symbol, Instant timestamp, Map<String, Object> features) {
        String id = UUID.randomUUID().toString();
        featureSnapshots.put(id, features);
        return id;
    }

    public Map<String, Object> featureSnapshot(String id) {
        return featureSnapshots.get(id);
    }

    // ========================
    // INTENTS & APPROVALS
    // ========================

    @Override
    public boolean insertIntent(OrderIntent intent) {
        if (intents.containsKey(intent.getIntentId())) {
            return false;
        }
        intents.put(intent.getIntentId(), intent.toBuilder().build());
        return true;
    }

    @Override
    public Optional<OrderIntent> findIntent(String intentId) {
        return Optional.ofNullable(intents.get(intentId)).map(i -> i.toBuilder().build());
    }

    @Override
    public List<OrderIntent> recentIntents() {
        List<OrderIntent> all = new ArrayList<>(intents.values());
        all.sort(Comparator.comparing(OrderIntent::getCreatedAt).reversed());
        return all;
    }

    @Override
    public boolean updateIntentStatus(String intentId, IntentStatus status) {
        OrderIntent stored = intents.get(intentId);
        if (stored == null) {
            return false;
        }
        if (stored.getStatus() == status) {
            return true;
        }
        if (!stored.getStatus().canTransitionTo(status)) {
            return false;
        }
        stored.setStatus(status);
        return true;
    }

    /** Overwrites stored intent fields, simulating out-of-band tampering. */
    public void overwriteIntent(OrderIntent intent) {
        intents.put(intent.getIntentId(), intent.toBuilder().build());
    }

    @Override
    public void saveApproval(Approval approval) {
        approvals.put(approval.getIntentId(), approval);
    }

    @Override
    public Optional<Approval> findApproval(String intentId) {
        return Optional.ofNullable(approvals.get(intentId));
    }

    // ========================
    // EXECUTIONS
    // ========================

    @Override
    public void recordExecution(Execution execution, Fill fill, TradeResult tradeResult, IntentStatus intentStatus) {
        executions.add(execution);
        if (fill != null) {
            fills.add(fill);
        }
        if (tradeResult != null) {
            tradeResults.add(tradeResult);
        }
        if (intentStatus != null) {
            updateIntentStatus(execution.getIntentId(), intentStatus);
        }
    }

    @Override
    public List<Execution> executionsForIntent(String intentId) {
        return executions.stream().filter(e -> e.getIntentId().equals(intentId)).toList();
    }

    @Override
    public List<Fill> fillsForExecution(String execId) {
        return fills.stream().filter(f -> f.getExecId().equals(execId)).toList();
    }

    @Override
    public List<TradeResult> tradeResults(TradingMode mode) {
        return tradeResults.stream()
                .filter(t -> mode == null || t.getMode() == mode)
                .sorted(Comparator.comparing(TradeResult::getTimestamp))
                .toList();
    }

    public List<Execution> executions() {
        return executions;
    }

    public List<Fill> fills() {
        return fills;
    }

    public List<TradeResult> tradeResults() {
        return tradeResults;
    }

    /** Adds a fill directly, for tests that need pre-existing position or day state. */
    public void addFill(Fill fill) {
        fills.add(fill);
    }

    // ========================
    // RISK SNAPSHOT
    // ========================

    @Override
    public PositionState positionState(String symbol) {
        PositionLedger ledger = new PositionLedger();
        fills.stream()
                .filter(f -> f.getSymbol().equals(symbol))
                .sorted(Comparator.comparing(Fill::getTimestamp))
                .forEach(f -> {
                    BigDecimal fee = f.getFee() != null ? f.getFee() : BigDecimal.ZERO;
                    if (f.getSide() == TradeSide.BUY) {
                        ledger.applyBuy(f.getSize(), f.getPrice(), fee);
                    } else if (f.getSide() == TradeSide.SELL) {
                        ledger.applySell(f.getSize(), f.getPrice(), fee);
                    }
                });
        return ledger.snapshot(symbol);
    }

    @Override
    public BigDecimal dailyRealizedPnl(LocalDate day) {
        return tradeResults.stream()
                .filter(t -> RiskState.utcDay(t.getTimestamp()).equals(day))
                .map(TradeResult::getRealizedPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Override
    public int dailyExecutionCount(LocalDate day) {
        return (int) fills.stream()
                .filter(f -> RiskState.utcDay(f.getTimestamp()).equals(day))
                .count();
    }

    @Override
    public Optional<Instant> lastExecutionTime() {
        return fills.stream().map(Fill::getTimestamp).max(Comparator.naturalOrder());
    }

    // ========================
    // RUNNER
    // ========================

    @Override
    public Optional<RunnerState> loadRunnerState(String runnerName) {
        return Optional.ofNullable(runnerStates.get(runnerName));
    }

    @Override
    public void saveRunnerState(String runnerName, RunnerState state) {
        runnerStates.put(runnerName, state);
    }
}
