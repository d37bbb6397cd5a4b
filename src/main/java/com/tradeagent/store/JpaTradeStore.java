package com.tradeagent.store;

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
import com.tradeagent.entity.CandleEntity;
import com.tradeagent.entity.FeatureSnapshotEntity;
import com.tradeagent.entity.FillEntity;
import com.tradeagent.entity.OrderIntentEntity;
import com.tradeagent.entity.RunnerStateEntity;
import com.tradeagent.exception.ResourceNotFoundException;
import com.tradeagent.intent.IntentHasher;
import com.tradeagent.mapper.ApprovalMapper;
import com.tradeagent.mapper.CandleMapper;
import com.tradeagent.mapper.ExecutionMapper;
import com.tradeagent.mapper.FillMapper;
import com.tradeagent.mapper.JsonHelper;
import com.tradeagent.mapper.NewsItemMapper;
import com.tradeagent.mapper.OrderBookSnapshotMapper;
import com.tradeagent.mapper.OrderIntentMapper;
import com.tradeagent.mapper.TradeResultMapper;
import com.tradeagent.pnl.PositionLedger;
import com.tradeagent.repository.jpa.ApprovalJpaRepository;
import com.tradeagent.repository.jpa.CandleJpaRepository;
import com.tradeagent.repository.jpa.ExecutionJpaRepository;
import com.tradeagent.repository.jpa.FeatureSnapshotJpaRepository;
import com.tradeagent.repository.jpa.FillJpaRepository;
import com.tradeagent.repository.jpa.NewsItemJpaRepository;
import com.tradeagent.repository.jpa.OrderBookSnapshotJpaRepository;
import com.tradeagent.repository.jpa.OrderIntentJpaRepository;
import com.tradeagent.repository.jpa.RunnerStateJpaRepository;
import com.tradeagent.repository.jpa.TradeResultJpaRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link TradeStore} backed by Spring Data JPA repositories on H2.
 *
 * <p>Day-scoped aggregates use the half-open UTC range [day 00:00, next day 00:00). Executions
 * counted against the daily order limit and the cooldown are the ones that produced a fill;
 * an unfilled paper attempt that is retried later does not consume the budget.
 */
@Service
public class JpaTradeStore implements TradeStore {

    private static final Logger log = LoggerFactory.getLogger(JpaTradeStore.class);

    private final CandleJpaRepository candleRepository;
    private final OrderBookSnapshotJpaRepository orderBookRepository;
    private final NewsItemJpaRepository newsItemRepository;
    private final FeatureSnapshotJpaRepository featureSnapshotRepository;
    private final OrderIntentJpaRepository intentRepository;
    private final ApprovalJpaRepository approvalRepository;
    private final ExecutionJpaRepository executionRepository;
    private final FillJpaRepository fillRepository;
    private final TradeResultJpaRepository tradeResultRepository;
    private final RunnerStateJpaRepository runnerStateRepository;
    private final CandleMapper candleMapper;
    private final OrderBookSnapshotMapper orderBookMapper;
    private final NewsItemMapper newsItemMapper;
    private final OrderIntentMapper intentMapper;
    private final ApprovalMapper approvalMapper;
    private final ExecutionMapper executionMapper;
    private final FillMapper fillMapper;
    private final TradeResultMapper tradeResultMapper;
    private final Clock clock;

    public JpaTradeStore(
            CandleJpaRepository candleRepository,
            OrderBookSnapshotJpaRepository orderBookRepository,
            NewsItemJpaRepository newsItemRepository,
            FeatureSnapshotJpaRepository featureSnapshotRepository,
            OrderIntentJpaRepository intentRepository,
            ApprovalJpaRepository approvalRepository,
            ExecutionJpaRepository executionRepository,
            FillJpaRepository fillRepository,
            TradeResultJpaRepository tradeResultRepository,
            RunnerStateJpaRepository runnerStateRepository,
            CandleMapper candleMapper,
            OrderBookSnapshotMapper orderBookMapper,
            NewsItemMapper newsItemMapper,
            OrderIntentMapper intentMapper,
            ApprovalMapper approvalMapper,
            ExecutionMapper executionMapper,
            FillMapper fillMapper,
            TradeResultMapper tradeResultMapper,
            Clock clock) {
        this.candleRepository = candleRepository;
        this.orderBookRepository = orderBookRepository;
        this.newsItemRepository = newsItemRepository;
        this.featureSnapshotRepository = featureSnapshotRepository;
        this.intentRepository = intentRepository;
        this.approvalRepository = approvalRepository;
        this.executionRepository = executionRepository;
        this.fillRepository = fillRepository;
        this.tradeResultRepository = tradeResultRepository;
        this.runnerStateRepository = runnerStateRepository;
        this.candleMapper = candleMapper;
        this.orderBookMapper = orderBookMapper;
        this.newsItemMapper = newsItemMapper;
        this.intentMapper = intentMapper;
        this.approvalMapper = approvalMapper;
        this.executionMapper = executionMapper;
        this.fillMapper = fillMapper;
        this.tradeResultMapper = tradeResultMapper;
        this.clock = clock;
    }

    // ========================
    // MARKET DATA
    // ========================

    @Override
    @Transactional
    public int saveCandles(List<Candle> candles) {
        int inserted = 0;
        for (Candle candle : candles) {
            Optional<CandleEntity> existing = candleRepository.findBySymbolAndTimeframeAndTimestamp(
                    candle.getSymbol(), candle.getTimeframe(), candle.getTimestamp());
            if (existing.isPresent()) {
                CandleEntity entity = existing.get();
                entity.setOpen(candle.getOpen());
                entity.setHigh(candle.getHigh());
                entity.setLow(candle.getLow());
                entity.setClose(candle.getClose());
                entity.setVolume(candle.getVolume());
                candleRepository.save(entity);
            } else {
                candleRepository.save(candleMapper.toEntity(candle));
                inserted++;
            }
        }
        return inserted;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Candle> latestCandles(String symbol, String timeframe, int limit) {
        List<Candle> newestFirst = candleMapper.toDomainList(candleRepository
                .findBySymbolAndTimeframeOrderByTimestampDesc(symbol, timeframe, PageRequest.of(0, limit)));
        List<Candle> chronological = new ArrayList<>(newestFirst);
        Collections.reverse(chronological);
        return chronological;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Candle> candlesBetween(String symbol, String timeframe, Instant from, Instant to) {
        return candleMapper.toDomainList(candleRepository.findRange(symbol, timeframe, from, to));
    }

    @Override
    @Transactional
    public void saveOrderBook(OrderBookSnapshot snapshot) {
        orderBookRepository.save(orderBookMapper.toEntity(snapshot));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OrderBookSnapshot> latestOrderBook(String symbol) {
        return orderBookRepository.findFirstBySymbolOrderByTimestampDesc(symbol).map(orderBookMapper::toDomain);
    }

    // ========================
    // NEWS & FEATURES
    // ========================

    @Override
    @Transactional
    public int saveNewsItems(List<NewsItem> items) {
        int inserted = 0;
        for (NewsItem item : items) {
            if (newsItemRepository.existsById(item.getId())) {
                continue;
            }
            newsItemRepository.save(newsItemMapper.toEntity(item));
            inserted++;
        }
        return inserted;
    }

    @Override
    @Transactional(readOnly = true)
    public List<NewsItem> newsCandidates(Instant from, Instant to) {
        return newsItemMapper.toDomainList(newsItemRepository.findCandidates(from, to));
    }

    @Override
    @Transactional
    public String saveFeatureSnapshot(String symbol, Instant timestamp, Map<String, Object> features) {
        String id = UUID.randomUUID().toString();
        featureSnapshotRepository.save(FeatureSnapshotEntity.builder()
                .id(id)
                .symbol(symbol)
                .timestamp(timestamp)
                .featuresJson(JsonHelper.toJson(features))
                .build());
        return id;
    }

    // ========================
    // INTENTS & APPROVALS
    // ========================

    @Override
    @Transactional
    public boolean insertIntent(OrderIntent intent) {
        if (intentRepository.existsById(intent.getIntentId())) {
            log.info("Intent {} already stored, insert is a no-op", intent.getIntentId());
            return false;
        }
        OrderIntentEntity entity = intentMapper.toEntity(intent);
        entity.setIntentJson(IntentHasher.canonicalJson(intent));
        if (entity.getIntentHash() == null) {
            entity.setIntentHash(IntentHasher.hash(intent));
        }
        entity.setUpdatedAt(clock.instant());
        intentRepository.save(entity);
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OrderIntent> findIntent(String intentId) {
        return intentRepository.findById(intentId).map(intentMapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderIntent> recentIntents() {
        return intentMapper.toDomainList(intentRepository.findTop50ByOrderByCreatedAtDesc());
    }

    @Override
    @Transactional
    public boolean updateIntentStatus(String intentId, IntentStatus status) {
        OrderIntentEntity entity = intentRepository
                .findById(intentId)
                .orElseThrow(() -> new ResourceNotFoundException("OrderIntent", intentId));
        return applyStatus(entity, status);
    }

    @Override
    @Transactional
    public void saveApproval(Approval approval) {
        approvalRepository.save(approvalMapper.toEntity(approval));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Approval> findApproval(String intentId) {
        return approvalRepository.findById(intentId).map(approvalMapper::toDomain);
    }

    // ========================
    // EXECUTIONS
    // ========================

    @Override
    @Transactional
    public void recordExecution(Execution execution, Fill fill, TradeResult tradeResult, IntentStatus intentStatus) {
        executionRepository.save(executionMapper.toEntity(execution));
        if (fill != null) {
            fillRepository.save(fillMapper.toEntity(fill));
        }
        if (tradeResult != null) {
            tradeResultRepository.save(tradeResultMapper.toEntity(tradeResult));
        }
        if (intentStatus != null) {
            intentRepository.findById(execution.getIntentId()).ifPresent(entity -> applyStatus(entity, intentStatus));
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Execution> executionsForIntent(String intentId) {
        return executionMapper.toDomainList(executionRepository.findByIntentIdOrderByTimestampAsc(intentId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Fill> fillsForExecution(String execId) {
        return fillMapper.toDomainList(fillRepository.findByExecId(execId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<TradeResult> tradeResults(TradingMode mode) {
        return tradeResultMapper.toDomainList(mode == null
                ? tradeResultRepository.findAllByOrderByTimestampAsc()
                : tradeResultRepository.findByModeOrderByTimestampAsc(mode));
    }

    // ========================
    // RISK SNAPSHOT
    // ========================

    @Override
    @Transactional(readOnly = true)
    public PositionState positionState(String symbol) {
        PositionLedger ledger = new PositionLedger();
        for (FillEntity fill : fillRepository.findBySymbolOrderByTimestampAsc(symbol)) {
            BigDecimal fee = fill.getFee() != null ? fill.getFee() : BigDecimal.ZERO;
            if (fill.getSide() == TradeSide.BUY) {
                ledger.applyBuy(fill.getSize(), fill.getPrice(), fee);
            } else if (fill.getSide() == TradeSide.SELL) {
                ledger.applySell(fill.getSize(), fill.getPrice(), fee);
            }
        }
        return ledger.snapshot(symbol);
    }

    @Override
    @Transactional(readOnly = true)
    public BigDecimal dailyRealizedPnl(LocalDate day) {
        BigDecimal sum = tradeResultRepository.sumRealizedPnlBetween(startOf(day), startOf(day.plusDays(1)));
        return sum != null ? sum : BigDecimal.ZERO;
    }

    @Override
    @Transactional(readOnly = true)
    public int dailyExecutionCount(LocalDate day) {
        return (int) fillRepository.countBetween(startOf(day), startOf(day.plusDays(1)));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Instant> lastExecutionTime() {
        return fillRepository.findFirstByOrderByTimestampDesc().map(FillEntity::getTimestamp);
    }

    // ========================
    // RUNNER
    // ========================

    @Override
    @Transactional(readOnly = true)
    public Optional<RunnerState> loadRunnerState(String runnerName) {
        return runnerStateRepository
                .findById(runnerName)
                .map(entity -> JsonHelper.fromJson(entity.getStateJson(), RunnerState.class));
    }

    @Override
    @Transactional
    public void saveRunnerState(String runnerName, RunnerState state) {
        runnerStateRepository.save(RunnerStateEntity.builder()
                .name(runnerName)
                .stateJson(JsonHelper.toJson(state))
                .updatedAt(clock.instant())
                .build());
    }

    private boolean applyStatus(OrderIntentEntity entity, IntentStatus status) {
        IntentStatus current = entity.getStatus();
        if (current == status) {
            return true;
        }
        if (!current.canTransitionTo(status)) {
            log.warn("Refusing intent {} status change {} -> {}", entity.getIntentId(), current, status);
            return false;
        }
        entity.setStatus(status);
        entity.setUpdatedAt(clock.instant());
        intentRepository.save(entity);
        return true;
    }

    private static Instant startOf(LocalDate day) {
        return day.atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
