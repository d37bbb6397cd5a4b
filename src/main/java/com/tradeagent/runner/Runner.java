package com.tradeagent.runner;

import com.tradeagent.config.TradeAgentProperties;
import com.tradeagent.domain.enums.TradingMode;
import com.tradeagent.domain.model.RunnerState;
import com.tradeagent.domain.model.TradePlan;
import com.tradeagent.execution.ExecutionEngine;
import com.tradeagent.execution.ExecutionResult;
import com.tradeagent.execution.Sleeper;
import com.tradeagent.ingest.IngestResult;
import com.tradeagent.ingest.IngestService;
import com.tradeagent.intent.CanonicalJson;
import com.tradeagent.observability.TradeAgentMetrics;
import com.tradeagent.proposal.ProposalCandidate;
import com.tradeagent.proposal.ProposalOutcome;
import com.tradeagent.proposal.ProposalService;
import com.tradeagent.store.TradeStore;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-threaded ingest and propose loop with independent schedules.
 *
 * <p>Each cycle:
 * <ol>
 *   <li>market ingest, if due</li>
 *   <li>news ingest, if due</li>
 *   <li>propose, if due or if either ingest ran; skipped when an ingest failed</li>
 * </ol>
 * Each schedule's next run is {@code now + interval + uniform(0, jitter)}. A proposal whose
 * signature matches the last finalized one within the propose cooldown is not re-submitted.
 *
 * <p>Any failure in a cycle engages exponential backoff (1, 2, 4 ... seconds, capped at
 * {@code maxBackoffSeconds}); a clean cycle resets it. State is saved after every cycle, and a
 * restarted runner resumes each schedule from its last success.
 *
 * <p>Not thread-safe. One runner per thread, stopped through its {@link RunnerStopToken}.
 */
public class Runner {

    private static final Logger log = LoggerFactory.getLogger(Runner.class);

    public static final String DEFAULT_NAME = "default";

    private static final int MAX_ERROR_SUMMARY = 500;

    private final String name;
    private final TradeAgentProperties.Runner config;
    private final TradingMode mode;
    private final IngestService ingestService;
    private final ProposalService proposalService;
    private final ExecutionEngine executionEngine;
    private final TradeStore tradeStore;
    private final TradeAgentMetrics metrics;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Random jitterRandom;

    private final RunnerState state;
    private Instant nextMarketAt;
    private Instant nextNewsAt;
    private Instant nextProposeAt;
    private long backoffSeconds;

    public Runner(
            String name,
            TradeAgentProperties.Runner config,
            IngestService ingestService,
            ProposalService proposalService,
            ExecutionEngine executionEngine,
            TradeStore tradeStore,
            TradeAgentMetrics metrics,
            Clock clock,
            Sleeper sleeper,
            Random jitterRandom) {
        this.name = name;
        this.config = config;
        this.mode = TradingMode.fromWire(config.getMode());
        this.ingestService = ingestService;
        this.proposalService = proposalService;
        this.executionEngine = executionEngine;
        this.tradeStore = tradeStore;
        this.metrics = metrics;
        this.clock = clock;
        this.sleeper = sleeper;
        this.jitterRandom = jitterRandom;

        this.state = loadState();
        Instant now = clock.instant();
        this.nextMarketAt = resumeAt(state.getLastMarketIngestAt(), config.getMarketIntervalSeconds(), now);
        this.nextNewsAt = resumeAt(state.getLastNewsIngestAt(), config.getNewsIntervalSeconds(), now);
        this.nextProposeAt = resumeAt(state.getLastProposeAt(), config.getProposeIntervalSeconds(), now);
    }

    // ========================
    // LOOP
    // ========================

    /**
     * Runs cycles until a stop is requested, or until {@code maxCycles} cycles have run when it
     * is positive. Use {@code maxCycles = 1} for a single cron-style pass.
     */
    public void run(RunnerStopToken stopToken, int maxCycles) {
        log.info("Runner '{}' starting in {} mode for {} (strategy {})",
                name, mode.wireValue(), config.getSymbol(), config.getStrategy());
        int cycles = 0;
        while (!stopToken.isStopRequested()) {
            if (maxCycles > 0 && cycles >= maxCycles) {
                break;
            }
            runCycle();
            cycles++;
            if ((maxCycles > 0 && cycles >= maxCycles) || stopToken.isStopRequested()) {
                break;
            }

            Duration pause = pauseBeforeNextCycle();
            log.debug("Runner '{}' sleeping {} ms", name, pause.toMillis());
            if (!pause.isZero()) {
                try {
                    sleeper.sleep(pause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.info("Runner '{}' interrupted while sleeping", name);
                    break;
                }
            }
        }
        log.info("Runner '{}' stopped after {} cycles (iteration {})", name, cycles, state.getIteration());
    }

    /** One pass over the three schedules. Never throws. */
    void runCycle() {
        long started = System.nanoTime();
        state.setIteration(state.getIteration() + 1);
        Instant now = clock.instant();
        List<String> errors = new ArrayList<>();
        boolean ingestAttempted = false;
        boolean ingestFailed = false;

        if (!now.isBefore(nextMarketAt)) {
            ingestAttempted = true;
            try {
                IngestResult result = ingestService.ingestMarket(config.isOrderbook());
                if (result.isOk()) {
                    state.setLastMarketIngestAt(clock.instant());
                } else {
                    ingestFailed = true;
                    errors.add("market ingest errors=" + result.getErrors().size());
                }
            } catch (RuntimeException e) {
                ingestFailed = true;
                errors.add("market ingest exception=" + e.getMessage());
                log.warn("Runner market ingest failed", e);
            }
            nextMarketAt = scheduleNext(now, config.getMarketIntervalSeconds());
        }

        if (!now.isBefore(nextNewsAt)) {
            ingestAttempted = true;
            try {
                IngestResult result = ingestService.ingestNews();
                if (result.isOk()) {
                    state.setLastNewsIngestAt(clock.instant());
                } else {
                    ingestFailed = true;
                    errors.add("news ingest errors=" + result.getErrors().size());
                }
            } catch (RuntimeException e) {
                ingestFailed = true;
                errors.add("news ingest exception=" + e.getMessage());
                log.warn("Runner news ingest failed", e);
            }
            nextNewsAt = scheduleNext(now, config.getNewsIntervalSeconds());
        }

        if (!now.isBefore(nextProposeAt) || ingestAttempted) {
            if (ingestFailed) {
                log.warn("Runner propose skipped: ingest failed this cycle");
            } else {
                try {
                    propose(now);
                } catch (RuntimeException e) {
                    errors.add("propose exception=" + e.getMessage());
                    log.warn("Runner propose failed", e);
                }
            }
            nextProposeAt = scheduleNext(now, config.getProposeIntervalSeconds());
        }

        if (errors.isEmpty()) {
            backoffSeconds = 0;
            metrics.runnerCycleSucceeded();
        } else {
            String summary = String.join("; ", errors);
            state.setLastErrorAt(clock.instant());
            state.setLastErrorSummary(
                    summary.length() > MAX_ERROR_SUMMARY ? summary.substring(0, MAX_ERROR_SUMMARY) : summary);
            backoffSeconds = nextBackoff(backoffSeconds, config.getMaxBackoffSeconds());
            metrics.runnerCycleFailed(backoffSeconds);
            log.error("Runner cycle {} failed ({}), backing off {}s", state.getIteration(), summary, backoffSeconds);
        }

        saveState();
        log.info("Runner cycle {} done in {} ms",
                state.getIteration(), Duration.ofNanos(System.nanoTime() - started).toMillis());
    }

    // ========================
    // PROPOSE
    // ========================

    private void propose(Instant now) {
        ProposalCandidate candidate = proposalService.prepare(config.getSymbol(), config.getStrategy());
        if (!candidate.isProposed()) {
            log.info("Runner propose: {} ({})", candidate.getStatus(), candidate.getReason());
            state.setLastProposeAt(clock.instant());
            return;
        }

        String signature = signature(candidate.getPlan(), mode);
        if (withinCooldown(signature, now)) {
            log.info("Runner propose skipped: no change since {}", state.getLastSignatureAt());
            state.setLastProposeAt(clock.instant());
            return;
        }

        ProposalOutcome outcome = proposalService.finalizeProposal(candidate, mode);
        Instant finalizedAt = clock.instant();
        state.setLastProposeAt(finalizedAt);
        state.setLastSignature(signature);
        state.setLastSignatureAt(finalizedAt);
        log.info("Runner proposed intent {}: {} {} @ {}",
                outcome.getIntent().getIntentId(),
                outcome.getIntent().getSide(),
                outcome.getIntent().getSize().toPlainString(),
                outcome.getIntent().getPrice().toPlainString());

        if (config.isAutoExecute()) {
            ExecutionResult result = executionEngine.execute(outcome.getIntent().getIntentId(), mode);
            log.info("Runner auto-execute of {}: {} ({})",
                    outcome.getIntent().getIntentId(), result.getStatus(), result.getMessage());
        }
    }

    /**
     * Hash of the economically meaningful fields of a plan. Size and price are rounded to 8
     * decimals so noise below that does not defeat deduplication.
     */
    public static String signature(TradePlan plan, TradingMode mode) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("symbol", plan.getSymbol());
        payload.put("side", plan.getSide().wireValue());
        payload.put("size", plan.getSize().setScale(8, RoundingMode.HALF_EVEN));
        payload.put("price", plan.getPrice().setScale(8, RoundingMode.HALF_EVEN));
        payload.put("strategy", plan.getStrategy());
        payload.put("mode", mode.wireValue());
        payload.put("order_type", "limit");
        payload.put("time_in_force", "GTC");
        return CanonicalJson.sha256Hex(CanonicalJson.write(payload));
    }

    private boolean withinCooldown(String signature, Instant now) {
        if (state.getLastSignature() == null || state.getLastSignatureAt() == null) {
            return false;
        }
        if (!state.getLastSignature().equals(signature)) {
            return false;
        }
        return Duration.between(state.getLastSignatureAt(), now).getSeconds() < config.getProposeCooldownSeconds();
    }

    // ========================
    // SCHEDULING
    // ========================

    static long nextBackoff(long current, long maxBackoffSeconds) {
        if (current <= 0) {
            return 1;
        }
        return Math.min(current * 2, maxBackoffSeconds);
    }

    private Instant scheduleNext(Instant now, int intervalSeconds) {
        return now.plusSeconds(intervalSeconds).plus(jitter());
    }

    private Duration jitter() {
        if (config.getJitterSeconds() <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis((long) (jitterRandom.nextDouble() * config.getJitterSeconds() * 1000));
    }

    private static Instant resumeAt(Instant lastSuccess, int intervalSeconds, Instant now) {
        if (lastSuccess == null) {
            return now;
        }
        Instant due = lastSuccess.plusSeconds(intervalSeconds);
        return due.isBefore(now) ? now : due;
    }

    private Duration pauseBeforeNextCycle() {
        Instant nextDue = Stream.of(nextMarketAt, nextNewsAt, nextProposeAt)
                .min(Instant::compareTo)
                .orElseThrow();
        Duration pause = Duration.between(clock.instant(), nextDue);
        if (pause.isNegative()) {
            pause = Duration.ZERO;
        }
        Duration backoff = Duration.ofSeconds(backoffSeconds);
        return backoff.compareTo(pause) > 0 ? backoff : pause;
    }

    // ========================
    // STATE
    // ========================

    private RunnerState loadState() {
        try {
            return tradeStore.loadRunnerState(name).orElseGet(RunnerState::new);
        } catch (RuntimeException e) {
            log.warn("Runner state for '{}' unreadable, starting fresh", name, e);
            return new RunnerState();
        }
    }

    private void saveState() {
        try {
            tradeStore.saveRunnerState(name, state);
        } catch (RuntimeException e) {
            log.error("Failed to save runner state for '{}'", name, e);
        }
    }

    public RunnerState getState() {
        return state;
    }

    public long getBackoffSeconds() {
        return backoffSeconds;
    }

    Instant getNextMarketAt() {
        return nextMarketAt;
    }

    Instant getNextProposeAt() {
        return nextProposeAt;
    }
}
