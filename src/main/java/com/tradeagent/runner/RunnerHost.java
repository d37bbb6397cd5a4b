package com.tradeagent.runner;

import com.tradeagent.config.TradeAgentProperties;
import com.tradeagent.execution.ExecutionEngine;
import com.tradeagent.ingest.IngestService;
import com.tradeagent.observability.TradeAgentMetrics;
import com.tradeagent.proposal.ProposalService;
import com.tradeagent.store.TradeStore;
import java.time.Clock;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Owns the background {@link Runner} and its stop token.
 *
 * <p>When {@code tradeagent.runner.enabled} is true the runner loop starts on its own thread
 * with the application context. On shutdown a stop is requested and the host waits for the
 * in-flight cycle to finish; a cycle is never interrupted, so an order placement or fill write
 * cannot be cut in half.
 */
@Component
public class RunnerHost implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RunnerHost.class);

    /** Grace on top of the live order timeout when waiting for the last cycle. */
    private static final long STOP_GRACE_SECONDS = 30;

    private final TradeAgentProperties properties;
    private final IngestService ingestService;
    private final ProposalService proposalService;
    private final ExecutionEngine executionEngine;
    private final TradeStore tradeStore;
    private final TradeAgentMetrics metrics;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile RunnerStopToken stopToken;
    private volatile Thread thread;

    public RunnerHost(
            TradeAgentProperties properties,
            IngestService ingestService,
            ProposalService proposalService,
            ExecutionEngine executionEngine,
            TradeStore tradeStore,
            TradeAgentMetrics metrics,
            Clock clock) {
        this.properties = properties;
        this.ingestService = ingestService;
        this.proposalService = proposalService;
        this.executionEngine = executionEngine;
        this.tradeStore = tradeStore;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public void start() {
        if (!properties.getRunner().isEnabled()) {
            log.info("Background runner disabled (tradeagent.runner.enabled=false)");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        RunnerStopToken token = new RunnerStopToken();
        Runner runner = newRunner(token);
        stopToken = token;
        thread = new Thread(() -> runLoop(runner, token), "trade-agent-runner");
        thread.start();
    }

    /** Builds a runner whose between-cycle sleeps end early when {@code token} is stopped. */
    Runner newRunner(RunnerStopToken token) {
        return new Runner(
                Runner.DEFAULT_NAME,
                properties.getRunner(),
                ingestService,
                proposalService,
                executionEngine,
                tradeStore,
                metrics,
                clock,
                token::await,
                new Random());
    }

    private void runLoop(Runner runner, RunnerStopToken token) {
        try {
            runner.run(token, 0);
        } catch (RuntimeException e) {
            log.error("Background runner terminated unexpectedly", e);
        } finally {
            running.set(false);
        }
    }

    @Override
    public void stop() {
        RunnerStopToken token = stopToken;
        Thread current = thread;
        if (token == null || current == null) {
            return;
        }
        log.info("Stopping background runner, waiting for the current cycle");
        token.requestStop();
        try {
            current.join(TimeUnit.SECONDS.toMillis(
                    properties.getTrading().getOrderTimeoutSeconds() + STOP_GRACE_SECONDS));
            if (current.isAlive()) {
                log.warn("Background runner still finishing its cycle after the stop timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Stop before the datasource and other beans the runner writes through.
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
