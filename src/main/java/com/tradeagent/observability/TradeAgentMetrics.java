package com.tradeagent.observability;

import com.tradeagent.domain.enums.ExecutionStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the decision-to-execution pipeline.
 * <ul>
 *   <li><b>intents.proposed</b> (counter): intents stored by a proposal</li>
 *   <li><b>risk.rejections</b> (counter): plans rejected by the risk engine</li>
 *   <li><b>approvals.granted</b> (counter)</li>
 *   <li><b>executions</b> (counter, tag status)</li>
 *   <li><b>runner.cycle.failures</b> (counter)</li>
 *   <li><b>runner.backoff.seconds</b> (gauge): current backoff sleep</li>
 * </ul>
 */
@Service
public class TradeAgentMetrics {

    private final Counter intentsProposed;
    private final Counter riskRejections;
    private final Counter approvalsGranted;
    private final Counter runnerFailures;
    private final Map<ExecutionStatus, Counter> executionsByStatus = new EnumMap<>(ExecutionStatus.class);
    private final AtomicLong runnerBackoffSeconds = new AtomicLong();

    public TradeAgentMetrics(MeterRegistry meterRegistry) {
        this.intentsProposed = Counter.builder("intents.proposed")
                .description("Order intents created from approved plans")
                .register(meterRegistry);
        this.riskRejections = Counter.builder("risk.rejections")
                .description("Trade plans rejected by the risk engine")
                .register(meterRegistry);
        this.approvalsGranted = Counter.builder("approvals.granted")
                .description("Human approvals recorded")
                .register(meterRegistry);
        this.runnerFailures = Counter.builder("runner.cycle.failures")
                .description("Runner cycles that ended with an error")
                .register(meterRegistry);
        for (ExecutionStatus status : ExecutionStatus.values()) {
            executionsByStatus.put(
                    status,
                    Counter.builder("executions")
                            .description("Execution attempts by outcome")
                            .tag("status", status.wireValue())
                            .register(meterRegistry));
        }
        meterRegistry.gauge("runner.backoff.seconds", runnerBackoffSeconds);
    }

    public void intentProposed() {
        intentsProposed.increment();
    }

    public void riskRejected() {
        riskRejections.increment();
    }

    public void approvalGranted() {
        approvalsGranted.increment();
    }

    public void executionRecorded(ExecutionStatus status) {
        executionsByStatus.get(status).increment();
    }

    public void runnerCycleFailed(long backoffSeconds) {
        runnerFailures.increment();
        runnerBackoffSeconds.set(backoffSeconds);
    }

    public void runnerCycleSucceeded() {
        runnerBackoffSeconds.set(0);
    }
}
