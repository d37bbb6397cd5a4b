package com.tradeagent.execution;

import com.tradeagent.domain.enums.ExecutionStatus;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of {@link ExecutionEngine#execute}. Rejections carry a human-readable reason and
 * no execution id; anything that reached the market or the simulator carries one.
 */
@Getter
@ToString
public class ExecutionResult {

    private final ExecutionStatus status;
    private final String message;
    private final String execId;

    private ExecutionResult(ExecutionStatus status, String message, String execId) {
        this.status = status;
        this.message = message;
        this.execId = execId;
    }

    public static ExecutionResult rejected(String message) {
        return new ExecutionResult(ExecutionStatus.REJECTED, message, null);
    }

    public static ExecutionResult of(ExecutionStatus status, String message, String execId) {
        return new ExecutionResult(status, message, execId);
    }

    public boolean isRejected() {
        return status == ExecutionStatus.REJECTED;
    }
}
