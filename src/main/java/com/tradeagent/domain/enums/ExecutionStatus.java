package com.tradeagent.domain.enums;

import java.util.Locale;

/**
 * Outcome of one execution attempt. Maps onto the intent status written in the same transaction.
 */
public enum ExecutionStatus {
    FILLED,
    OPEN,
    CANCELED,
    REJECTED,
    EXPIRED,
    ERROR;

    public IntentStatus toIntentStatus() {
        return switch (this) {
            case FILLED -> IntentStatus.FILLED;
            case OPEN -> IntentStatus.OPEN;
            case CANCELED -> IntentStatus.CANCELED;
            case REJECTED -> IntentStatus.REJECTED;
            case EXPIRED -> IntentStatus.EXPIRED;
            case ERROR -> IntentStatus.ERROR;
        };
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
