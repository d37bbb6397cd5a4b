package com.tradeagent.domain.enums;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle status of an order intent.
 *
 * <p>Transitions are monotonic:
 * <ul>
 *   <li>PROPOSED may move to any other status</li>
 *   <li>APPROVED may move to OPEN or any terminal status</li>
 *   <li>OPEN may move to FILLED, CANCELED, EXPIRED or ERROR</li>
 *   <li>terminal statuses never move again</li>
 * </ul>
 */
public enum IntentStatus {
    PROPOSED,
    APPROVED,
    OPEN,
    FILLED,
    REJECTED,
    EXPIRED,
    ERROR,
    CANCELED;

    private static final Set<IntentStatus> TERMINAL = EnumSet.of(FILLED, REJECTED, EXPIRED, ERROR, CANCELED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean canTransitionTo(IntentStatus target) {
        if (target == null || target == this) {
            return false;
        }
        return switch (this) {
            case PROPOSED -> true;
            case APPROVED -> target != PROPOSED;
            case OPEN -> target == FILLED || target == CANCELED || target == EXPIRED || target == ERROR;
            case FILLED, REJECTED, EXPIRED, ERROR, CANCELED -> false;
        };
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
