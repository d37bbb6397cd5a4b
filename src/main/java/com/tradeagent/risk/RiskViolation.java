package com.tradeagent.risk;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * The check that stopped a plan, with a human-readable reason.
 */
@Getter
@AllArgsConstructor(staticName = "of")
public class RiskViolation {

    private final String code;
    private final String message;

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
