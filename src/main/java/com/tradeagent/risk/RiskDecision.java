package com.tradeagent.risk;

import com.tradeagent.domain.model.TradePlan;
import lombok.Getter;

/**
 * Result of evaluating a trade plan.
 *
 * <p>Either APPROVED with the (possibly resized) plan, or REJECTED with the first failing
 * check. A rejection may still carry a plan: the long-only guard returns a HOLD plan so a
 * caller can tell "nothing to do" apart from "blocked".
 */
@Getter
public class RiskDecision {

    private final boolean approved;
    private final RiskViolation violation;
    private final TradePlan plan;

    private RiskDecision(boolean approved, RiskViolation violation, TradePlan plan) {
        this.approved = approved;
        this.violation = violation;
        this.plan = plan;
    }

    public static RiskDecision approved(TradePlan plan) {
        return new RiskDecision(true, null, plan);
    }

    public static RiskDecision rejected(RiskViolation violation) {
        return new RiskDecision(false, violation, null);
    }

    public static RiskDecision rejected(RiskViolation violation, TradePlan plan) {
        return new RiskDecision(false, violation, plan);
    }

    public boolean isRejected() {
        return !approved;
    }

    public String getReason() {
        return approved ? "ok" : violation.getMessage();
    }
}
