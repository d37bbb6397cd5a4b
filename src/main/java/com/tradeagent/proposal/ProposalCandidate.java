package com.tradeagent.proposal;

import com.tradeagent.domain.model.TradePlan;
import lombok.Builder;
import lombok.Data;

/**
 * A risk-checked plan that has not been stored yet. The runner compares its signature with
 * the last finalized one before calling {@link ProposalService#finalizeProposal}.
 */
@Data
@Builder
public class ProposalCandidate {

    private ProposalStatus status;

    /** Risk-approved plan for PROPOSED, the hold plan for HOLD, null for REJECTED. */
    private TradePlan plan;

    private String featuresRef;
    private String reason;

    public boolean isProposed() {
        return status == ProposalStatus.PROPOSED && plan != null;
    }
}
