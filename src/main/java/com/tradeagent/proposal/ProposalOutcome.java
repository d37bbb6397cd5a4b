package com.tradeagent.proposal;

import com.tradeagent.domain.model.OrderIntent;
import com.tradeagent.domain.model.TradePlan;
import lombok.Builder;
import lombok.Data;

/** Result of a propose call. {@code intent} is set only when status is PROPOSED. */
@Data
@Builder
public class ProposalOutcome {

    private ProposalStatus status;
    private TradePlan plan;
    private String reason;
    private String featuresRef;
    private OrderIntent intent;
}
