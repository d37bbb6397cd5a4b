package com.tradeagent.proposal;

public enum ProposalStatus {
    /** Risk approved a buy or sell; ready to be frozen into an intent. */
    PROPOSED,
    /** Nothing to do: the strategy held, or the long-only guard turned a sell into a hold. */
    HOLD,
    /** Risk blocked the plan. */
    REJECTED
}
