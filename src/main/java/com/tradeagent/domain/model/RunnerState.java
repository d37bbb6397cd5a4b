package com.tradeagent.domain.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Durable runner bookkeeping, rewritten after every cycle so a restarted process resumes
 * its schedules instead of re-running everything at once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunnerState {

    private long iteration;
    private Instant lastMarketIngestAt;
    private Instant lastNewsIngestAt;
    private Instant lastProposeAt;
    private Instant lastErrorAt;
    private String lastErrorSummary;
    private String lastSignature;
    private Instant lastSignatureAt;
}
