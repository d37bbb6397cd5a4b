package com.tradeagent.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * Human approval bound to the hash an intent had at approval time.
 * Only the phrase hash is kept; the phrase itself is never stored.
 */
@Data
@Builder
public class Approval {

    private String intentId;
    private String intentHash;
    private Instant approvedAt;
    private String approvedBy;
    private String phraseHash;
}
