package com.tradeagent.domain.model;

import com.tradeagent.domain.enums.ExecutionStatus;
import com.tradeagent.domain.enums.TradingMode;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * One attempt to execute an intent. Owns zero or more {@link Fill}s.
 */
@Data
@Builder
public class Execution {

    private String execId;
    private String intentId;
    private String intentHash;
    private Instant timestamp;
    private TradingMode mode;
    private ExecutionStatus status;
    private BigDecimal fee;

    /** Tag describing how the price was produced, e.g. {@code paper_bps} or {@code live}. */
    private String slippageModel;

    private Map<String, Object> details;
}
