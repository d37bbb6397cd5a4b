package com.tradeagent.simulator;

import com.tradeagent.domain.enums.ExecutionStatus;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Getter;

/** Outcome of one paper fill attempt. */
@Getter
@AllArgsConstructor
public class PaperFill {

    private final boolean filled;
    private final BigDecimal price;
    private final BigDecimal size;
    private final BigDecimal fee;
    private final ExecutionStatus status;
    private final String message;

    static PaperFill notFilled(String message) {
        return new PaperFill(false, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, ExecutionStatus.OPEN, message);
    }
}
