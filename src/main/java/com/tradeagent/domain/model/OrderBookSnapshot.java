package com.tradeagent.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/** Top of book only; depth is never modelled. */
@Data
@Builder
public class OrderBookSnapshot {

    private String symbol;
    private Instant timestamp;
    private BigDecimal bid;
    private BigDecimal ask;
    private BigDecimal lastPrice;
}
