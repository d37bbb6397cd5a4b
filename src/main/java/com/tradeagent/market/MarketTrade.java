package com.tradeagent.market;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/** A public trade print. */
@Data
@Builder
public class MarketTrade {

    private Instant timestamp;
    private BigDecimal price;
    private BigDecimal amount;
}
