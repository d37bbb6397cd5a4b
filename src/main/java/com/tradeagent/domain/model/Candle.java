package com.tradeagent.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** OHLCV bar keyed by symbol, timeframe and open time. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Candle {

    private String symbol;
    private String timeframe;
    private Instant timestamp;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private BigDecimal volume;
}
