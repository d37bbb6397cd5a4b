package com.tradeagent.domain.model;

import com.tradeagent.domain.enums.TradeSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class Fill {

    private String fillId;
    private String execId;
    private String symbol;
    private TradeSide side;
    private BigDecimal size;
    private BigDecimal price;
    private BigDecimal fee;
    private String feeCurrency;
    private Instant timestamp;
}
