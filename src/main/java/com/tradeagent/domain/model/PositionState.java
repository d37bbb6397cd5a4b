package com.tradeagent.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PositionState {

    private String symbol;
    private BigDecimal position;
    private BigDecimal avgCost;
    private BigDecimal realizedPnl;

    public static PositionState flat(String symbol) {
        return PositionState.builder()
                .symbol(symbol)
                .position(BigDecimal.ZERO)
                .avgCost(BigDecimal.ZERO)
                .realizedPnl(BigDecimal.ZERO)
                .build();
    }
}
