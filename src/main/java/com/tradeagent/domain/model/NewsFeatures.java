package com.tradeagent.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/** Aggregate of the news items visible at one point in time. */
@Data
@Builder
public class NewsFeatures {

    private BigDecimal sentimentWeighted;
    private int newsCount;
    private int positiveCount;
    private int negativeCount;
    private BigDecimal avgSourceWeight;

    public static NewsFeatures empty() {
        return NewsFeatures.builder()
                .sentimentWeighted(BigDecimal.ZERO)
                .avgSourceWeight(BigDecimal.ZERO)
                .build();
    }
}
