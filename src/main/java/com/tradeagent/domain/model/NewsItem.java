package com.tradeagent.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * A scored news item.
 *
 * <p>{@code publishedAt} is the source's timestamp; {@code observedAt} is when this process
 * first saw it. Both bound when the item may influence a decision.
 */
@Data
@Builder
public class NewsItem {

    private String id;
    private String title;
    private String source;
    private String url;
    private Instant publishedAt;
    private Instant observedAt;

    /** In [-1, 1]. */
    private BigDecimal sentiment;

    private BigDecimal sourceWeight;
}
