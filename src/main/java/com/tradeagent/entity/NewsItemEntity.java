package com.tradeagent.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the news_items table.
 * The id is derived from the item's URL (or title) so re-ingesting a feed is idempotent.
 * observed_at is set once, on first sight, and never moved.
 */
@Entity
@Table(name = "news_items")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NewsItemEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(length = 500)
    private String title;

    @Column(length = 100)
    private String source;

    @Column(length = 1000)
    private String url;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "observed_at", nullable = false)
    private Instant observedAt;

    @Column(precision = 10, scale = 6)
    private BigDecimal sentiment;

    @Column(name = "source_weight", precision = 10, scale = 6)
    private BigDecimal sourceWeight;
}
