package com.tradeagent.news;

import com.tradeagent.domain.model.NewsItem;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Decides which news items a decision at time {@code T} may see.
 *
 * <p>An item becomes available at {@code max(observedAt, publishedAt + latency)}. It is usable at
 * {@code T} when it is available at or before {@code T} and was published inside the lookback
 * window {@code [T - lookback, T]}. Backtests and live proposals both go through this class,
 * so a backtest can never see an item the live path could not have seen at the same time.
 */
public class PointInTimeNewsFilter {

    private final Duration latency;
    private final Duration lookback;

    public PointInTimeNewsFilter(Duration latency, Duration lookback) {
        this.latency = latency;
        this.lookback = lookback;
    }

    public Instant availableAt(NewsItem item) {
        Instant published = item.getPublishedAt().plus(latency);
        Instant observed = item.getObservedAt() != null ? item.getObservedAt() : published;
        return observed.isAfter(published) ? observed : published;
    }

    public boolean isAvailable(NewsItem item, Instant decisionTime) {
        return !availableAt(item).isAfter(decisionTime);
    }

    public boolean isUsable(NewsItem item, Instant decisionTime) {
        Instant windowStart = decisionTime.minus(lookback);
        return isAvailable(item, decisionTime)
                && !item.getPublishedAt().isBefore(windowStart)
                && !item.getPublishedAt().isAfter(decisionTime);
    }

    public List<NewsItem> usableAt(List<NewsItem> candidates, Instant decisionTime) {
        return candidates.stream()
                .filter(item -> isUsable(item, decisionTime))
                .toList();
    }

    /** Candidates ordered by the time they become available, for incremental replay. */
    public List<NewsItem> byAvailability(List<NewsItem> candidates) {
        return candidates.stream()
                .sorted(Comparator.comparing(this::availableAt).thenComparing(NewsItem::getId, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    public Duration getLookback() {
        return lookback;
    }
}
