package com.tradeagent.news;

import com.tradeagent.domain.model.NewsItem;
import java.time.Instant;
import java.util.List;

/**
 * Source of scored news items. Implementations set {@code observedAt} to the time they fetched
 * the item.
 */
public interface NewsFeed {

    List<NewsItem> fetch(Instant observedAt);

    /** Feed used when no real source is configured. */
    NewsFeed NONE = observedAt -> List.of();
}
