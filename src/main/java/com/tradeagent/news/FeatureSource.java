package com.tradeagent.news;

import com.tradeagent.domain.model.NewsFeatures;
import com.tradeagent.domain.model.NewsItem;
import java.util.List;

/** Reduces the news items visible at one point in time to a feature vector. */
public interface FeatureSource {

    NewsFeatures aggregate(List<NewsItem> pointInTimeItems);
}
