package com.tradeagent.news;

import com.tradeagent.domain.model.NewsFeatures;
import com.tradeagent.domain.model.NewsItem;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Source-weighted sentiment aggregate.
 *
 * <p>{@code sentimentWeighted = sum(sentiment * weight) / max(sum(|weight|), 1)}. Items with no
 * weight count with weight 1.
 */
@Component
public class NewsFeatureAggregator implements FeatureSource {

    private static final MathContext MC = MathContext.DECIMAL64;

    @Override
    public NewsFeatures aggregate(List<NewsItem> pointInTimeItems) {
        if (pointInTimeItems == null || pointInTimeItems.isEmpty()) {
            return NewsFeatures.empty();
        }

        BigDecimal weightedSum = BigDecimal.ZERO;
        BigDecimal weightTotal = BigDecimal.ZERO;
        BigDecimal absWeightTotal = BigDecimal.ZERO;
        int positive = 0;
        int negative = 0;

        for (NewsItem item : pointInTimeItems) {
            BigDecimal sentiment = item.getSentiment() != null ? item.getSentiment() : BigDecimal.ZERO;
            BigDecimal weight = item.getSourceWeight() != null ? item.getSourceWeight() : BigDecimal.ONE;
            weightedSum = weightedSum.add(sentiment.multiply(weight));
            weightTotal = weightTotal.add(weight);
            absWeightTotal = absWeightTotal.add(weight.abs());
            if (sentiment.signum() > 0) {
                positive++;
            } else if (sentiment.signum() < 0) {
                negative++;
            }
        }

        int count = pointInTimeItems.size();
        return NewsFeatures.builder()
                .sentimentWeighted(weightedSum.divide(absWeightTotal.max(BigDecimal.ONE), MC))
                .newsCount(count)
                .positiveCount(positive)
                .negativeCount(negative)
                .avgSourceWeight(weightTotal.divide(BigDecimal.valueOf(count), MC))
                .build();
    }

    /** Flat map form stored as a feature snapshot. */
    public static Map<String, Object> toSnapshot(NewsFeatures features) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("sentiment_weighted", features.getSentimentWeighted());
        snapshot.put("news_count", features.getNewsCount());
        snapshot.put("positive_count", features.getPositiveCount());
        snapshot.put("negative_count", features.getNegativeCount());
        snapshot.put("avg_source_weight", features.getAvgSourceWeight());
        return snapshot;
    }
}
