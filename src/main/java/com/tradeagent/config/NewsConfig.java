package com.tradeagent.config;

import com.tradeagent.news.NewsFeed;
import com.tradeagent.news.PointInTimeNewsFilter;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** News availability rules and the default (empty) news feed. */
@Configuration
public class NewsConfig {

    @Bean
    public PointInTimeNewsFilter pointInTimeNewsFilter(TradeAgentProperties properties) {
        TradeAgentProperties.News news = properties.getNews();
        return new PointInTimeNewsFilter(
                Duration.ofSeconds(news.getNewsLatencySeconds()), Duration.ofHours(news.getSentimentLookbackHours()));
    }

    @Bean
    @ConditionalOnMissingBean
    public NewsFeed newsFeed() {
        return NewsFeed.NONE;
    }
}
