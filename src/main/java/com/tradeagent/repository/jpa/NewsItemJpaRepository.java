package com.tradeagent.repository.jpa;

import com.tradeagent.entity.NewsItemEntity;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the news_items table.
 * The coarse query only bounds by observed_at; the point-in-time filter decides what is
 * actually visible at a given instant.
 */
@Repository
public interface NewsItemJpaRepository extends JpaRepository<NewsItemEntity, String> {

    @Query("SELECT n FROM NewsItemEntity n WHERE n.observedAt <= :to "
            + "AND (n.publishedAt IS NULL OR n.publishedAt >= :from) ORDER BY n.observedAt ASC")
    List<NewsItemEntity> findCandidates(@Param("from") Instant from, @Param("to") Instant to);
}
