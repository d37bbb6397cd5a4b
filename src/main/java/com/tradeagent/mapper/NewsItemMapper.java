package com.tradeagent.mapper;

import com.tradeagent.domain.model.NewsItem;
import com.tradeagent.entity.NewsItemEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface NewsItemMapper {

    NewsItemEntity toEntity(NewsItem item);

    NewsItem toDomain(NewsItemEntity entity);

    List<NewsItem> toDomainList(List<NewsItemEntity> entities);
}
