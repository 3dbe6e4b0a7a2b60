package com.socialpulse.api.dto;

import com.socialpulse.api.entity.Source;
import lombok.Builder;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 어댑터가 반환하는 정규화된 수집 결과. (source, sourceId) 외에는 식별자가 없다.
 */
@Builder
public record NormalizedItem(
        Source source,
        String sourceId,
        String sourceUrl,
        String author,
        String title,
        String body,
        int score,
        int numComments,
        LocalDateTime publishedAt,
        String category,
        String subreddit, // 커뮤니티 라벨 (reddit 외에는 null)
        Map<String, Object> extra
) {

    public NormalizedItem {
        sourceUrl = sourceUrl == null ? "" : sourceUrl;
        author = author == null ? "" : author;
        title = title == null ? "" : title;
        body = body == null ? "" : body;
        category = category == null ? "" : category;
        extra = extra == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }
}
