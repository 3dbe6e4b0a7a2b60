package com.socialpulse.api.dto;

import com.socialpulse.api.entity.Post;
import com.socialpulse.api.entity.Source;
import lombok.Builder;

import java.time.LocalDateTime;

@Builder
public record PostDto(
        Long id,
        Source source,
        String sourceId,
        String sourceUrl,
        String author,
        String title,
        String body, // 목록용 미리보기 (최대 300자)
        String subreddit,
        String category,
        int score,
        int numComments,
        double engagementScore,
        LocalDateTime publishedAt,
        LocalDateTime scrapedAt
) {

    public static final int PREVIEW_LENGTH = 300;

    public static PostDto from(Post post) {
        String body = post.getBody();
        return PostDto.builder()
                .id(post.getId())
                .source(post.getSource())
                .sourceId(post.getSourceId())
                .sourceUrl(post.getSourceUrl())
                .author(post.getAuthor())
                .title(post.getTitle())
                .body(body.length() > PREVIEW_LENGTH ? body.substring(0, PREVIEW_LENGTH) : body)
                .subreddit(post.getSubreddit())
                .category(post.getCategory())
                .score(post.getScore())
                .numComments(post.getNumComments())
                .engagementScore(post.getEngagementScore())
                .publishedAt(post.getPublishedAt())
                .scrapedAt(post.getScrapedAt())
                .build();
    }
}
