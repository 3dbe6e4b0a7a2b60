package com.socialpulse.api.entity;

import com.socialpulse.api.dto.NormalizedItem;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@Entity
@Table(
        name = "posts",
        uniqueConstraints = @UniqueConstraint(name = "uk_posts_source_source_id", columnNames = {"source", "source_id"}),
        indexes = {
                @Index(name = "ix_posts_source", columnList = "source"),
                @Index(name = "ix_posts_published_at", columnList = "published_at")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class Post {

    public static final int MAX_TEXT_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private Source source;

    @Column(name = "source_id", nullable = false, length = 256, updatable = false)
    private String sourceId;

    @Column(name = "source_url", nullable = false, length = MAX_TEXT_LENGTH, updatable = false)
    private String sourceUrl;

    @Column(nullable = false, length = 256, updatable = false)
    private String author;

    // title/body/publishedAt은 최초 수집 시 한 번만 기록
    @Column(nullable = false, length = MAX_TEXT_LENGTH, updatable = false)
    private String title;

    @Column(nullable = false, length = MAX_TEXT_LENGTH, updatable = false)
    private String body;

    @Column(length = 100, updatable = false)
    private String subreddit;

    @Column(nullable = false, length = 100, updatable = false)
    private String category;

    @Column(nullable = false)
    private int score;

    @Column(name = "num_comments", nullable = false)
    private int numComments;

    @Column(name = "engagement_score", nullable = false)
    private double engagementScore;

    @Column(name = "published_at", nullable = false, updatable = false)
    private LocalDateTime publishedAt;

    @Column(name = "scraped_at", nullable = false)
    private LocalDateTime scrapedAt;

    @Convert(converter = ExtraFieldsConverter.class)
    @Column(name = "extra", length = 4000, updatable = false)
    @Builder.Default
    private Map<String, Object> extra = new HashMap<>();

    public static double engagement(int score, int numComments) {
        return score + numComments * 2.0;
    }

    public static Post from(NormalizedItem item, LocalDateTime now) {
        return Post.builder()
                .source(item.source())
                .sourceId(item.sourceId())
                .sourceUrl(truncate(item.sourceUrl(), MAX_TEXT_LENGTH))
                .author(truncate(item.author(), 256))
                .title(truncate(item.title(), MAX_TEXT_LENGTH))
                .body(truncate(item.body(), MAX_TEXT_LENGTH))
                .subreddit(item.subreddit())
                .category(truncate(item.category(), 100))
                .score(item.score())
                .numComments(item.numComments())
                .engagementScore(engagement(item.score(), item.numComments()))
                .publishedAt(item.publishedAt() != null ? item.publishedAt() : now)
                .scrapedAt(now)
                .extra(new HashMap<>(item.extra()))
                .build();
    }

    /**
     * 재수집 시 변하는 값만 갱신한다.
     */
    public void refreshFrom(NormalizedItem item, LocalDateTime now) {
        this.score = item.score();
        this.numComments = item.numComments();
        this.engagementScore = engagement(item.score(), item.numComments());
        this.scrapedAt = now;
    }

    private static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max);
    }
}
