package com.socialpulse.api.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(
        name = "trending_topics",
        uniqueConstraints = @UniqueConstraint(name = "uk_trending_source_topic", columnNames = {"source", "topic"}),
        indexes = @Index(name = "ix_trending_last_seen", columnList = "last_seen")
)
public class TrendingTopic {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private Source source;

    @Column(nullable = false, length = 255, updatable = false)
    private String topic;

    @Column(name = "mention_count", nullable = false)
    private int mentionCount;

    @Column(name = "avg_engagement", nullable = false)
    private double avgEngagement;

    @Column(name = "first_seen", nullable = false, updatable = false)
    private LocalDateTime firstSeen;

    @Column(name = "last_seen", nullable = false)
    private LocalDateTime lastSeen;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    public static TrendingTopic of(Source source, String topic, int mentionCount, double avgEngagement, LocalDateTime now) {
        TrendingTopic t = new TrendingTopic();
        t.source = source;
        t.topic = topic;
        t.mentionCount = mentionCount;
        t.avgEngagement = avgEngagement;
        t.firstSeen = now;
        t.lastSeen = now;
        t.active = true;
        return t;
    }

    /** first_seen은 유지 */
    public void activate(int mentionCount, double avgEngagement, LocalDateTime now) {
        this.mentionCount = mentionCount;
        this.avgEngagement = avgEngagement;
        this.lastSeen = now;
        this.active = true;
    }
}
