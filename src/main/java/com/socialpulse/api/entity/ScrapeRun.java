package com.socialpulse.api.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One row per cycle attempt. Append-only: every column is insert-only.
 */
@Entity
@Table(
        name = "scrape_runs",
        indexes = @Index(name = "ix_scrape_runs_started_at", columnList = "started_at")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class ScrapeRun {

    public static final int MAX_ERROR_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private Source source;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private RunStatus status;

    @Column(name = "items_scraped", nullable = false, updatable = false)
    private int itemsScraped;

    @Column(name = "items_new", nullable = false, updatable = false)
    private int itemsNew;

    @Column(name = "error_message", nullable = false, length = MAX_ERROR_LENGTH, updatable = false)
    private String errorMessage;

    @Column(name = "duration_seconds", nullable = false, updatable = false)
    private double durationSeconds;

    @Column(name = "started_at", nullable = false, updatable = false)
    private LocalDateTime startedAt;

    @Column(name = "finished_at", updatable = false)
    private LocalDateTime finishedAt;
}
