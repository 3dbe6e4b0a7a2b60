package com.socialpulse.api.dto;

import com.socialpulse.api.entity.Source;
import lombok.Builder;

import java.time.LocalDateTime;

@Builder
public record SourceStatsDto(
        Source source,
        long totalRuns,
        double successRate, // 0..1
        LocalDateTime lastRun,
        long totalItemsNew
) {
}
