package com.socialpulse.api.dto;

import lombok.Builder;

import java.util.Map;

@Builder
public record PostStatsDto(
        long totalPosts,
        long postsToday, // UTC 자정 이후 수집분
        double avgEngagement,
        Map<String, SourceBreakdown> perSource
) {

    public record SourceBreakdown(long count, double avgEngagement) {
    }
}
