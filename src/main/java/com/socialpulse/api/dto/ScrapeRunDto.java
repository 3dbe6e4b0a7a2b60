package com.socialpulse.api.dto;

import com.socialpulse.api.entity.RunStatus;
import com.socialpulse.api.entity.ScrapeRun;
import com.socialpulse.api.entity.Source;
import lombok.Builder;

import java.time.LocalDateTime;

@Builder
public record ScrapeRunDto(
        Long id,
        Source source,
        RunStatus status,
        int itemsScraped,
        int itemsNew,
        String errorMessage,
        double durationSeconds,
        LocalDateTime startedAt,
        LocalDateTime finishedAt
) {

    public static ScrapeRunDto from(ScrapeRun run) {
        return ScrapeRunDto.builder()
                .id(run.getId())
                .source(run.getSource())
                .status(run.getStatus())
                .itemsScraped(run.getItemsScraped())
                .itemsNew(run.getItemsNew())
                .errorMessage(run.getErrorMessage())
                .durationSeconds(run.getDurationSeconds())
                .startedAt(run.getStartedAt())
                .finishedAt(run.getFinishedAt())
                .build();
    }
}
