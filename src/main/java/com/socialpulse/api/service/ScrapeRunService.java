package com.socialpulse.api.service;

import com.socialpulse.api.dto.ScrapeRunDto;
import com.socialpulse.api.dto.SourceStatsDto;
import com.socialpulse.api.entity.RunStatus;
import com.socialpulse.api.entity.ScrapeRun;
import com.socialpulse.api.entity.Source;
import com.socialpulse.api.repository.ScrapeRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 수집 실행 이력. 기록은 append-only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScrapeRunService {

    static final int MAX_LIMIT = 100;

    private final ScrapeRunRepository runRepository;
    private final Clock clock;

    @Transactional
    public ScrapeRun record(Source source,
                            RunStatus status,
                            int itemsScraped,
                            int itemsNew,
                            String errorText,
                            Duration duration,
                            LocalDateTime startedAt) {
        String error = errorText == null ? "" : errorText;
        if (error.length() > ScrapeRun.MAX_ERROR_LENGTH) {
            error = error.substring(0, ScrapeRun.MAX_ERROR_LENGTH);
        }
        double seconds = duration == null ? 0.0 : duration.toNanos() / 1_000_000_000.0;

        ScrapeRun run = ScrapeRun.builder()
                .source(source)
                .status(status)
                .itemsScraped(itemsScraped)
                .itemsNew(itemsNew)
                .errorMessage(error)
                .durationSeconds(round(seconds, 2))
                .startedAt(startedAt)
                .finishedAt(LocalDateTime.now(clock))
                .build();

        ScrapeRun saved = runRepository.save(run);
        log.debug("Recorded run: source={}, status={}, items={}, new={}", source, status, itemsScraped, itemsNew);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<ScrapeRunDto> recent(int limit) {
        int size = Math.max(1, Math.min(limit, MAX_LIMIT));
        return runRepository.findAllByOrderByStartedAtDescIdDesc(PageRequest.of(0, size)).stream()
                .map(ScrapeRunDto::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<SourceStatsDto> sourceStats() {
        return runRepository.aggregateBySource(RunStatus.SUCCESS).stream()
                .map(row -> {
                    long total = row.getTotalRuns() == null ? 0L : row.getTotalRuns();
                    long success = row.getSuccessRuns() == null ? 0L : row.getSuccessRuns();
                    return SourceStatsDto.builder()
                            .source(row.getSource())
                            .totalRuns(total)
                            .successRate(total == 0 ? 0.0 : round((double) success / total, 2))
                            .lastRun(row.getLastRun())
                            .totalItemsNew(row.getTotalItemsNew() == null ? 0L : row.getTotalItemsNew())
                            .build();
                })
                .toList();
    }

    static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
