package com.socialpulse.api.service;

import com.socialpulse.api.crawler.SourceAdapter;
import com.socialpulse.api.dto.ScrapeCompletedEvent;
import com.socialpulse.api.dto.ScrapeCycleResult;
import com.socialpulse.api.dto.ScrapeResult;
import com.socialpulse.api.entity.RunStatus;
import com.socialpulse.api.publisher.ScrapeEventBroadcaster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 한 소스의 수집 사이클: scrape -> upsert -> trend 재계산 -> 실행 기록 -> 이벤트 발행.
 * 호출자(스케줄러)가 소스별 동시 실행을 막는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScrapeCycleService {

    private final PostUpsertService postUpsertService;
    private final TrendService trendService;
    private final ScrapeRunService scrapeRunService;
    private final ScrapeEventBroadcaster broadcaster;
    private final Clock clock;

    public ScrapeCycleResult runCycle(SourceAdapter adapter) {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        long t0 = System.nanoTime();
        log.info("Starting scrape cycle: {}", adapter.source().getKey());

        ScrapeResult result;
        try {
            result = adapter.scrape();
        } catch (RuntimeException e) {
            log.error("Adapter {} threw unexpectedly", adapter.source().getKey(), e);
            result = ScrapeResult.failed(adapter.source(), "adapter: " + e.getMessage(),
                    Duration.ofNanos(System.nanoTime() - t0));
        }
        if (result == null) {
            result = ScrapeResult.failed(adapter.source(), "adapter: no result",
                    Duration.ofNanos(System.nanoTime() - t0));
        }

        RunStatus status = RunStatus.derive(result.items().size(), result.errors().size());
        List<String> errors = new ArrayList<>(result.errors());

        int newCount = 0;
        try {
            newCount = postUpsertService.upsert(result.items());
            trendService.recompute();
        } catch (RuntimeException e) {
            log.error("Persistence failed for {}", adapter.source().getKey(), e);
            errors.add("persistence: " + e.getMessage());
        }

        try {
            scrapeRunService.record(adapter.source(), status, result.items().size(), newCount,
                    String.join("; ", errors), result.duration(), startedAt);
        } catch (RuntimeException e) {
            log.error("Failed to record scrape run for {}", adapter.source().getKey(), e);
        }

        broadcaster.publish(ScrapeCompletedEvent.builder()
                .source(adapter.source().getKey())
                .items(result.items().size())
                .newItems(newCount)
                .errors(result.errors().size())
                .build());

        log.info("Finished {}: {} items ({} new), {} errors, {}s, status={}",
                adapter.source().getKey(), result.items().size(), newCount, errors.size(),
                String.format("%.2f", result.durationSeconds()), status);

        return ScrapeCycleResult.builder()
                .source(adapter.source())
                .itemsFetched(result.items().size())
                .itemsNew(newCount)
                .errors(List.copyOf(errors))
                .durationSeconds(ScrapeRunService.round(result.durationSeconds(), 2))
                .status(status)
                .build();
    }
}
