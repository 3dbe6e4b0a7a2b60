package com.socialpulse.api.service;

import com.socialpulse.api.crawler.SourceAdapter;
import com.socialpulse.api.dto.NormalizedItem;
import com.socialpulse.api.dto.ScrapeCompletedEvent;
import com.socialpulse.api.dto.ScrapeCycleResult;
import com.socialpulse.api.dto.ScrapeResult;
import com.socialpulse.api.entity.RunStatus;
import com.socialpulse.api.entity.Source;
import com.socialpulse.api.publisher.ScrapeEventBroadcaster;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScrapeCycleServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-15T12:00:00Z");

    private PostUpsertService upsertService;
    private TrendService trendService;
    private ScrapeRunService runService;
    private ScrapeEventBroadcaster broadcaster;
    private SourceAdapter adapter;
    private ScrapeCycleService cycleService;

    @BeforeEach
    void setUp() {
        upsertService = mock(PostUpsertService.class);
        trendService = mock(TrendService.class);
        runService = mock(ScrapeRunService.class);
        broadcaster = mock(ScrapeEventBroadcaster.class);
        adapter = mock(SourceAdapter.class);
        when(adapter.source()).thenReturn(Source.REDDIT);
        cycleService = new ScrapeCycleService(upsertService, trendService, runService, broadcaster,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static NormalizedItem item(String id) {
        return NormalizedItem.builder().source(Source.REDDIT).sourceId(id).title("Title " + id).build();
    }

    @Test
    void runsStepsInOrder() {
        List<NormalizedItem> items = List.of(item("a"), item("b"));
        when(adapter.scrape()).thenReturn(new ScrapeResult(Source.REDDIT, items, List.of(), Duration.ofMillis(1500)));
        when(upsertService.upsert(items)).thenReturn(2);

        ScrapeCycleResult result = cycleService.runCycle(adapter);

        InOrder order = inOrder(adapter, upsertService, trendService, runService, broadcaster);
        order.verify(adapter).scrape();
        order.verify(upsertService).upsert(items);
        order.verify(trendService).recompute();
        order.verify(runService).record(Source.REDDIT, RunStatus.SUCCESS, 2, 2, "",
                Duration.ofMillis(1500), LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
        order.verify(broadcaster).publish(new ScrapeCompletedEvent("reddit", 2, 2, 0));

        assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(result.itemsFetched()).isEqualTo(2);
        assertThat(result.itemsNew()).isEqualTo(2);
        assertThat(result.durationSeconds()).isEqualTo(1.5);
    }

    @Test
    void persistenceFailure_isRecordedAndStillPublished() {
        List<NormalizedItem> items = List.of(item("a"));
        when(adapter.scrape()).thenReturn(new ScrapeResult(Source.REDDIT, items, List.of(), Duration.ZERO));
        when(upsertService.upsert(items)).thenThrow(new IllegalStateException("db down"));

        ScrapeCycleResult result = cycleService.runCycle(adapter);

        ArgumentCaptor<String> errorText = ArgumentCaptor.forClass(String.class);
        verify(runService).record(eq(Source.REDDIT), eq(RunStatus.SUCCESS), eq(1), eq(0), errorText.capture(),
                any(), any());
        assertThat(errorText.getValue()).isEqualTo("persistence: db down");
        verify(broadcaster).publish(new ScrapeCompletedEvent("reddit", 1, 0, 0));

        // status는 수집 결과만으로 결정
        assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(result.errors()).containsExactly("persistence: db down");
    }

    @Test
    void recomputeFailure_eventCountsOnlyFetchErrors() {
        List<NormalizedItem> items = List.of(item("a"));
        when(adapter.scrape()).thenReturn(new ScrapeResult(Source.REDDIT, items,
                List.of("r/two: HTTP 429"), Duration.ZERO));
        when(upsertService.upsert(items)).thenReturn(1);
        when(trendService.recompute()).thenThrow(new IllegalStateException("lock timeout"));

        ScrapeCycleResult result = cycleService.runCycle(adapter);

        verify(broadcaster).publish(new ScrapeCompletedEvent("reddit", 1, 1, 1));
        verify(runService).record(eq(Source.REDDIT), eq(RunStatus.PARTIAL), eq(1), eq(1),
                eq("r/two: HTTP 429; persistence: lock timeout"), any(), any());
        assertThat(result.errors()).containsExactly("r/two: HTTP 429", "persistence: lock timeout");
    }

    @Test
    void adapterException_becomesFailedRun() {
        when(adapter.scrape()).thenThrow(new IllegalArgumentException("boom"));

        ScrapeCycleResult result = cycleService.runCycle(adapter);

        assertThat(result.status()).isEqualTo(RunStatus.FAILED);
        assertThat(result.errors()).containsExactly("adapter: boom");
        verify(upsertService).upsert(List.of());
        verify(runService).record(eq(Source.REDDIT), eq(RunStatus.FAILED), eq(0), eq(0), eq("adapter: boom"),
                any(), any());
        verify(broadcaster).publish(new ScrapeCompletedEvent("reddit", 0, 0, 1));
    }

    @Test
    void partialFetch_joinsErrors() {
        when(adapter.scrape()).thenReturn(new ScrapeResult(Source.REDDIT, List.of(item("a")),
                List.of("r/one: HTTP 503", "r/two: HTTP 429"), Duration.ZERO));
        when(upsertService.upsert(anyList())).thenReturn(1);

        ScrapeCycleResult result = cycleService.runCycle(adapter);

        assertThat(result.status()).isEqualTo(RunStatus.PARTIAL);
        verify(runService).record(eq(Source.REDDIT), eq(RunStatus.PARTIAL), eq(1), eq(1),
                eq("r/one: HTTP 503; r/two: HTTP 429"), any(), any());
    }

    @Test
    void runLogFailure_doesNotStopPublish() {
        when(adapter.scrape()).thenReturn(new ScrapeResult(Source.REDDIT, List.of(), List.of(), Duration.ZERO));
        when(runService.record(any(), any(), anyInt(), anyInt(), anyString(), any(), any()))
                .thenThrow(new IllegalStateException("disk full"));

        ScrapeCycleResult result = cycleService.runCycle(adapter);

        assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
        verify(broadcaster).publish(new ScrapeCompletedEvent("reddit", 0, 0, 0));
    }
}
