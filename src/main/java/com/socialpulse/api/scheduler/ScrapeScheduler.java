package com.socialpulse.api.scheduler;

import com.socialpulse.api.config.ScheduleProperties;
import com.socialpulse.api.crawler.SourceAdapter;
import com.socialpulse.api.dto.ScrapeCycleResult;
import com.socialpulse.api.dto.SchedulerStatusDto;
import com.socialpulse.api.entity.Source;
import com.socialpulse.api.service.ScrapeCycleService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class ScrapeScheduler {

    private final Map<Source, SourceJob> jobs = new EnumMap<>(Source.class);
    private final ScheduleProperties properties;

    private ExecutorService executor;
    private volatile boolean running;

    public ScrapeScheduler(List<SourceAdapter> adapters,
                           ScrapeCycleService cycleService,
                           ScheduleProperties properties,
                           Clock clock) {
        this.properties = properties;
        for (SourceAdapter adapter : adapters) {
            SourceJob job = new SourceJob(adapter, cycleService, properties.intervalFor(adapter.source()), clock);
            if (jobs.putIfAbsent(adapter.source(), job) != null) {
                throw new IllegalStateException("Duplicate adapter for source " + adapter.source().getKey());
            }
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.isEnabled()) {
            start();
        } else {
            log.info("Scrape schedule disabled, manual triggers only");
        }
    }

    public synchronized void start() {
        if (running || jobs.isEmpty()) {
            return;
        }
        executor = Executors.newFixedThreadPool(jobs.size());
        jobs.values().forEach(job -> executor.submit(job::loop));
        running = true;
        log.info("Scrape scheduler started: {}", jobs.values().stream()
                .map(job -> job.id() + "=" + job.interval())
                .toList());
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Scrape jobs did not stop within 10s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Scrape scheduler stopped");
    }

    /**
     * @return 알 수 없는 소스면 empty
     * @throws com.socialpulse.api.exception.ScrapeInProgressException 해당 소스 사이클이 이미 실행 중일 때
     */
    public Optional<ScrapeCycleResult> runSource(String key) {
        Optional<SourceJob> job = Source.fromKey(key).map(jobs::get);
        if (job.isEmpty()) {
            return Optional.empty();
        }
        log.info("Manual trigger: {}", job.get().id());
        return Optional.of(job.get().runNow());
    }

    public SchedulerStatusDto status() {
        List<SchedulerStatusDto.JobStatus> jobStatuses = jobs.values().stream()
                .map(job -> new SchedulerStatusDto.JobStatus(job.id(), job.nextRunTime()))
                .toList();
        return new SchedulerStatusDto(running, jobStatuses);
    }

    public boolean isRunning() {
        return running;
    }
}
