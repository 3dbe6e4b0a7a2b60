package com.socialpulse.api.scheduler;

import com.socialpulse.api.crawler.SourceAdapter;
import com.socialpulse.api.dto.ScrapeCycleResult;
import com.socialpulse.api.exception.ScrapeInProgressException;
import com.socialpulse.api.service.ScrapeCycleService;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 소스 하나의 주기 실행 상태. 수동 실행과 타이머 실행이 같은 lock을 공유해서
 * 한 소스의 사이클은 동시에 하나만 돈다.
 */
@Slf4j
class SourceJob {

    private final SourceAdapter adapter;
    private final ScrapeCycleService cycleService;
    private final Duration interval;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile Instant nextRunTime;

    SourceJob(SourceAdapter adapter, ScrapeCycleService cycleService, Duration interval, Clock clock) {
        this.adapter = adapter;
        this.cycleService = cycleService;
        this.interval = interval;
        this.clock = clock;
    }

    String id() {
        return "scrape_" + adapter.source().getKey();
    }

    Duration interval() {
        return interval;
    }

    Instant nextRunTime() {
        return nextRunTime;
    }

    /**
     * 수동 실행. 이미 돌고 있으면 기다리지 않고 거절한다.
     */
    ScrapeCycleResult runNow() {
        return tryRun().orElseThrow(() -> new ScrapeInProgressException(adapter.source()));
    }

    Optional<ScrapeCycleResult> tryRun() {
        if (!lock.tryLock()) {
            return Optional.empty();
        }
        try {
            return Optional.of(cycleService.runCycle(adapter));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 첫 실행은 즉시, 이후 interval마다. interrupt 되면 종료.
     */
    void loop() {
        Thread.currentThread().setName(id());
        nextRunTime = clock.instant();
        log.info("Job {} started, interval={}", id(), interval);

        while (!Thread.currentThread().isInterrupted()) {
            try {
                long waitMillis = Duration.between(clock.instant(), nextRunTime).toMillis();
                if (waitMillis > 0) {
                    TimeUnit.MILLISECONDS.sleep(waitMillis);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            // 도는 동안에도 status에는 다음 실행 시각이 보이도록 먼저 갱신
            nextRunTime = clock.instant().plus(interval);
            fire();
        }

        nextRunTime = null;
        log.info("Job {} stopped", id());
    }

    private void fire() {
        try {
            if (tryRun().isEmpty()) {
                log.warn("Skipping {}: previous cycle still running", id());
            }
        } catch (RuntimeException e) {
            // 실패해도 루프는 유지, 재시도는 다음 주기
            log.error("Cycle {} failed", id(), e);
        }
    }
}
