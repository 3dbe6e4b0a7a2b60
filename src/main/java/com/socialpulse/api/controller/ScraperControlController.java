package com.socialpulse.api.controller;

import com.socialpulse.api.dto.ScrapeCycleResult;
import com.socialpulse.api.dto.SchedulerStatusDto;
import com.socialpulse.api.scheduler.ScrapeScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/scraper")
@RequiredArgsConstructor
public class ScraperControlController {

    private final ScrapeScheduler scheduler;

    /**
     * 수동 실행. 사이클이 끝날 때까지 요청 스레드에서 기다린다.
     * 이미 실행 중이면 409 (ScrapeInProgressException).
     */
    @PostMapping("/run/{source}")
    public ScrapeCycleResult run(@PathVariable String source) {
        return scheduler.runSource(source)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown source: " + source));
    }

    @GetMapping("/status")
    public SchedulerStatusDto status() {
        return scheduler.status();
    }
}
