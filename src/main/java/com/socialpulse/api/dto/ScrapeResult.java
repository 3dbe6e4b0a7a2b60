package com.socialpulse.api.dto;

import com.socialpulse.api.entity.Source;

import java.time.Duration;
import java.util.List;

public record ScrapeResult(
        Source source,
        List<NormalizedItem> items,
        List<String> errors,
        Duration duration
) {

    public ScrapeResult {
        items = items == null ? List.of() : List.copyOf(items);
        errors = errors == null ? List.of() : List.copyOf(errors);
        duration = duration == null ? Duration.ZERO : duration;
    }

    /** 어댑터 자체가 예외를 던진 경우 */
    public static ScrapeResult failed(Source source, String error, Duration duration) {
        return new ScrapeResult(source, List.of(), List.of(error), duration);
    }

    public double durationSeconds() {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
