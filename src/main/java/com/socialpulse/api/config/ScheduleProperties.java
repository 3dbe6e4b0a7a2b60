package com.socialpulse.api.config;

import com.socialpulse.api.entity.Source;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-source scrape intervals.
 *
 * <pre>
 * scraper:
 *   schedule:
 *     enabled: true
 *     default-interval: 15m
 *     intervals:
 *       reddit: 10m
 * </pre>
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scraper.schedule")
public class ScheduleProperties {

    /**
     * Whether the background loops start with the application.
     * Manual triggers work either way.
     */
    private boolean enabled = true;

    private Duration defaultInterval = Duration.ofMinutes(15);

    /** Keyed by source key ("reddit", "news", "twitter"). */
    private Map<String, Duration> intervals = new HashMap<>();

    public Duration intervalFor(Source source) {
        Duration interval = intervals.get(source.getKey());
        return (interval == null || interval.isZero() || interval.isNegative()) ? defaultInterval : interval;
    }
}
