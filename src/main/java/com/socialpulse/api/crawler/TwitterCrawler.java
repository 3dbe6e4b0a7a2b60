package com.socialpulse.api.crawler;

import com.socialpulse.api.dto.NormalizedItem;
import com.socialpulse.api.dto.ScrapeResult;
import com.socialpulse.api.entity.Source;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Nitter 검색 페이지 스크래핑. 인스턴스가 자주 죽기 때문에 설정 순서대로 돌아가며 시도한다.
 */
@Slf4j
@Component
public class TwitterCrawler implements SourceAdapter {

    static final Duration MIN_DELAY = Duration.ofSeconds(3);
    private static final int MAX_TITLE_LENGTH = 200;

    private final HttpFetcher fetcher;
    private final Clock clock;
    private final List<String> queries;
    private final List<String> instances;
    private final RateLimiter limiter;

    @Autowired
    public TwitterCrawler(HttpFetcher fetcher,
                          Clock clock,
                          @Value("${scraper.twitter.queries:AI,technology,breaking news}") List<String> queries,
                          @Value("${scraper.twitter.nitter-instances:https://nitter.net,https://nitter.privacydev.net}") List<String> instances,
                          @Value("${scraper.request-delay:2s}") Duration requestDelay) {
        this.fetcher = fetcher;
        this.clock = clock;
        this.queries = queries.stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
        this.instances = instances.stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
        Duration delay = requestDelay == null || requestDelay.compareTo(MIN_DELAY) < 0 ? MIN_DELAY : requestDelay;
        this.limiter = new RateLimiter(delay);
    }

    /** 테스트용: limiter 지연을 그대로 사용 */
    TwitterCrawler(HttpFetcher fetcher, Clock clock, List<String> queries, List<String> instances, RateLimiter limiter) {
        this.fetcher = fetcher;
        this.clock = clock;
        this.queries = List.copyOf(queries);
        this.instances = List.copyOf(instances);
        this.limiter = limiter;
    }

    Duration requestDelay() {
        return limiter.delay();
    }

    @Override
    public Source source() {
        return Source.TWITTER;
    }

    @Override
    public ScrapeResult scrape() {
        List<NormalizedItem> items = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        long t0 = System.nanoTime();

        for (String query : queries) {
            try {
                limiter.acquire();
                List<NormalizedItem> fetched = fetchQuery(query);
                items.addAll(fetched);
                log.info("Scraped twitter query '{}': {} tweets", query, fetched.size());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                errors.add("twitter/" + query + ": interrupted");
                break;
            } catch (IOException | RuntimeException e) {
                String msg = "twitter/" + query + ": " + e.getMessage();
                log.warn("[Twitter] {}", msg);
                errors.add(msg);
            }
        }

        return new ScrapeResult(Source.TWITTER, items, errors, Duration.ofNanos(System.nanoTime() - t0));
    }

    private List<NormalizedItem> fetchQuery(String query) throws IOException, InterruptedException {
        Exception last = null;
        for (String instance : instances) {
            try {
                String base = instance.endsWith("/") ? instance.substring(0, instance.length() - 1) : instance;
                String url = base + "/search?f=tweets&q=" + URLEncoder.encode(query, StandardCharsets.UTF_8);
                return parseSearch(fetcher.get(url), query, base);
            } catch (IOException | RuntimeException e) {
                last = e;
                log.debug("Nitter instance {} failed for '{}': {}", instance, query, e.getMessage());
            }
        }
        throw new IOException("All Nitter instances failed for '" + query + "': "
                + (last == null ? "no instances configured" : last.getMessage()));
    }

    List<NormalizedItem> parseSearch(String html, String query, String instance) {
        Document doc = Jsoup.parse(html, instance);
        LocalDateTime now = LocalDateTime.now(clock);
        List<NormalizedItem> results = new ArrayList<>();

        for (Element tweet : doc.select(".timeline-item")) {
            try {
                NormalizedItem item = parseTweet(tweet, query, instance, now);
                if (item != null) results.add(item);
            } catch (RuntimeException e) {
                // 깨진 트윗 하나 때문에 인스턴스 전체를 실패 처리하지 않는다
                log.debug("Skipping malformed tweet from {}: {}", instance, e.getMessage());
            }
        }
        return results;
    }

    private NormalizedItem parseTweet(Element tweet, String query, String instance, LocalDateTime now) {
        Element contentEl = tweet.selectFirst(".tweet-content");
        String content = contentEl == null ? "" : contentEl.text().trim();
        if (content.isEmpty()) return null;

        Element userEl = tweet.selectFirst(".username");
        String username = userEl == null ? "unknown" : userEl.text().trim();

        Element linkEl = tweet.selectFirst(".tweet-link");
        String path = linkEl == null ? "" : linkEl.attr("href");

        List<Integer> stats = new ArrayList<>();
        for (Element stat : tweet.select(".tweet-stat .icon-container")) {
            String txt = stat.text().trim().replace(",", "");
            if (!txt.isEmpty() && txt.chars().allMatch(Character::isDigit)) {
                stats.add(parseCount(txt));
            }
        }
        int replies = stats.isEmpty() ? 0 : stats.get(0);
        int likes = stats.size() < 2 ? 0 : stats.get(stats.size() - 1);

        String key = path.isEmpty()
                ? username + ":" + content.substring(0, Math.min(80, content.length()))
                : path;

        return NormalizedItem.builder()
                .source(Source.TWITTER)
                .sourceId(NewsCrawler.shortHash(key))
                .sourceUrl(path.isEmpty() ? "" : "https://x.com" + path)
                .author(username)
                .title(content.length() > MAX_TITLE_LENGTH ? content.substring(0, MAX_TITLE_LENGTH) : content)
                .body(content)
                .score(likes)
                .numComments(replies)
                .publishedAt(now)
                .category(query)
                .extra(Map.of("instance", instance))
                .build();
    }

    /** 숫자만 있는 문자열, int 범위를 넘으면 Integer.MAX_VALUE */
    static int parseCount(String digits) {
        if (digits.length() > 10) return Integer.MAX_VALUE;
        return (int) Math.min(Long.parseLong(digits), Integer.MAX_VALUE);
    }
}
