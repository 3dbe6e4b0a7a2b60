package com.socialpulse.api.crawler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialpulse.api.dto.NormalizedItem;
import com.socialpulse.api.dto.ScrapeResult;
import com.socialpulse.api.entity.Source;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class RedditCrawler implements SourceAdapter {

    private static final String BASE_URL = "https://www.reddit.com";
    private static final int MAX_BODY_LENGTH = 2000;

    private final HttpFetcher fetcher;
    private final ObjectMapper mapper;
    private final List<String> subreddits;
    private final String sort;
    private final int limit;
    private final RateLimiter limiter;

    public RedditCrawler(HttpFetcher fetcher,
                         ObjectMapper mapper,
                         @Value("${scraper.reddit.subreddits:technology,worldnews,science,programming}") List<String> subreddits,
                         @Value("${scraper.reddit.sort:hot}") String sort,
                         @Value("${scraper.reddit.limit:25}") int limit,
                         @Value("${scraper.request-delay:2s}") Duration requestDelay) {
        this.fetcher = fetcher;
        this.mapper = mapper;
        this.subreddits = subreddits.stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
        this.sort = sort;
        this.limit = limit;
        this.limiter = new RateLimiter(requestDelay);
    }

    @Override
    public Source source() {
        return Source.REDDIT;
    }

    @Override
    public ScrapeResult scrape() {
        List<NormalizedItem> items = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        long t0 = System.nanoTime();

        for (String sub : subreddits) {
            try {
                limiter.acquire();
                String url = String.format("%s/r/%s/%s.json?limit=%d&raw_json=1", BASE_URL, sub, sort, limit);
                List<NormalizedItem> fetched = parseListing(fetcher.get(url), sub);
                items.addAll(fetched);
                log.info("r/{}: {} posts fetched", sub, fetched.size());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                errors.add("r/" + sub + ": interrupted");
                break;
            } catch (IOException | RuntimeException e) {
                String msg = "r/" + sub + ": " + e.getMessage();
                log.warn("[Reddit] {}", msg);
                errors.add(msg);
            }
        }

        return new ScrapeResult(Source.REDDIT, items, errors, Duration.ofNanos(System.nanoTime() - t0));
    }

    /**
     * data.children[].data 구조의 리스팅 JSON을 파싱. 제목이나 id가 없는 글은 버린다.
     */
    List<NormalizedItem> parseListing(String body, String sub) throws IOException {
        JsonNode children = mapper.readTree(body).path("data").path("children");
        List<NormalizedItem> results = new ArrayList<>();

        for (JsonNode child : children) {
            JsonNode post = child.path("data");
            String id = post.path("id").asText("");
            String title = post.path("title").asText("");
            if (id.isBlank() || title.isBlank()) continue;

            String selftext = post.path("selftext").asText("");
            Map<String, Object> extra = new LinkedHashMap<>();
            if (post.hasNonNull("link_flair_text")) extra.put("flair", post.get("link_flair_text").asText());
            if (post.has("upvote_ratio")) extra.put("upvote_ratio", post.get("upvote_ratio").asDouble());

            results.add(NormalizedItem.builder()
                    .source(Source.REDDIT)
                    .sourceId(id)
                    .sourceUrl(BASE_URL + post.path("permalink").asText(""))
                    .author(post.path("author").asText("[deleted]"))
                    .title(title)
                    .body(selftext.length() > MAX_BODY_LENGTH ? selftext.substring(0, MAX_BODY_LENGTH) : selftext)
                    .score(post.path("score").asInt(0))
                    .numComments(post.path("num_comments").asInt(0))
                    .publishedAt(toLocalDateTime(post.path("created_utc").asLong(0)))
                    .subreddit(sub)
                    .extra(extra)
                    .build());
        }
        return results;
    }

    private LocalDateTime toLocalDateTime(long epochSeconds) {
        return LocalDateTime.ofInstant(Instant.ofEpochSecond(epochSeconds), ZoneOffset.UTC);
    }
}
