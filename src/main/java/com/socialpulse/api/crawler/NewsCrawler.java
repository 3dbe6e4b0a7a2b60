package com.socialpulse.api.crawler;

import com.socialpulse.api.dto.NormalizedItem;
import com.socialpulse.api.dto.ScrapeResult;
import com.socialpulse.api.entity.Source;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Component
public class NewsCrawler implements SourceAdapter {

    private static final int MIN_TITLE_LENGTH = 15;

    private final HttpFetcher fetcher;
    private final Clock clock;
    private final List<NewsSiteConfig> sites;
    private final RateLimiter limiter;

    public NewsCrawler(HttpFetcher fetcher,
                       Clock clock,
                       @Value("${scraper.news.sites:hackernews,reuters,ap_news}") List<String> enabled,
                       @Value("${scraper.request-delay:2s}") Duration requestDelay) {
        this.fetcher = fetcher;
        this.clock = clock;
        // 설정 순서대로, 알 수 없는 이름은 무시
        this.sites = enabled.stream()
                .map(String::trim)
                .filter(NewsSiteConfig.BUILT_IN::containsKey)
                .distinct()
                .map(NewsSiteConfig.BUILT_IN::get)
                .toList();
        this.limiter = new RateLimiter(requestDelay);
    }

    @Override
    public Source source() {
        return Source.NEWS;
    }

    @Override
    public ScrapeResult scrape() {
        List<NormalizedItem> items = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        long t0 = System.nanoTime();

        for (NewsSiteConfig site : sites) {
            try {
                limiter.acquire();
                List<NormalizedItem> fetched = parsePage(fetcher.get(site.url()), site);
                items.addAll(fetched);
                log.info("Scraped {}: {} articles", site.name(), fetched.size());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                errors.add(site.name() + ": interrupted");
                break;
            } catch (IOException | RuntimeException e) {
                String msg = site.name() + ": " + e.getMessage();
                log.warn("[News] {}", msg);
                errors.add(msg);
            }
        }

        return new ScrapeResult(Source.NEWS, items, errors, Duration.ofNanos(System.nanoTime() - t0));
    }

    List<NormalizedItem> parsePage(String html, NewsSiteConfig site) {
        Document doc = Jsoup.parse(html, site.url());
        LocalDateTime now = LocalDateTime.now(clock);
        Set<String> seenLinks = new HashSet<>();
        List<NormalizedItem> results = new ArrayList<>();

        for (Element el : doc.select(site.articleSelector())) {
            String title = el.text().trim();
            if (title.length() < MIN_TITLE_LENGTH || !title.contains(" ")) continue;

            String link = site.resolve(el.attr("href"));
            if (!seenLinks.add(link)) continue;

            results.add(NormalizedItem.builder()
                    .source(Source.NEWS)
                    .sourceId(shortHash(link.isEmpty() ? title : link))
                    .sourceUrl(link)
                    .author(site.name())
                    .title(title)
                    .body("")
                    .score(0)
                    .numComments(0)
                    .publishedAt(now)
                    .category(site.name())
                    .build());
        }
        return results;
    }

    static String shortHash(String value) {
        return DigestUtils.md5DigestAsHex(value.getBytes(StandardCharsets.UTF_8)).substring(0, 16);
    }
}
