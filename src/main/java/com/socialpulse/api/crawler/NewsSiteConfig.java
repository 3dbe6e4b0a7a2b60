package com.socialpulse.api.crawler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 뉴스 사이트별 추출 규칙. baseUrl은 상대 링크를 절대 경로로 만들 때 사용 (비어 있으면 그대로 둔다).
 */
public record NewsSiteConfig(String name, String url, String articleSelector, String baseUrl) {

    public static final Map<String, NewsSiteConfig> BUILT_IN;

    static {
        Map<String, NewsSiteConfig> sites = new LinkedHashMap<>();
        sites.put("hackernews", new NewsSiteConfig("hackernews",
                "https://news.ycombinator.com/", ".titleline > a", ""));
        sites.put("reuters", new NewsSiteConfig("reuters",
                "https://www.reuters.com/", "a[data-testid=Heading]", "https://www.reuters.com"));
        sites.put("ap_news", new NewsSiteConfig("ap_news",
                "https://apnews.com/", "a.Link[href*=/article/]", "https://apnews.com"));
        BUILT_IN = Map.copyOf(sites);
    }

    String resolve(String link) {
        if (link.isEmpty() || link.startsWith("http") || baseUrl.isEmpty()) {
            return link;
        }
        return baseUrl + link;
    }
}
