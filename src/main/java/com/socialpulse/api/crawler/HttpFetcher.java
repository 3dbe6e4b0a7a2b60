package com.socialpulse.api.crawler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

@Slf4j
@Component
public class HttpFetcher {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(TIMEOUT)
            .build();

    @Value("${scraper.user-agent:SocialPulse/1.0 (research project)}")
    private String userAgent;

    /**
     * GET 요청 후 본문 반환. 2xx 이외 응답은 IOException.
     */
    public String get(String url) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("User-Agent", userAgent)
                .header("Accept", "application/json, text/html;q=0.9, */*;q=0.8")
                .timeout(TIMEOUT)
                .GET()
                .build();

        HttpResponse<String> res = client.send(request, HttpResponse.BodyHandlers.ofString());
        if (res.statusCode() / 100 != 2) {
            log.debug("Non-2xx response: status={}, url={}", res.statusCode(), url);
            throw new IOException("HTTP " + res.statusCode() + " from " + url);
        }
        return res.body();
    }
}
