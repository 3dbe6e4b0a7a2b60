package com.socialpulse.api.config;

import com.socialpulse.api.crawler.HttpFetcher;
import org.mockito.Mockito;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

@TestConfiguration
public class MockHttpFetcherConfig {
    @Bean
    @Primary
    public HttpFetcher mockHttpFetcher() {
        return Mockito.mock(HttpFetcher.class); // 외부 사이트 호출 차단
    }
}
