package com.socialpulse.api.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TimeConfig {

    /** 모든 타임스탬프는 UTC 기준 */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
