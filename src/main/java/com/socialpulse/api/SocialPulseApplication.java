package com.socialpulse.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

import java.util.Arrays;

@Slf4j
@SpringBootApplication
@EnableJpaRepositories
public class SocialPulseApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext ctx = SpringApplication.run(SocialPulseApplication.class, args);
		Environment env = ctx.getEnvironment();

		log.info("Active profiles: {}", Arrays.toString(env.getActiveProfiles()));
		log.info("Datasource: {}", env.getProperty("spring.datasource.url"));
		log.info("Schedule enabled: {}", env.getProperty("scraper.schedule.enabled", "true"));
	}
}
