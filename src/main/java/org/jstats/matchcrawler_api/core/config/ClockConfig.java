package org.jstats.matchcrawler_api.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // crawl deadlines, backoff and timestamps all read this clock
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
