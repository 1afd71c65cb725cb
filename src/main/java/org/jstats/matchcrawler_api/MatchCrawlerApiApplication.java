package org.jstats.matchcrawler_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

@EnableRetry
@SpringBootApplication
public class MatchCrawlerApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(MatchCrawlerApiApplication.class, args);
    }
}
