package org.jstats.matchcrawler_api.modules.crawl.config;

import org.jstats.matchcrawler_api.modules.crawl.repository.StorageException;
import org.jstats.matchcrawler_api.modules.crawl.repository.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.Map;

@Configuration
@EnableConfigurationProperties(CrawlProperties.class)
public class CrawlConfig {

    private static final Logger log = LoggerFactory.getLogger(CrawlConfig.class);

    /**
     * Retries {@link StorageException}s of a crawl step. An unreachable store is not retried here:
     * the run halts and the claims are recovered by the staleness timeout.
     */
    @Bean
    RetryTemplate crawlStorageRetryTemplate(CrawlProperties props) {
        return storageRetryTemplate(props.storageRetry());
    }

    public static RetryTemplate storageRetryTemplate(CrawlProperties.StorageRetry settings) {
        var policy = new SimpleRetryPolicy(
                settings.maxAttempts(),
                Map.of(StorageException.class, true, StorageUnavailableException.class, false),
                false);

        var backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(Math.max(1, settings.initialDelay().toMillis()));
        backOff.setMultiplier(2.0);
        backOff.setMaxInterval(Math.max(1, settings.maxDelay().toMillis()));

        var template = new RetryTemplate();
        template.setRetryPolicy(policy);
        template.setBackOffPolicy(backOff);
        template.registerListener(new RetryListener() {
            @Override
            public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
                if (log.isWarnEnabled()) {
                    log.warn("Storage operation failed (attempt {}): {}", context.getRetryCount(), throwable.getMessage());
                }
            }
        });
        return template;
    }
}
