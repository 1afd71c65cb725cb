package org.jstats.matchcrawler_api.modules.riot_gatherer.config;

import org.jstats.matchcrawler_api.modules.riot_gatherer.client.RateLimitGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Configuration
@EnableConfigurationProperties(RiotApiProperties.class)
public class RiotApiConfig {

    private static final Logger log = LoggerFactory.getLogger(RiotApiConfig.class);

    static final String TOKEN_HEADER = "X-Riot-Token";

    private static final Pattern PLACEHOLDER = Pattern.compile("^\\$\\{([^}]+)}$");

    record ResolvedKey(String value, String source) {}

    static ResolvedKey resolveApiKey(String configured) {
        // Spring already resolved it
        if (StringUtils.hasText(configured) && !configured.startsWith("${")) {
            return new ResolvedKey(configured, "spring-property");
        }
        if (!StringUtils.hasText(configured)) {
            String fromEnv = System.getenv("RIOT_API_KEY");
            return StringUtils.hasText(fromEnv)
                    ? new ResolvedKey(fromEnv, "env:RIOT_API_KEY")
                    : new ResolvedKey(configured, "unset");
        }
        Matcher m = PLACEHOLDER.matcher(configured.trim());
        if (m.matches()) {
            String var = m.group(1);
            // ENV:NAME or NAME
            int colon = var.indexOf(':');
            if (colon >= 0) {
                var = var.substring(colon + 1);
            }
            String fromSysProp = System.getProperty(var);
            if (StringUtils.hasText(fromSysProp)) {
                return new ResolvedKey(fromSysProp, "system-property:" + var);
            }
            fromSysProp = System.getProperty("riot.api.key");
            if (StringUtils.hasText(fromSysProp)) {
                return new ResolvedKey(fromSysProp, "system-property:riot.api.key");
            }
            String fromEnv = System.getenv(var);
            if (StringUtils.hasText(fromEnv)) {
                return new ResolvedKey(fromEnv, "env:" + var);
            }
        }
        // still unresolved, fails validation below
        return new ResolvedKey(configured, "unresolved");
    }

    @Bean
    RateLimitGate riotRateLimitGate(RiotApiProperties p, Clock clock) {
        var gate = RateLimitGate.fromSpecs(p.rateLimits(), clock);
        log.info("Riot API rate limit buckets: {}", gate.limits());
        return gate;
    }

    @Bean(name = "riotregional")
    RestClient riotRegionalRestClient(RestClient.Builder builder, RiotApiProperties p) {
        return configure(builder.clone(), p, p.regionalBaseUrl());
    }

    @Bean(name = "riotplatform")
    RestClient riotPlatformRestClient(RestClient.Builder builder, RiotApiProperties p) {
        return configure(builder.clone(), p, p.platformBaseUrl());
    }

    private RestClient configure(RestClient.Builder builder, RiotApiProperties p, String baseUrl) {
        var apiKey = resolveApiKey(p.key());
        if (!StringUtils.hasText(apiKey.value()) || apiKey.value().startsWith("${")) {
            throw new IllegalStateException("Riot API key missing. Provide via: 1) application property riot.api.key, 2) JVM system property -DRIOT_API_KEY=..., or 3) environment variable RIOT_API_KEY.");
        }
        // non-secret diagnostics
        int len = apiKey.value().length();
        String tail = len >= 2 ? apiKey.value().substring(len - 2) : "??";
        log.info("Riot API key for {} resolved from {} (len={}, endsWith=**{})", baseUrl, apiKey.source(), len, tail);

        // Connect timeout is configured on the underlying JDK HttpClient
        var httpClientBuilder = HttpClient.newBuilder();
        if (p.connectTimeout() != null) {
            httpClientBuilder.connectTimeout(p.connectTimeout());
        }
        final var factory = new JdkClientHttpRequestFactory(httpClientBuilder.build());
        if (p.readTimeout() != null) {
            factory.setReadTimeout(p.readTimeout());
        }

        return builder
                .baseUrl(baseUrl)
                .requestFactory(factory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(TOKEN_HEADER, apiKey.value())
                .defaultHeader(HttpHeaders.USER_AGENT, p.userAgent())
                .build();
    }
}
