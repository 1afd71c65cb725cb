package org.jstats.matchcrawler_api.modules.riot_gatherer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Connection settings of the Riot Games API.
 *
 * @param platform          platform routing value used for league endpoints and player regions (euw1, na1, ...)
 * @param platformBaseUrl   base url of the platform host
 * @param regionalBaseUrl   base url of the regional host serving match-v5 (europe, americas, asia)
 * @param key               API key; may be a ${PLACEHOLDER} resolved from system properties or env
 * @param connectTimeout    TCP connect timeout
 * @param readTimeout       per request read timeout
 * @param userAgent         User-Agent header
 * @param retention         how long the API keeps match detail; older matches answer 404
 * @param rateLimits        app rate limit buckets as "permits:seconds"
 * @param defaultRetryAfter cooldown used when a 429 carries no Retry-After
 */
@ConfigurationProperties(prefix = "riot.api")
public record RiotApiProperties(
        @DefaultValue("euw1") String platform,
        @DefaultValue("https://euw1.api.riotgames.com") String platformBaseUrl,
        @DefaultValue("https://europe.api.riotgames.com") String regionalBaseUrl,
        String key,
        @DurationUnit(ChronoUnit.MILLIS) @DefaultValue("5000") Duration connectTimeout,
        @DurationUnit(ChronoUnit.MILLIS) @DefaultValue("15000") Duration readTimeout,
        @DefaultValue("matchcrawler-api") String userAgent,
        @DefaultValue("730d") Duration retention,
        @DefaultValue({"20:1", "100:120"}) List<String> rateLimits,
        @DefaultValue("2s") Duration defaultRetryAfter) {
}
