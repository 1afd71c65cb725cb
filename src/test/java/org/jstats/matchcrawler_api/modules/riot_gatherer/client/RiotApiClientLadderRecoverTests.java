package org.jstats.matchcrawler_api.modules.riot_gatherer.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jstats.matchcrawler_api.modules.riot_gatherer.config.RiotApiProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringExtension;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@ExtendWith(SpringExtension.class)
@ContextConfiguration(classes = {
        RiotApiClientLadderRecoverTests.TestRetryConfig.class,
        RiotApiClient.class,
        RiotApiClientLadderRecoverTests.TestConfig.class
})
@TestPropertySource(properties = {
        "riot.api.seed-retry.max-attempts=3",
        "riot.api.seed-retry.delay-ms=1",
        "riot.api.seed-retry.max-delay-ms=2"
})
class RiotApiClientLadderRecoverTests {

    private static final String PLATFORM = "https://euw1.example.test";
    private static final String LADDER = PLATFORM + "/lol/league/v4/challengerleagues/by-queue/RANKED_SOLO_5x5";

    @Configuration
    @EnableRetry(proxyTargetClass = true)
    static class TestRetryConfig { }

    @Configuration
    static class TestConfig {

        final RestClient.Builder builder = RestClient.builder();

        @Bean
        MockRestServiceServer mockServer() {
            return MockRestServiceServer.bindTo(builder).build();
        }

        // takes the server so the client is built from the bound builder
        @Bean(name = "riotplatform")
        RestClient platform(MockRestServiceServer mockServer) {
            return builder.baseUrl(PLATFORM).build();
        }

        @Bean(name = "riotregional")
        RestClient regional(MockRestServiceServer mockServer) {
            return builder.baseUrl("https://europe.example.test").build();
        }

        @Bean
        Clock clock() {
            return Clock.systemUTC();
        }

        @Bean
        RateLimitGate gate(Clock clock) {
            return new RateLimitGate(List.of(), clock, d -> { });
        }

        @Bean
        RiotApiProperties riotApiProperties() {
            return new RiotApiProperties("euw1", PLATFORM, "https://europe.example.test", "test-key",
                    Duration.ofSeconds(1), Duration.ofSeconds(1), "test", Duration.ofDays(730),
                    List.of("20:1"), Duration.ofSeconds(1));
        }

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }
    }

    @Autowired
    MockRestServiceServer server;

    @Autowired
    RiotApiClient client;

    @BeforeEach
    void resetServer() {
        server.reset();
    }

    @Test
    void ladder_retriesTransientFailures_thenSucceeds() {
        server.expect(ExpectedCount.times(2), requestTo(LADDER)).andRespond(withServerError());
        server.expect(requestTo(LADDER)).andRespond(withSuccess(
                "{\"entries\":[{\"puuid\":\"p-1\"}]}", MediaType.APPLICATION_JSON));

        var players = client.listLadderPlayers("challenger");

        server.verify();
        assertEquals(1, players.size());
        assertEquals("p-1", players.get(0).id());
    }

    @Test
    void ladder_recover_onPersistent5xx_returnsEmpty() {
        server.expect(ExpectedCount.times(3), requestTo(LADDER)).andRespond(withServerError());

        var players = client.listLadderPlayers("challenger");

        server.verify();
        assertTrue(players.isEmpty());
    }

    @Test
    void ladder_unknownTier_recoversWithoutCallingRemote() {
        var players = client.listLadderPlayers("diamond");

        server.verify();
        assertTrue(players.isEmpty());
    }
}
