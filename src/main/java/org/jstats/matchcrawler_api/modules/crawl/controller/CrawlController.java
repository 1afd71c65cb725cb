package org.jstats.matchcrawler_api.modules.crawl.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import org.jstats.matchcrawler_api.modules.crawl.model.EntityKind;
import org.jstats.matchcrawler_api.modules.crawl.model.FrontierEntry;
import org.jstats.matchcrawler_api.modules.crawl.model.FrontierState;
import org.jstats.matchcrawler_api.modules.crawl.model.MatchRef;
import org.jstats.matchcrawler_api.modules.crawl.service.CrawlCollector;
import org.jstats.matchcrawler_api.modules.crawl.service.CrawlRequest;
import org.jstats.matchcrawler_api.modules.crawl.service.CrawlRunSummary;
import org.jstats.matchcrawler_api.modules.crawl.service.CrawlRunner;
import org.jstats.matchcrawler_api.modules.crawl.service.FrontierManager;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Tag(name = "Crawl", description = "Start, observe and stop match crawls; inspect the frontier.")
@Validated
@RestController
@RequestMapping("/crawl")
public class CrawlController {

    private final CrawlRunner runner;
    private final FrontierManager frontier;
    private final CrawlCollector collector;

    public CrawlController(CrawlRunner runner, FrontierManager frontier, CrawlCollector collector) {
        this.runner = runner;
        this.frontier = frontier;
        this.collector = collector;
    }

    public record FrontierView(Map<EntityKind, Map<FrontierState, Long>> counts, List<FrontierEntry> failed) {
    }

    public record RepairedMatch(String region, String matchId, Instant gameStart, int participants, Instant fetchedAt) {
    }

    public record ResetResult(EntityKind kind, int reset) {
    }

    @Operation(
            summary = "Start a crawl run",
            description = "Starts a crawl in the background. The body may override seeds, maxMatches and maxRunDuration.",
            responses = {
                    @ApiResponse(responseCode = "202", description = "Accepted"),
                    @ApiResponse(responseCode = "400", description = "Bad Request",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "409", description = "A run is already active",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping("/runs")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public CrawlRunSummary start(@Valid @RequestBody(required = false) CrawlRequest request) {
        return runner.start(request != null ? request : CrawlRequest.defaults());
    }

    @Operation(summary = "Current or last crawl run")
    @GetMapping("/runs/current")
    public CrawlRunSummary current() {
        return runner.current()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No crawl run since start-up"));
    }

    @Operation(summary = "Stop the active run gracefully",
            description = "Workers finish the batch in hand and claim nothing more.")
    @PostMapping("/runs/current/stop")
    public CrawlRunSummary stop() {
        return runner.requestStop()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No crawl run since start-up"));
    }

    @Operation(summary = "Frontier counts by kind and state, plus the most recent failures")
    @GetMapping("/frontier")
    public FrontierView frontier(@RequestParam(name = "failedLimit", defaultValue = "50") @Min(0) @Max(1000) int failedLimit) {
        return new FrontierView(frontier.stats().asMap(), failedLimit == 0 ? List.of() : frontier.failedEntries(failedLimit));
    }

    @Operation(summary = "Reset failed frontier entries of a kind to pending")
    @PostMapping("/frontier/failed/reset")
    public ResetResult resetFailed(@RequestParam("kind") EntityKind kind) {
        return new ResetResult(kind, frontier.resetFailed(kind));
    }

    /**
     * Example:
     * POST /crawl/matches/euw1/EUW1_6543210987/repair
     */
    @Operation(
            summary = "Re-fetch a match and overwrite the stored copy",
            responses = {
                    @ApiResponse(responseCode = "200", description = "OK"),
                    @ApiResponse(responseCode = "404", description = "Match unknown to the remote API",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "502", description = "Upstream failure",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping("/matches/{region}/{matchId}/repair")
    public RepairedMatch repair(
            @PathVariable("region")
            @Pattern(regexp = "^[a-z]{2,4}[0-9]?$", message = "region must be a platform id like euw1, na1, kr")
            String region,
            @PathVariable("matchId")
            @Pattern(regexp = "^[A-Za-z0-9_]{3,40}$", message = "matchId must look like EUW1_6543210987")
            String matchId) {
        var match = collector.repair(new MatchRef(region, matchId));
        return new RepairedMatch(region, matchId, match.gameStart(), match.participants().size(), match.fetchedAt());
    }
}
