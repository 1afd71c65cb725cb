package org.jstats.matchcrawler_api.modules.feature_builder.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.jstats.matchcrawler_api.modules.feature_builder.service.FeatureBuildReport;
import org.jstats.matchcrawler_api.modules.feature_builder.service.FeatureBuilderService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Features", description = "Build the training dataset from stored matches.")
@RestController
@RequestMapping("/features")
public class FeatureController {

    private final FeatureBuilderService builder;

    public FeatureController(FeatureBuilderService builder) {
        this.builder = builder;
    }

    @Operation(
            summary = "Rebuild the feature dataset",
            description = "Replaces features.jsonl and features.schema.json in the configured output directory.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "OK"),
                    @ApiResponse(responseCode = "409", description = "A build is already running",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "503", description = "Storage unavailable",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping("/build")
    public FeatureBuildReport build() {
        return builder.build();
    }
}
