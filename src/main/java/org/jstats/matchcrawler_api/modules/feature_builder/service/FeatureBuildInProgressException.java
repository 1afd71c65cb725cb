package org.jstats.matchcrawler_api.modules.feature_builder.service;

public class FeatureBuildInProgressException extends RuntimeException {

    public FeatureBuildInProgressException() {
        super("A feature dataset build is already running");
    }
}
