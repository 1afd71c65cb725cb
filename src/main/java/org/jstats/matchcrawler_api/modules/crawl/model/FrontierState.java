package org.jstats.matchcrawler_api.modules.crawl.model;

public enum FrontierState {
    PENDING,
    IN_FLIGHT,
    DONE,
    FAILED
}
