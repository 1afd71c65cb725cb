package org.jstats.matchcrawler_api.modules.crawl.model;

public enum EntityKind {
    PLAYER,
    MATCH
}
