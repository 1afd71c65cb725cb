package org.jstats.matchcrawler_api.modules.crawl.service;

public class CrawlAlreadyRunningException extends RuntimeException {

    private final String runId;

    public CrawlAlreadyRunningException(String runId) {
        super("Crawl run " + runId + " is still running");
        this.runId = runId;
    }

    public String runId() {
        return runId;
    }
}
