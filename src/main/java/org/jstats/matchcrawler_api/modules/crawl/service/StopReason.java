package org.jstats.matchcrawler_api.modules.crawl.service;

public enum StopReason {
    /** No pending and no in-flight entries left. */
    EXHAUSTED,
    /** The store reached the match ceiling. */
    CEILING,
    DEADLINE,
    /** Graceful stop requested by an operator or by application shutdown. */
    SHUTDOWN,
    STORAGE_UNAVAILABLE,
    /** The remote API rejected the credentials. */
    REMOTE_REJECTED,
    ERROR
}
