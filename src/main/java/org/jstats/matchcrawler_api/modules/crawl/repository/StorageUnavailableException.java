package org.jstats.matchcrawler_api.modules.crawl.repository;

/**
 * The store cannot be reached at all; continuing would lose data.
 */
public class StorageUnavailableException extends StorageException {

    public StorageUnavailableException(String operation, String message, Throwable cause) {
        super(operation, message, cause);
    }
}
