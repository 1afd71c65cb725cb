package org.jstats.matchcrawler_api.modules.crawl.repository;

/**
 * A storage operation failed. The caller decides between retry and abort.
 */
public class StorageException extends RuntimeException {

    private final String operation;

    public StorageException(String operation, String message, Throwable cause) {
        super(operation + ": " + message, cause);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }
}
