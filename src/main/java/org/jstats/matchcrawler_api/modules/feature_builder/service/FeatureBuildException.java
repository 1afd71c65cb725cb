package org.jstats.matchcrawler_api.modules.feature_builder.service;

/**
 * The dataset could not be written. The previous files are left untouched.
 */
public class FeatureBuildException extends RuntimeException {

    public FeatureBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
