package org.persistor.pipeline.config;

/**
 * Thrown when the pull variant is misconfigured, including invalid request parameters.
 */
public class PullConfigurationException extends PersistorConfigurationException {

    public PullConfigurationException(String message) {
        super(message);
    }

    public PullConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
