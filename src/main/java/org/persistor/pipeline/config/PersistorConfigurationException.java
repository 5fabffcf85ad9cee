package org.persistor.pipeline.config;

/**
 * Thrown when the persistor configuration is missing a required value or contains an invalid one.
 */
public class PersistorConfigurationException extends RuntimeException {

    public PersistorConfigurationException(String message) {
        super(message);
    }

    public PersistorConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
