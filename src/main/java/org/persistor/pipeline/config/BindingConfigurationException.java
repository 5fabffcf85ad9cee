package org.persistor.pipeline.config;

/**
 * Thrown when the push variant is misconfigured, e.g. an output binding is enabled but no
 * output slot is bound.
 */
public class BindingConfigurationException extends PersistorConfigurationException {

    public BindingConfigurationException(String message) {
        super(message);
    }
}
