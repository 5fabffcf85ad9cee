package org.persistor.pipeline.api.resources.storage;

/**
 * Thrown when append mode is requested but no append target was supplied.
 * This is a configuration error, never a transient failure.
 */
public class StorageTargetException extends RuntimeException {

    public StorageTargetException(String message) {
        super(message);
    }
}
