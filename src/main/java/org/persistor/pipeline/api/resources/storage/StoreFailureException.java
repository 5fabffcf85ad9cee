package org.persistor.pipeline.api.resources.storage;

/**
 * Thrown when a batch could not be durably stored after all retries.
 * <p>
 * Fatal to the pull task that owns the batch; sibling tasks are not affected. On the push
 * path it is propagated to the host so that the host's redelivery policy applies.
 */
public class StoreFailureException extends RuntimeException {

    public StoreFailureException(String message) {
        super(message);
    }

    public StoreFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
