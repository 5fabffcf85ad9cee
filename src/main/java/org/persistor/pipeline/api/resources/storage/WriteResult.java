package org.persistor.pipeline.api.resources.storage;

/**
 * Outcome of a durable batch write.
 * <p>
 * A failed write does not throw; callers must check {@link #success()} before
 * acknowledging or checkpointing anything.
 *
 * @param path     The destination the batch was (or would have been) written to.
 * @param success  Whether the batch is durably stored.
 * @param attempts Number of store attempts made.
 */
public record WriteResult(StoragePath path, boolean success, int attempts) {
}
