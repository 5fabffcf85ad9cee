package org.persistor.pipeline.api.resources.storage;

import org.persistor.pipeline.api.resources.IResource;

import java.io.IOException;

/**
 * Key-based blob store supporting both whole-object writes and appendable objects.
 * <p>
 * Keys use hierarchical structure with '/' separators
 * (e.g., "orders/2024/3/7/14-5.txt").
 * <p>
 * <strong>Thread Safety:</strong> all methods are thread-safe. Multiple pull tasks write
 * concurrently without coordination; only appendable creation may race, see
 * {@link #createAppendableIfAbsent(String)}.
 */
public interface IBlobStore extends IResource {

    /**
     * Checks whether an object exists at the given key.
     *
     * @param path the storage key
     * @return {@code true} if an object exists
     * @throws IOException if the store could not be queried
     */
    boolean exists(String path) throws IOException;

    /**
     * Creates an empty appendable object at the given key.
     *
     * @param path the storage key
     * @throws java.nio.file.FileAlreadyExistsException if another creator won the race
     * @throws IOException if creation failed for any other reason
     */
    void createAppendableIfAbsent(String path) throws IOException;

    /**
     * Appends a block of bytes to an existing appendable object.
     *
     * @param path the storage key of an existing appendable object
     * @param data the bytes to append
     * @throws IOException if the object does not exist or the append failed
     */
    void appendBlock(String path, byte[] data) throws IOException;

    /**
     * Creates or overwrites the object at the given key with the given bytes.
     * The object becomes visible only after the write completed.
     *
     * @param path the storage key
     * @param data the object contents
     * @throws IOException if the write failed
     */
    void writeWhole(String path, byte[] data) throws IOException;
}
