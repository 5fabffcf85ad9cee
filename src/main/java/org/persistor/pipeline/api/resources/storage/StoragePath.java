package org.persistor.pipeline.api.resources.storage;

import java.util.Objects;

/**
 * Immutable value object representing a destination path in the blob store.
 * <p>
 * <strong>Example paths:</strong>
 * <ul>
 *   <li>{@code "orders/2024/3/7/0b7c0e9e-3f39-4a39-9a5b-0f3b9e3f8f55.txt"} (unique per batch)</li>
 *   <li>{@code "orders/2024/3/7/14-5.txt"} (time-bucketed append target)</li>
 * </ul>
 * <p>
 * <strong>Thread Safety:</strong> This class is immutable and thread-safe.
 */
public final class StoragePath {

    private final String path;

    private StoragePath(String path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("path cannot be null or empty");
        }
        this.path = path;
    }

    /**
     * Creates a StoragePath from a string path.
     *
     * @param path the storage key (must not be null or empty)
     * @return a new StoragePath instance
     * @throws IllegalArgumentException if path is null or empty
     */
    public static StoragePath of(String path) {
        return new StoragePath(path);
    }

    /**
     * @return the storage key
     */
    public String asString() {
        return path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StoragePath that = (StoragePath) o;
        return path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path);
    }

    @Override
    public String toString() {
        return path;
    }
}
