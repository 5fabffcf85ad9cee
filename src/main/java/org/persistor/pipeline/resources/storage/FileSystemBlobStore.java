package org.persistor.pipeline.resources.storage;

import com.typesafe.config.Config;
import org.persistor.pipeline.api.resources.storage.IBlobStore;
import org.persistor.pipeline.resources.AbstractResource;
import org.persistor.pipeline.utils.PathExpansion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Blob store backed by a local directory tree.
 * <p>
 * Whole-object writes go through a temporary file ({@code name.UUID.tmp}) followed by an
 * atomic move, so a reader never sees a partially written object. Appendable objects are
 * plain files opened with {@link StandardOpenOption#APPEND}; a single append of one block is
 * not interleaved with another block by the operating system for the sizes written here.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code rootDirectory} (required): absolute path, {@code ${VAR}} references are expanded</li>
 * </ul>
 */
public class FileSystemBlobStore extends AbstractResource implements IBlobStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemBlobStore.class);

    private final File rootDirectory;

    private final AtomicLong wholeWrites = new AtomicLong(0);
    private final AtomicLong blocksAppended = new AtomicLong(0);
    private final AtomicLong appendablesCreated = new AtomicLong(0);
    private final AtomicLong bytesWritten = new AtomicLong(0);
    private final AtomicLong writeErrors = new AtomicLong(0);

    public FileSystemBlobStore(String name, Config options) {
        super(name, options);
        if (!options.hasPath("rootDirectory")) {
            throw new IllegalArgumentException("rootDirectory is required for FileSystemBlobStore");
        }
        String expandedPath = PathExpansion.expandPath(options.getString("rootDirectory"));
        this.rootDirectory = new File(expandedPath);
        if (!rootDirectory.isAbsolute()) {
            throw new IllegalArgumentException("rootDirectory must be an absolute path: " + expandedPath);
        }
        if (!rootDirectory.exists() && !rootDirectory.mkdirs()) {
            throw new IllegalArgumentException("Failed to create rootDirectory: " + expandedPath);
        }
        log.debug("Blob store '{}' initialized at {}", name, rootDirectory);
    }

    @Override
    public boolean exists(String path) throws IOException {
        return Files.isRegularFile(resolve(path));
    }

    @Override
    public void createAppendableIfAbsent(String path) throws IOException {
        Path file = resolve(path);
        ensureParent(file);
        // createFile is atomic: exactly one concurrent creator succeeds
        Files.createFile(file);
        appendablesCreated.incrementAndGet();
        log.debug("Created appendable blob '{}'", path);
    }

    @Override
    public void appendBlock(String path, byte[] data) throws IOException {
        Path file = resolve(path);
        try {
            Files.write(file, data, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        } catch (NoSuchFileException e) {
            writeErrors.incrementAndGet();
            recordError("APPEND_FAILED", "Appendable blob does not exist", "Key: " + path);
            throw new IOException("Appendable blob does not exist: " + path, e);
        } catch (IOException e) {
            writeErrors.incrementAndGet();
            recordError("APPEND_FAILED", "Failed to append block", "Key: " + path + ", " + e.getMessage());
            throw e;
        }
        blocksAppended.incrementAndGet();
        bytesWritten.addAndGet(data.length);
    }

    @Override
    public void writeWhole(String path, byte[] data) throws IOException {
        Path file = resolve(path);
        ensureParent(file);

        Path tempFile = file.resolveSibling(file.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.write(tempFile, data);
            Files.move(tempFile, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            writeErrors.incrementAndGet();
            recordError("WRITE_FAILED", "Failed to write blob", "Key: " + path + ", " + e.getMessage());
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after write failure: {}", tempFile);
            }
            throw e;
        }
        wholeWrites.incrementAndGet();
        bytesWritten.addAndGet(data.length);
    }

    @Override
    public ResourceState getState() {
        return rootDirectory.isDirectory() && rootDirectory.canWrite() ? ResourceState.ACTIVE : ResourceState.FAILED;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("whole_writes", wholeWrites.get());
        metrics.put("blocks_appended", blocksAppended.get());
        metrics.put("appendables_created", appendablesCreated.get());
        metrics.put("bytes_written", bytesWritten.get());
        metrics.put("write_errors", writeErrors.get());
    }

    private Path resolve(String key) {
        validateKey(key);
        return new File(rootDirectory, key).toPath();
    }

    private static void ensureParent(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key cannot be null or empty");
        }
        if (key.contains("..")) {
            throw new IllegalArgumentException("Key cannot contain '..' (path traversal attempt): " + key);
        }
        if (key.startsWith("/") || key.startsWith("\\")) {
            throw new IllegalArgumentException("Key cannot be an absolute path: " + key);
        }
        if (key.length() >= 2 && key.charAt(1) == ':') {
            throw new IllegalArgumentException("Key cannot contain Windows drive letter: " + key);
        }
        for (char c : key.toCharArray()) {
            if ("<>\"?*|".indexOf(c) >= 0) {
                throw new IllegalArgumentException("Key contains invalid character '" + c + "': " + key);
            }
            if (c < 0x20) {
                throw new IllegalArgumentException("Key contains control character (0x"
                    + Integer.toHexString(c) + "): " + key);
            }
        }
    }
}
