package org.persistor.pipeline.storage;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.persistor.pipeline.api.resources.storage.IBlobStore;
import org.persistor.pipeline.api.resources.storage.StoragePath;
import org.persistor.pipeline.api.resources.storage.StorageTargetException;
import org.persistor.pipeline.api.resources.storage.WriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes a batch of serialized records to the blob store with bounded retry.
 * <p>
 * In unique mode a fresh destination is named once per call (retries reuse it) and the batch
 * is written as a whole object. In append mode the caller supplies the append target and the
 * batch is appended as one block terminated by a newline, so consecutive blocks never merge
 * two records into one line.
 * <p>
 * Store failures never escape: after the last attempt the result carries {@code success=false}
 * and callers decide what a failed batch means. A write failing because its thread was
 * interrupted counts as cancellation and surfaces as {@link InterruptedException}.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code maxAttempts} (default 3)</li>
 *   <li>{@code retryBackoffMs} fixed delay between attempts (default 500)</li>
 * </ul>
 * <p>
 * <strong>Thread Safety:</strong> thread-safe; shared by all pull tasks of a run.
 */
public class BatchStoreWriter {

    private static final Logger log = LoggerFactory.getLogger(BatchStoreWriter.class);

    private final IBlobStore store;
    private final DestinationNamer namer;
    private final String logicalKey;
    private final int maxAttempts;
    private final long retryBackoffMs;

    private final AtomicLong batchesWritten = new AtomicLong(0);
    private final AtomicLong writeRetries = new AtomicLong(0);
    private final AtomicLong writeFailures = new AtomicLong(0);
    private final AtomicLong bytesWritten = new AtomicLong(0);

    /**
     * @param store      the blob store to write to
     * @param namer      names unique destinations
     * @param logicalKey the logical store key (top-level folder of unique destinations)
     * @param options    writer options
     */
    public BatchStoreWriter(IBlobStore store, DestinationNamer namer, String logicalKey, Config options) {
        this.store = store;
        this.namer = namer;
        this.logicalKey = logicalKey;
        Config finalConfig = options.withFallback(ConfigFactory.parseMap(Map.of(
            "maxAttempts", 3,
            "retryBackoffMs", 500
        )));
        this.maxAttempts = finalConfig.getInt("maxAttempts");
        this.retryBackoffMs = finalConfig.getLong("retryBackoffMs");
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (retryBackoffMs < 0) {
            throw new IllegalArgumentException("retryBackoffMs cannot be negative");
        }
    }

    /**
     * Writes the batch.
     *
     * @param lines        serialized records, in order
     * @param appendTarget the append target; required in append mode, ignored otherwise
     * @param appendMode   whether to append to {@code appendTarget} instead of writing a unique object
     * @return the destination and whether the batch is durably stored
     * @throws StorageTargetException if append mode is requested without a target
     * @throws InterruptedException if interrupted while writing or backing off between attempts
     */
    public WriteResult write(List<String> lines, StoragePath appendTarget, boolean appendMode)
            throws InterruptedException {
        return write(lines, logicalKey, appendTarget, appendMode);
    }

    /**
     * Writes the batch, naming unique destinations under {@code key} instead of the writer's key.
     *
     * @see #write(List, StoragePath, boolean)
     */
    public WriteResult write(List<String> lines, String key, StoragePath appendTarget, boolean appendMode)
            throws InterruptedException {
        StoragePath path;
        if (appendMode) {
            if (appendTarget == null) {
                throw new StorageTargetException("Append mode is enabled but no append target was given");
            }
            path = appendTarget;
        } else {
            path = namer.uniquePath(key);
        }

        String joined = String.join("\n", lines);
        byte[] data = (appendMode ? joined + "\n" : joined).getBytes(StandardCharsets.UTF_8);

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                if (appendMode) {
                    store.appendBlock(path.asString(), data);
                } else {
                    store.writeWhole(path.asString(), data);
                }
                batchesWritten.incrementAndGet();
                bytesWritten.addAndGet(data.length);
                log.debug("Wrote batch of {} records to '{}'", lines.size(), path);
                return new WriteResult(path, true, attempt);
            } catch (ClosedByInterruptException e) {
                throw interrupted(path, e);
            } catch (IOException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw interrupted(path, e);
                }
                if (attempt == maxAttempts) {
                    writeFailures.incrementAndGet();
                    log.error("Failed to store batch to '{}' after {} attempts ({} records, {} bytes): {}",
                        path, attempt, lines.size(), data.length, e.getMessage());
                    log.debug("Last store failure for '{}'", path, e);
                    return new WriteResult(path, false, attempt);
                }
                writeRetries.incrementAndGet();
                log.warn("Failed to store batch to '{}', retrying (attempt {}/{}): {}",
                    path, attempt, maxAttempts, e.getMessage());
                Thread.sleep(retryBackoffMs);
            }
        }
        // Unreachable, the loop returns on its last attempt
        throw new IllegalStateException("Retry loop exited without result");
    }

    /**
     * A write cut short by cancellation is not a store failure; the caller still owns the batch.
     */
    private static InterruptedException interrupted(StoragePath path, IOException cause) {
        Thread.interrupted();
        log.debug("Write to '{}' interrupted: {}", path, cause.toString());
        InterruptedException interrupted = new InterruptedException("Write to '" + path + "' interrupted");
        interrupted.initCause(cause);
        return interrupted;
    }

    public long getBatchesWritten() {
        return batchesWritten.get();
    }

    public long getWriteRetries() {
        return writeRetries.get();
    }

    public long getWriteFailures() {
        return writeFailures.get();
    }

    public long getBytesWritten() {
        return bytesWritten.get();
    }
}
