package org.persistor.pipeline.storage;

import org.persistor.pipeline.api.resources.storage.IBlobStore;
import org.persistor.pipeline.api.resources.storage.StoragePath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decides the append target for all tasks of one orchestrator run (or one push persistor).
 * <p>
 * {@link #resolvePath(String, boolean)} is the only place rotation happens. Resolution,
 * create-if-absent and the state update run as one unit under a single lock; the lock is
 * never held across a batch write.
 * <p>
 * Creation races with other processes are expected. A losing creator sees
 * {@link FileAlreadyExistsException} (or some other store error) and carries on with the
 * path, because the winner's object is just as good.
 * <p>
 * <strong>Thread Safety:</strong> thread-safe. Instances must not be shared between
 * orchestrator runs.
 */
public class AppendTargetRotator {

    private static final Logger log = LoggerFactory.getLogger(AppendTargetRotator.class);

    private final IBlobStore store;
    private final DestinationNamer namer;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile RotationState state;

    private final AtomicLong rotations = new AtomicLong(0);
    private final AtomicLong createRacesIgnored = new AtomicLong(0);

    public AppendTargetRotator(IBlobStore store, DestinationNamer namer) {
        this.store = store;
        this.namer = namer;
    }

    /**
     * Resolves the append target for {@code logicalKey}.
     * <p>
     * With {@code timeBased} the target is named after the current hour and minute and a new
     * target is only resolved when the minute bucket changed since the last rotation; calls
     * within the same bucket return the same path. Without {@code timeBased} every call
     * resolves a fresh uniquely named target.
     *
     * @param logicalKey the logical store key (top-level folder)
     * @param timeBased  whether the target rotates on the minute boundary
     * @return the current append target
     */
    public StoragePath resolvePath(String logicalKey, boolean timeBased) {
        lock.lock();
        try {
            LocalDateTime now = namer.now();
            RotationState current = state;
            if (timeBased && current != null && !current.isOutsideBucket(now)) {
                return current.currentPath();
            }

            StoragePath path = timeBased
                ? namer.timedPath(logicalKey, now)
                : namer.pathFor(logicalKey, UUID.randomUUID().toString(), now);
            ensureAppendable(path);
            state = new RotationState(path, now);
            rotations.incrementAndGet();
            log.debug("Append target rotated to '{}'", path);
            return path;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the last resolved append target, if any
     */
    public Optional<StoragePath> currentPath() {
        RotationState snapshot = state;
        return snapshot == null ? Optional.empty() : Optional.of(snapshot.currentPath());
    }

    public long getRotationCount() {
        return rotations.get();
    }

    public long getCreateRacesIgnored() {
        return createRacesIgnored.get();
    }

    private void ensureAppendable(StoragePath path) {
        String key = path.asString();
        try {
            if (store.exists(key)) {
                return;
            }
        } catch (IOException e) {
            // Fall through: the atomic create decides
            log.debug("Probe of append target '{}' failed: {}", key, e.getMessage());
        }
        try {
            store.createAppendableIfAbsent(key);
        } catch (FileAlreadyExistsException e) {
            createRacesIgnored.incrementAndGet();
            log.debug("Append target '{}' was created concurrently", key);
        } catch (IOException e) {
            createRacesIgnored.incrementAndGet();
            log.debug("Creating append target '{}' failed, assuming a concurrent creator: {}", key, e.getMessage());
        }
    }
}
