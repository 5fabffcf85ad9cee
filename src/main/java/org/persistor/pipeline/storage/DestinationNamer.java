package org.persistor.pipeline.storage;

import org.persistor.pipeline.api.resources.storage.StoragePath;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Computes destination paths of the form {@code {logicalKey}/{year}/{month}/{day}/{name}.txt}.
 * <p>
 * Date and time components are not zero-padded. The time always comes from the clock at the
 * moment the path is computed, never from when a batch is flushed.
 */
public class DestinationNamer {

    static final String EXTENSION = ".txt";

    private final Clock clock;

    public DestinationNamer(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return the current wall-clock time of this namer's clock
     */
    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * Computes a fresh unique destination for one batch.
     */
    public StoragePath uniquePath(String logicalKey) {
        return pathFor(logicalKey, UUID.randomUUID().toString(), now());
    }

    /**
     * Computes the time-bucketed append target for the given instant, e.g. {@code orders/2024/3/7/14-5.txt}.
     */
    public StoragePath timedPath(String logicalKey, LocalDateTime at) {
        return pathFor(logicalKey, bucketName(at), at);
    }

    public StoragePath pathFor(String logicalKey, String name, LocalDateTime at) {
        if (logicalKey == null || logicalKey.isEmpty()) {
            throw new IllegalArgumentException("logicalKey cannot be null or empty");
        }
        return StoragePath.of(logicalKey + "/" + at.getYear() + "/" + at.getMonthValue() + "/"
            + at.getDayOfMonth() + "/" + name + EXTENSION);
    }

    static String bucketName(LocalDateTime at) {
        return at.getHour() + "-" + at.getMinute();
    }
}
