package org.persistor.pipeline.storage;

import org.persistor.pipeline.api.resources.storage.StoragePath;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Snapshot of the current append target and when it was resolved.
 * <p>
 * Immutable; {@link AppendTargetRotator} replaces the whole snapshot under its lock, so
 * readers see either the old or the new path together with its timestamp.
 *
 * @param currentPath   The append target all tasks currently write to.
 * @param lastRotatedAt Wall-clock time of the resolution that produced {@code currentPath}.
 */
public record RotationState(StoragePath currentPath, LocalDateTime lastRotatedAt) {

    /**
     * Returns whether {@code now} lies in a different minute bucket than {@link #lastRotatedAt()}.
     * The bucket includes the date, so a day rollover with an equal hour and minute still rotates.
     */
    boolean isOutsideBucket(LocalDateTime now) {
        return !lastRotatedAt.truncatedTo(ChronoUnit.MINUTES).equals(now.truncatedTo(ChronoUnit.MINUTES));
    }
}
