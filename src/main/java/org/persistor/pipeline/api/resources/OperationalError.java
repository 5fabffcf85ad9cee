package org.persistor.pipeline.api.resources;

import java.time.Instant;

/**
 * Represents an operational error that occurred within a persistor component.
 *
 * @param timestamp The timestamp of when the error occurred.
 * @param errorType A category for the error (e.g., "WRITE_FAILED", "ACK_FAILED").
 * @param message   A human-readable description of the error.
 * @param details   Optional additional context, such as the affected path.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
