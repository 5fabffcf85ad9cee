package org.persistor.pipeline.resources;

import com.typesafe.config.Config;
import org.persistor.pipeline.api.resources.IMonitorable;
import org.persistor.pipeline.api.resources.IResource;
import org.persistor.pipeline.api.resources.OperationalError;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Abstract base class for all IResource implementations, providing common
 * functionality for name and configuration handling, and monitoring infrastructure.
 */
public abstract class AbstractResource implements IResource, IMonitorable {
    protected final String resourceName;
    protected final Config options;

    /**
     * Collection of operational errors that occurred during resource operations.
     * These are transient errors that don't prevent the resource from functioning
     * but may indicate problems.
     * <p>
     * Private to enforce use of {@link #recordError(String, String, String)}.
     */
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    /**
     * Maximum number of errors to keep in memory. When exceeded, oldest errors are removed.
     */
    protected int getMaxErrors() {
        return 10000;
    }

    /**
     * @param name    The unique name of the resource instance from the configuration.
     * @param options The configuration object for this resource instance.
     */
    protected AbstractResource(String name, Config options) {
        this.resourceName = Objects.requireNonNull(name, "Resource name cannot be null");
        this.options = Objects.requireNonNull(options, "Resource options cannot be null");
    }

    @Override
    public String getResourceName() {
        return resourceName;
    }

    /**
     * Records an operational error for tracking and monitoring.
     * <p>
     * <strong>IMPORTANT:</strong> Use this method ONLY for transient errors where the resource
     * continues functioning. For fatal errors, log and throw an exception instead.
     * <p>
     * <strong>Logging rules for resources:</strong>
     * <ul>
     *   <li>Transient error: {@code log.warn(...)} without the exception, then recordError()</li>
     *   <li>Fatal error: {@code log.error(...)} without the exception, then throw</li>
     *   <li>Retry attempts and interruption during shutdown: {@code log.debug(...)}</li>
     * </ul>
     * Stack traces are only ever logged at DEBUG level.
     *
     * @param code    Error code for categorization (e.g., "WRITE_FAILED", "ACK_FAILED")
     * @param message Human-readable error message
     * @param details Additional context about the error
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));

        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    /**
     * A resource is healthy as long as no operational error is recorded.
     */
    @Override
    public boolean isHealthy() {
        return errors.isEmpty();
    }

    /**
     * Returns the base metric {@code error_count} plus whatever {@link #addCustomMetrics(Map)} adds.
     */
    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook method for subclasses to add resource-specific metrics.
     * Always call {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map to add custom metrics to (already contains base metrics)
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }
}
