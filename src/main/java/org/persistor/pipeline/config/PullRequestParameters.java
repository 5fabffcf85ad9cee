package org.persistor.pipeline.config;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Parameters of one pull run as supplied by the triggering request.
 *
 * @param taskCount       Number of concurrent pull tasks ({@code N}).
 * @param batchStoreSize  Messages per stored batch ({@code batch_store_size}), already capped.
 * @param receiveDuration Time budget override ({@code receive_duration}, seconds), {@code null} if absent.
 */
public record PullRequestParameters(int taskCount, int batchStoreSize, Duration receiveDuration) {

    public static final String TASK_COUNT = "N";
    public static final String BATCH_STORE_SIZE = "batch_store_size";
    public static final String RECEIVE_DURATION = "receive_duration";

    public static final int DEFAULT_TASK_COUNT = 1;
    public static final int DEFAULT_BATCH_STORE_SIZE = 200;
    /** Upper bound of messages held by one task: the batch plus the receiver's prefetch. */
    public static final int MAX_ALLOWED_BATCH_SIZE = 10000;

    public PullRequestParameters {
        if (taskCount < 1) {
            throw new PullConfigurationException("Number of concurrent tasks (" + TASK_COUNT + ") must be at least 1");
        }
        if (batchStoreSize < 1) {
            throw new PullConfigurationException("Messages to store in a batch (" + BATCH_STORE_SIZE + ") must be at least 1");
        }
        if (receiveDuration != null && (receiveDuration.isZero() || receiveDuration.isNegative())) {
            throw new PullConfigurationException("Receive duration (" + RECEIVE_DURATION + ") must be positive");
        }
    }

    /**
     * Parses the request parameters.
     * <p>
     * The batch size is capped at {@code 10000 - prefetch} so that one task never holds more
     * than 10000 unsettled messages.
     *
     * @param params   request parameters by name; absent parameters take their defaults
     * @param prefetch the receiver prefetch of this persistor
     * @return the parsed parameters
     * @throws PullConfigurationException if a value is not a number or out of range
     */
    public static PullRequestParameters parse(Map<String, String> params, int prefetch) {
        int taskCount = parseInt(params, TASK_COUNT, DEFAULT_TASK_COUNT, "number of concurrent tasks");
        int batchSize = parseInt(params, BATCH_STORE_SIZE, DEFAULT_BATCH_STORE_SIZE, "messages to store in a batch");
        int cap = MAX_ALLOWED_BATCH_SIZE - prefetch;
        if (cap < 1) {
            throw new PullConfigurationException("Prefetch " + prefetch + " leaves no room for a batch below "
                + MAX_ALLOWED_BATCH_SIZE + " messages");
        }

        Duration receiveDuration = null;
        String rawDuration = params.get(RECEIVE_DURATION);
        if (rawDuration != null && !rawDuration.isBlank()) {
            try {
                double seconds = Double.parseDouble(rawDuration.trim());
                receiveDuration = Duration.ofMillis(Math.round(seconds * 1000));
            } catch (NumberFormatException e) {
                throw new PullConfigurationException("Invalid value for receive duration (" + RECEIVE_DURATION + "): "
                    + rawDuration, e);
            }
        }
        return new PullRequestParameters(taskCount, Math.min(batchSize, cap), receiveDuration);
    }

    /**
     * @return the time budget override, if the request carried one
     */
    public Optional<Duration> receiveDurationOverride() {
        return Optional.ofNullable(receiveDuration);
    }

    private static int parseInt(Map<String, String> params, String name, int defaultValue, String description) {
        String raw = params.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new PullConfigurationException("Invalid value for " + description + " (" + name + "): " + raw, e);
        }
    }
}
