package org.persistor.pipeline.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Validated settings of one persistor instance, read from the {@code persistor} tree.
 * <p>
 * {@code timedAppend} implies {@code append}. Out-of-range pull values are clamped the way
 * the receivers expect them: prefetch to 0, idle timeout to 3 seconds (0 disables it), and
 * checkpoint update rate to 1.
 *
 * @param storeKey                  Logical store key, the top-level folder of all destinations. May be blank
 *                                  for push deliveries of Event Grid events, which fall back to their topic.
 * @param append                    Append batches to a shared target instead of one object per batch.
 * @param timedAppend               Rotate the append target every minute.
 * @param getMetadata               Carry custom message properties into the records.
 * @param outputBinding             Push path hands records to an output slot instead of the writer.
 * @param prefetch                  Receiver prefetch; also bounds the fetch size.
 * @param idleTimeout               How long a fetch waits for the first message before the stream is considered ended; zero waits indefinitely.
 * @param receiveDuration           Default time budget of a pull run, {@code null} for unbounded.
 * @param checkpointUpdateRate      Minimum number of durably stored messages between checkpoint advances.
 * @param cleanupTimeout            How long a cancelled run waits for its tasks to flush and abandon.
 * @param rotationRefreshInterval   Interval of the rotation refresh loop in timed-append mode.
 * @param storage                   Options of the blob store.
 * @param writer                    Options of the batch writer.
 * @param source                    Options of the message source.
 */
public record PersistorSettings(
    String storeKey,
    boolean append,
    boolean timedAppend,
    boolean getMetadata,
    boolean outputBinding,
    int prefetch,
    Duration idleTimeout,
    Duration receiveDuration,
    int checkpointUpdateRate,
    Duration cleanupTimeout,
    Duration rotationRefreshInterval,
    Config storage,
    Config writer,
    Config source
) {

    private static final Logger log = LoggerFactory.getLogger(PersistorSettings.class);

    static final String ROOT = "persistor";
    static final Duration MIN_IDLE_TIMEOUT = Duration.ofSeconds(3);

    public PersistorSettings {
        storeKey = storeKey == null ? "" : storeKey.trim();
        if (checkpointUpdateRate < 1) {
            throw new PullConfigurationException("checkpointUpdateRate must be at least 1");
        }
        if (prefetch < 0) {
            throw new PullConfigurationException("prefetch cannot be negative");
        }
        append = append || timedAppend;
        storage = storage == null ? ConfigFactory.empty() : storage;
        writer = writer == null ? ConfigFactory.empty() : writer;
        source = source == null ? ConfigFactory.empty() : source;
    }

    /**
     * @return whether a store key is configured
     */
    public boolean hasStoreKey() {
        return !storeKey.isEmpty();
    }

    /**
     * Reads and validates the settings from a resolved configuration.
     *
     * @param root the resolved root configuration (see {@link ConfigLoader})
     * @return the settings
     * @throws PersistorConfigurationException if a value is missing or has the wrong type
     */
    public static PersistorSettings from(Config root) {
        if (!root.hasPath(ROOT)) {
            throw new PersistorConfigurationException("Configuration has no '" + ROOT + "' section");
        }
        Config c = root.getConfig(ROOT);
        try {
            int prefetch = c.getInt("pull.prefetch");
            if (prefetch < 0) {
                log.info("pull.prefetch {} is negative, using 0", prefetch);
                prefetch = 0;
            }

            Duration idle = Duration.ofSeconds(c.getLong("pull.idleTimeoutSeconds"));
            if (idle.isNegative() || (!idle.isZero() && idle.compareTo(MIN_IDLE_TIMEOUT) < 0)) {
                log.info("pull.idleTimeoutSeconds {} is below the minimum, using {}s",
                    idle.getSeconds(), MIN_IDLE_TIMEOUT.getSeconds());
                idle = MIN_IDLE_TIMEOUT;
            }

            int rate = c.getInt("pull.checkpointUpdateRate");
            if (rate < 1) {
                log.info("pull.checkpointUpdateRate {} is below 1, using 1", rate);
                rate = 1;
            }

            Duration receiveDuration = null;
            double seconds = c.getDouble("pull.receiveDurationSeconds");
            if (seconds > 0) {
                receiveDuration = Duration.ofMillis(Math.round(seconds * 1000));
            }

            return new PersistorSettings(
                c.getString("storeKey"),
                flag(c, "append"),
                flag(c, "timedAppend"),
                flag(c, "getMetadata"),
                flag(c, "outputBinding"),
                prefetch,
                idle,
                receiveDuration,
                rate,
                c.getDuration("pull.cleanupTimeout"),
                c.getDuration("rotation.refreshInterval"),
                c.getConfig("storage"),
                c.getConfig("writer"),
                c.getConfig("source"));
        } catch (ConfigException e) {
            throw new PersistorConfigurationException("Invalid persistor configuration: " + e.getMessage(), e);
        }
    }

    /**
     * @return the default time budget of a pull run, if any
     */
    public Optional<Duration> receiveDurationBudget() {
        return Optional.ofNullable(receiveDuration);
    }

    /**
     * @return the fetch timeout in milliseconds; {@link Long#MAX_VALUE} when the idle timeout is disabled
     */
    public long fetchTimeoutMs() {
        return idleTimeout.isZero() ? Long.MAX_VALUE : idleTimeout.toMillis();
    }

    public PersistorSettings withAppend(boolean append, boolean timedAppend) {
        return new PersistorSettings(storeKey, append, timedAppend, getMetadata, outputBinding, prefetch, idleTimeout,
            receiveDuration, checkpointUpdateRate, cleanupTimeout, rotationRefreshInterval, storage, writer, source);
    }

    public PersistorSettings withMetadata(boolean getMetadata) {
        return new PersistorSettings(storeKey, append, timedAppend, getMetadata, outputBinding, prefetch, idleTimeout,
            receiveDuration, checkpointUpdateRate, cleanupTimeout, rotationRefreshInterval, storage, writer, source);
    }

    public PersistorSettings withOutputBinding(boolean outputBinding) {
        return new PersistorSettings(storeKey, append, timedAppend, getMetadata, outputBinding, prefetch, idleTimeout,
            receiveDuration, checkpointUpdateRate, cleanupTimeout, rotationRefreshInterval, storage, writer, source);
    }

    /**
     * Overrides the idle timeout without clamping; used where the source ends its stream quickly.
     */
    public PersistorSettings withIdleTimeout(Duration idleTimeout) {
        return new PersistorSettings(storeKey, append, timedAppend, getMetadata, outputBinding, prefetch, idleTimeout,
            receiveDuration, checkpointUpdateRate, cleanupTimeout, rotationRefreshInterval, storage, writer, source);
    }

    public PersistorSettings withReceiveDuration(Duration receiveDuration) {
        return new PersistorSettings(storeKey, append, timedAppend, getMetadata, outputBinding, prefetch, idleTimeout,
            receiveDuration, checkpointUpdateRate, cleanupTimeout, rotationRefreshInterval, storage, writer, source);
    }

    public PersistorSettings withCheckpointUpdateRate(int checkpointUpdateRate) {
        return new PersistorSettings(storeKey, append, timedAppend, getMetadata, outputBinding, prefetch, idleTimeout,
            receiveDuration, checkpointUpdateRate, cleanupTimeout, rotationRefreshInterval, storage, writer, source);
    }

    public PersistorSettings withRotationRefreshInterval(Duration rotationRefreshInterval) {
        return new PersistorSettings(storeKey, append, timedAppend, getMetadata, outputBinding, prefetch, idleTimeout,
            receiveDuration, checkpointUpdateRate, cleanupTimeout, rotationRefreshInterval, storage, writer, source);
    }

    /**
     * Reads a flag leniently: environment variables arrive as strings such as {@code TRUE}.
     */
    private static boolean flag(Config c, String path) {
        if (!c.hasPath(path)) {
            return false;
        }
        if (c.getValue(path).valueType() == ConfigValueType.BOOLEAN) {
            return c.getBoolean(path);
        }
        String raw = c.getString(path).trim().toLowerCase(Locale.ROOT);
        return switch (raw) {
            case "true", "yes", "on", "1" -> true;
            case "false", "no", "off", "0", "" -> false;
            default -> throw new PersistorConfigurationException(
                "Invalid value '" + c.getString(path) + "' for persistor." + path + ", expected true or false");
        };
    }
}
