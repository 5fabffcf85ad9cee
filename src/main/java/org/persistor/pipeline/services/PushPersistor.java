package org.persistor.pipeline.services;

import org.persistor.pipeline.api.resources.sources.SourceMessage;
import org.persistor.pipeline.api.resources.storage.IBlobStore;
import org.persistor.pipeline.api.resources.storage.StoragePath;
import org.persistor.pipeline.api.resources.storage.StoreFailureException;
import org.persistor.pipeline.api.resources.storage.WriteResult;
import org.persistor.pipeline.config.PersistorConfigurationException;
import org.persistor.pipeline.config.PersistorSettings;
import org.persistor.pipeline.formatting.FormatException;
import org.persistor.pipeline.formatting.RecordFormatter;
import org.persistor.pipeline.formatting.RecordSerializer;
import org.persistor.pipeline.storage.AppendTargetRotator;
import org.persistor.pipeline.storage.BatchStoreWriter;
import org.persistor.pipeline.storage.DestinationNamer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stores messages the host delivered directly (push variant).
 * <p>
 * There is no checkpoint: a failed store is surfaced as {@link StoreFailureException} so the
 * host's redelivery policy applies. In append mode pushed messages always go to the
 * time-rotated append target. With an output binding the serialized records are handed to the
 * host's output slot instead of the writer.
 * <p>
 * Without a configured store key, Event Grid events are stored under the third segment of
 * their topic (the subscription id of {@code /subscriptions/<id>/...}). A delivery spanning
 * several topics is written as one batch per key.
 */
public class PushPersistor {

    private static final Logger log = LoggerFactory.getLogger(PushPersistor.class);

    /** Result reported to the host after a successful store. */
    public static final String OK = "OK";

    private final PersistorSettings settings;
    private final RecordFormatter formatter = new RecordFormatter();
    private final RecordSerializer serializer = new RecordSerializer();
    private final IBlobStore store;
    private final DestinationNamer namer;
    private final BatchStoreWriter writer;
    private final Map<String, AppendTargetRotator> rotators = new ConcurrentHashMap<>();

    private final AtomicLong messagesStored = new AtomicLong(0);
    private final AtomicLong messagesSkipped = new AtomicLong(0);

    public PushPersistor(IBlobStore store, PersistorSettings settings) {
        this(store, settings, Clock.systemDefaultZone());
    }

    public PushPersistor(IBlobStore store, PersistorSettings settings, Clock clock) {
        this.settings = settings;
        this.store = store;
        this.namer = new DestinationNamer(clock);
        this.writer = new BatchStoreWriter(store, namer, settings.storeKey(), settings.writer());
    }

    public String persist(SourceMessage message) throws InterruptedException {
        return persist(List.of(message), null);
    }

    public String persist(List<? extends SourceMessage> messages) throws InterruptedException {
        return persist(messages, null);
    }

    /**
     * Formats and stores the delivered messages as one batch.
     *
     * @param messages the delivered messages
     * @param slot     the output slot; required when the output binding is enabled, ignored otherwise
     * @return {@link #OK}
     * @throws StoreFailureException if the batch could not be stored or no output slot is bound
     * @throws PersistorConfigurationException if no store key is configured and a message carries no usable topic
     * @throws InterruptedException if interrupted while backing off between store attempts
     */
    public String persist(List<? extends SourceMessage> messages, IOutputSlot slot) throws InterruptedException {
        Map<String, List<String>> linesByKey = new LinkedHashMap<>();
        List<String> lines = new ArrayList<>(messages.size());
        for (SourceMessage message : messages) {
            try {
                String line = serializer.serialize(formatter.format(message, settings.getMetadata()));
                lines.add(line);
                if (!settings.outputBinding()) {
                    linesByKey.computeIfAbsent(storeKeyFor(message), key -> new ArrayList<>()).add(line);
                }
            } catch (FormatException e) {
                messagesSkipped.incrementAndGet();
                log.warn("Skipping pushed message {}: {}", message.position(), e.getMessage());
            }
        }
        if (lines.isEmpty()) {
            return OK;
        }

        if (settings.outputBinding()) {
            if (slot == null) {
                log.error("No output slot bound, {} records were not stored", lines.size());
                throw new StoreFailureException("No output slot given, failed to store " + lines.size() + " records");
            }
            slot.set(String.join("\n", lines));
            messagesStored.addAndGet(lines.size());
            return OK;
        }

        for (Map.Entry<String, List<String>> group : linesByKey.entrySet()) {
            String key = group.getKey();
            List<String> keyLines = group.getValue();
            StoragePath target = settings.append()
                ? rotators.computeIfAbsent(key, k -> new AppendTargetRotator(store, namer)).resolvePath(key, true)
                : null;
            WriteResult result = writer.write(keyLines, key, target, settings.append());
            if (!result.success()) {
                throw new StoreFailureException("Failed to store " + keyLines.size() + " pushed records to '" + result.path() + "'");
            }
            messagesStored.addAndGet(keyLines.size());
        }
        return OK;
    }

    private String storeKeyFor(SourceMessage message) {
        if (settings.hasStoreKey()) {
            return settings.storeKey();
        }
        String topic = message.topic().orElseThrow(() -> new PersistorConfigurationException(
            "No store key given (persistor.storeKey / STORE_PARAM) and message " + message.position() + " has no topic"));
        String[] segments = topic.split("/");
        if (segments.length < 3 || segments[2].isBlank()) {
            throw new PersistorConfigurationException("No store key given and topic '" + topic + "' has no subscription segment");
        }
        return segments[2];
    }

    public long getMessagesStored() {
        return messagesStored.get();
    }

    public long getMessagesSkipped() {
        return messagesSkipped.get();
    }
}
