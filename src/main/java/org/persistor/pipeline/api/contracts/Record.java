package org.persistor.pipeline.api.contracts;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized unit of persisted data.
 *
 * @param payload     The message payload as text.
 * @param jsonPayload Whether {@code payload} is a JSON document that is embedded as-is when serialized.
 * @param metadata    Custom properties of the source message, empty when metadata is not requested.
 */
public record Record(String payload, boolean jsonPayload, Map<String, String> metadata) {

    public Record {
        Objects.requireNonNull(payload, "payload cannot be null");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Creates a plain text record without metadata.
     */
    public static Record of(String payload) {
        return new Record(payload, false, Map.of());
    }

    public boolean hasMetadata() {
        return !metadata.isEmpty();
    }
}
