package org.persistor.pipeline.formatting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.persistor.pipeline.api.contracts.Record;

/**
 * Serializes a record into one JSON line: {@code {"DATA": ..., "METADATA": {...}}}.
 * {@code METADATA} is omitted when the record carries none.
 */
public class RecordSerializer {

    private final ObjectMapper objectMapper;

    public RecordSerializer() {
        this(new ObjectMapper());
    }

    public RecordSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String serialize(Record record) {
        ObjectNode root = objectMapper.createObjectNode();
        try {
            if (record.jsonPayload()) {
                root.set("DATA", objectMapper.readTree(record.payload()));
            } else {
                root.put("DATA", record.payload());
            }
            if (record.hasMetadata()) {
                ObjectNode metadata = root.putObject("METADATA");
                record.metadata().forEach(metadata::put);
            }
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Record cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }
}
