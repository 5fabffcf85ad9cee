package org.persistor.pipeline.formatting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.persistor.pipeline.api.contracts.Record;
import org.persistor.pipeline.api.resources.sources.MessageKind;
import org.persistor.pipeline.api.resources.sources.SourceMessage;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extracts the payload and, optionally, the custom properties of a source message.
 * <p>
 * Stateless and thread-safe; one instance is shared by all pull tasks.
 * <p>
 * Pull receivers transmit custom properties as raw byte pairs while push deliveries carry
 * text, so both keys and values are decoded as UTF-8 for kinds with
 * {@link MessageKind#hasRawProperties()}. Event Grid bodies are JSON documents and are kept
 * as JSON; they never carry metadata.
 */
public class RecordFormatter {

    private final ObjectMapper objectMapper;

    public RecordFormatter() {
        this(new ObjectMapper());
    }

    public RecordFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Formats a source message into a record.
     *
     * @param message         the source message
     * @param includeMetadata whether to carry the custom properties as metadata
     * @return the normalized record
     * @throws FormatException if the body or a property is not valid UTF-8, or an Event Grid body is not JSON
     */
    public Record format(SourceMessage message, boolean includeMetadata) throws FormatException {
        MessageKind kind = message.kind();
        String payload = decode(message.body(), "body of message " + message.position());

        if (kind.hasStructuredBody()) {
            try {
                objectMapper.readTree(payload);
            } catch (JsonProcessingException e) {
                throw new FormatException("Body of message " + message.position() + " is not valid JSON", e);
            }
            return new Record(payload, true, Map.of());
        }

        Map<String, String> metadata = includeMetadata
            ? extractMetadata(message, kind.hasRawProperties())
            : Map.of();
        return new Record(payload, false, metadata);
    }

    private Map<String, String> extractMetadata(SourceMessage message, boolean raw) throws FormatException {
        Map<?, ?> properties = message.properties();
        if (properties == null || properties.isEmpty()) {
            return Map.of();
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : properties.entrySet()) {
            String key = raw ? decodeProperty(entry.getKey(), message) : String.valueOf(entry.getKey());
            String value = raw ? decodeProperty(entry.getValue(), message) : String.valueOf(entry.getValue());
            metadata.put(key, value);
        }
        return metadata;
    }

    private String decodeProperty(Object value, SourceMessage message) throws FormatException {
        if (value instanceof byte[] bytes) {
            return decode(bytes, "property of message " + message.position());
        }
        // Some receivers already hand out text for individual properties
        return String.valueOf(value);
    }

    private static String decode(byte[] bytes, String what) throws FormatException {
        if (bytes == null) {
            throw new FormatException("Missing " + what);
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        } catch (CharacterCodingException e) {
            throw new FormatException("Invalid UTF-8 in " + what, e);
        }
    }
}
