package org.persistor.pipeline.api.resources.sources;

import java.util.Map;
import java.util.Optional;

/**
 * A single message as received from a message source, independent of the provider.
 * <p>
 * Queue-style messages that must be settled individually additionally implement
 * {@link IAcknowledgeable}. Stream-style messages (event hubs) are settled through
 * {@link IMessageReceiver#advanceCheckpoint(SourceMessage)} only.
 */
public interface SourceMessage {

    /**
     * @return The provider variant of this message.
     */
    MessageKind kind();

    /**
     * Returns the position of this message within its source stream (offset or sequence number).
     * Used as the checkpoint marker.
     *
     * @return The source position.
     */
    long position();

    /**
     * Returns the complete message body. Chunked bodies are already concatenated.
     *
     * @return The raw body bytes.
     */
    byte[] body();

    /**
     * Returns the custom properties of the message.
     * <p>
     * For kinds with {@link MessageKind#hasRawProperties()} keys and values are {@code byte[]},
     * otherwise they are {@code String}s.
     *
     * @return The custom properties, never {@code null}.
     */
    Map<?, ?> properties();

    /**
     * Returns the topic the event was published to, such as
     * {@code /subscriptions/<id>/resourceGroups/<group>/...}. Only Event Grid events carry one.
     *
     * @return The publishing topic, or empty.
     */
    default Optional<String> topic() {
        return Optional.empty();
    }
}
