package org.persistor.pipeline.api.resources.sources;

/**
 * Provider variant of a {@link SourceMessage}.
 * <p>
 * The record formatter dispatches on this tag. Pull-mode receivers of some providers
 * transmit custom properties as raw byte pairs instead of text, which is captured by
 * {@link #hasRawProperties()}.
 */
public enum MessageKind {

    /** Event Grid event delivered by the host; the body is a JSON document. */
    EVENT_GRID(false, true),

    /** Event hub event delivered by the host (push). */
    EVENT_HUB_PUSH(false, false),

    /** Queue or subscription message delivered by the host (push). */
    SERVICE_BUS_PUSH(false, false),

    /** Event hub event fetched by a pull receiver; properties arrive as bytes. */
    EVENT_HUB_PULL(true, false),

    /** Queue or subscription message fetched by a pull receiver; properties arrive as bytes. */
    SERVICE_BUS_PULL(true, false),

    /** Plain text message without provider specifics. */
    GENERIC(false, false);

    private final boolean rawProperties;
    private final boolean structuredBody;

    MessageKind(boolean rawProperties, boolean structuredBody) {
        this.rawProperties = rawProperties;
        this.structuredBody = structuredBody;
    }

    /**
     * @return {@code true} if both keys and values of the custom properties are {@code byte[]}.
     */
    public boolean hasRawProperties() {
        return rawProperties;
    }

    /**
     * @return {@code true} if the body is a JSON document that is embedded as-is into the record.
     */
    public boolean hasStructuredBody() {
        return structuredBody;
    }
}
