package org.persistor.pipeline.api.resources.sources;

import java.io.IOException;

/**
 * Settlement capability of queue-style messages.
 * <p>
 * Implementations should be idempotent: settling a message twice must not fail.
 */
public interface IAcknowledgeable {

    /**
     * Completes the message; the source removes it permanently.
     *
     * @throws IOException if the source rejected the settlement.
     */
    void acknowledge() throws IOException;

    /**
     * Releases the message back to the source so that it is redelivered.
     *
     * @throws IOException if the source rejected the settlement.
     */
    void abandon() throws IOException;
}
