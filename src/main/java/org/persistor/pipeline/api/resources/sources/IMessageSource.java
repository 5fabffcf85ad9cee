package org.persistor.pipeline.api.resources.sources;

import org.persistor.pipeline.api.resources.IResource;

import java.io.IOException;

/**
 * A message source supporting the pull consumption model with at-least-once delivery.
 * <p>
 * Each pull task opens its own receiver; receivers are never shared across tasks.
 */
public interface IMessageSource extends IResource {

    /**
     * Opens a new receiver. The caller owns it and must close it on every exit path.
     *
     * @return a new receiver
     * @throws IOException if the connection could not be established
     */
    IMessageReceiver openReceiver() throws IOException;
}
