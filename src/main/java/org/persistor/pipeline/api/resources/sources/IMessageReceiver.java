package org.persistor.pipeline.api.resources.sources;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * A pull receiver owned exclusively by one pull task for its whole lifetime.
 * <p>
 * <strong>Thread Safety:</strong> receivers are NOT shared between tasks and need not be thread-safe,
 * except that {@link #fetchBatch(int, long, TimeUnit)} must react to thread interruption.
 */
public interface IMessageReceiver extends AutoCloseable {

    /**
     * Fetches up to {@code maxSize} messages, waiting up to the given time for the first one.
     *
     * @param maxSize maximum number of messages to return
     * @param timeout how long to wait for messages
     * @param unit    unit of {@code timeout}
     * @return the fetched messages in delivery order; an empty list signals the end of the stream
     * @throws IOException          if the provider failed to deliver
     * @throws InterruptedException if the calling task was cancelled while waiting
     */
    List<SourceMessage> fetchBatch(int maxSize, long timeout, TimeUnit unit) throws IOException, InterruptedException;

    /**
     * Advances the consumption checkpoint to the given message (inclusive).
     * Callers must only pass messages whose batch has been durably stored.
     *
     * @param last the last durably stored message
     * @throws IOException if the checkpoint could not be updated
     */
    void advanceCheckpoint(SourceMessage last) throws IOException;

    /**
     * Disconnects the receiver.
     *
     * @throws IOException if closing failed
     */
    @Override
    void close() throws IOException;
}
