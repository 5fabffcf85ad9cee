package org.persistor.pipeline.resources.sources;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.persistor.pipeline.api.resources.sources.IAcknowledgeable;
import org.persistor.pipeline.api.resources.sources.IMessageReceiver;
import org.persistor.pipeline.api.resources.sources.IMessageSource;
import org.persistor.pipeline.api.resources.sources.MessageKind;
import org.persistor.pipeline.api.resources.sources.SourceMessage;
import org.persistor.pipeline.resources.AbstractResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A thread-safe, in-memory message source with queue-style settlement.
 * <p>
 * Messages are delivered at least once: an abandoned message is put back at the head of the
 * queue and delivered again to the next receiver that fetches. Acknowledged messages are gone.
 * The source additionally tracks a checkpoint so that stream-style consumers can be verified.
 * <p>
 * All receivers share one queue and one checkpoint. A receiver can only vouch for the messages
 * it stored itself, so the checkpoint never moves past the lowest position that has not been
 * acknowledged yet, whichever receiver holds it. Positions held back this way are caught up by
 * a later checkpoint once the gap is acknowledged.
 * <p>
 * A receiver's {@link IMessageReceiver#fetchBatch(int, long, TimeUnit)} waits up to the
 * timeout for the first message and then drains without waiting. An empty result means the
 * stream has ended, matching the contract of provider receivers with an idle timeout.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code kind}: the {@link MessageKind} stamped on every message (default {@code GENERIC})</li>
 *   <li>{@code topic}: the publishing topic of {@code EVENT_GRID} messages (default none)</li>
 * </ul>
 */
public class InMemoryMessageSource extends AbstractResource implements IMessageSource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageSource.class);

    private final MessageKind kind;
    private final Optional<String> topic;
    private final LinkedBlockingDeque<InMemoryMessage> queue = new LinkedBlockingDeque<>();
    private final AtomicLong nextPosition = new AtomicLong(0);
    private final AtomicLong checkpoint = new AtomicLong(-1);
    private final ConcurrentSkipListSet<Long> unacknowledged = new ConcurrentSkipListSet<>();
    private long requestedCheckpoint = -1;
    private final AtomicInteger openReceivers = new AtomicInteger(0);

    private final AtomicLong messagesOffered = new AtomicLong(0);
    private final AtomicLong messagesDelivered = new AtomicLong(0);
    private final AtomicLong messagesAcknowledged = new AtomicLong(0);
    private final AtomicLong messagesAbandoned = new AtomicLong(0);

    public InMemoryMessageSource(String name, Config options) {
        super(name, options);
        Config finalConfig = options.withFallback(ConfigFactory.parseMap(Map.of("kind", "GENERIC", "topic", "")));
        try {
            this.kind = MessageKind.valueOf(finalConfig.getString("kind"));
            String configuredTopic = finalConfig.getString("topic");
            this.topic = kind == MessageKind.EVENT_GRID && !configuredTopic.isBlank()
                ? Optional.of(configuredTopic)
                : Optional.empty();
        } catch (ConfigException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid configuration for InMemoryMessageSource '" + name + "'", e);
        }
    }

    /**
     * Enqueues a text message without custom properties.
     *
     * @param body the message body, encoded as UTF-8
     * @return the source position assigned to the message
     */
    public long offer(String body) {
        return offer(body.getBytes(StandardCharsets.UTF_8), Map.of());
    }

    /**
     * Enqueues a message with custom properties. For kinds with raw properties, keys and values
     * are stored as UTF-8 bytes the way pull receivers expose them.
     *
     * @param body       the raw body
     * @param properties the custom properties
     * @return the source position assigned to the message
     */
    public long offer(byte[] body, Map<String, String> properties) {
        long position = nextPosition.getAndIncrement();
        unacknowledged.add(position);
        queue.addLast(new InMemoryMessage(position, body, encodeProperties(properties)));
        messagesOffered.incrementAndGet();
        return position;
    }

    /**
     * Enqueues a message whose body arrives in several chunks; the chunks are concatenated.
     *
     * @param chunks the body chunks in order
     * @return the source position assigned to the message
     */
    public long offerChunked(List<byte[]> chunks) {
        ByteArrayOutputStream joined = new ByteArrayOutputStream();
        for (byte[] chunk : chunks) {
            joined.writeBytes(chunk);
        }
        return offer(joined.toByteArray(), Map.of());
    }

    /**
     * Enqueues text messages in order.
     *
     * @param bodies the message bodies
     * @return the number of messages enqueued
     */
    public int offerAll(Collection<String> bodies) {
        if (bodies == null) {
            throw new NullPointerException("bodies collection cannot be null");
        }
        bodies.forEach(this::offer);
        return bodies.size();
    }

    @Override
    public IMessageReceiver openReceiver() {
        openReceivers.incrementAndGet();
        return new InMemoryReceiver();
    }

    /**
     * @return the checkpointed position, or -1 if none
     */
    public long getCheckpoint() {
        return checkpoint.get();
    }

    /**
     * @return the number of messages waiting for delivery, including redeliveries
     */
    public int pendingCount() {
        return queue.size();
    }

    /**
     * @return the number of receivers opened and not yet closed
     */
    public int openReceiverCount() {
        return openReceivers.get();
    }

    @Override
    public ResourceState getState() {
        return queue.isEmpty() ? ResourceState.WAITING : ResourceState.ACTIVE;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("messages_offered", messagesOffered.get());
        metrics.put("messages_delivered", messagesDelivered.get());
        metrics.put("messages_acknowledged", messagesAcknowledged.get());
        metrics.put("messages_abandoned", messagesAbandoned.get());
        metrics.put("checkpoint_position", checkpoint.get());
        metrics.put("pending", queue.size());
    }

    private synchronized void checkpointUpTo(long position) {
        requestedCheckpoint = Math.max(requestedCheckpoint, position);
        Long lowestOpen = unacknowledged.ceiling(Long.MIN_VALUE);
        long durable = lowestOpen == null ? requestedCheckpoint : Math.min(requestedCheckpoint, lowestOpen - 1);
        if (durable < position) {
            log.debug("Checkpoint of source '{}' held at {}, message {} is not acknowledged yet",
                resourceName, durable, lowestOpen);
        }
        checkpoint.accumulateAndGet(durable, Math::max);
    }

    private Map<?, ?> encodeProperties(Map<String, String> properties) {
        if (!kind.hasRawProperties()) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        }
        Map<byte[], byte[]> raw = new LinkedHashMap<>();
        properties.forEach((k, v) -> raw.put(k.getBytes(StandardCharsets.UTF_8), v.getBytes(StandardCharsets.UTF_8)));
        return Collections.unmodifiableMap(raw);
    }

    private final class InMemoryReceiver implements IMessageReceiver {

        private final AtomicBoolean closed = new AtomicBoolean(false);

        @Override
        public List<SourceMessage> fetchBatch(int maxSize, long timeout, TimeUnit unit)
                throws IOException, InterruptedException {
            ensureOpen();
            if (maxSize <= 0) {
                throw new IllegalArgumentException("maxSize must be positive");
            }
            InMemoryMessage first = queue.pollFirst(timeout, unit);
            if (first == null) {
                return List.of();
            }
            List<SourceMessage> batch = new ArrayList<>(Math.min(maxSize, queue.size() + 1));
            batch.add(first);
            InMemoryMessage next;
            while (batch.size() < maxSize && (next = queue.pollFirst()) != null) {
                batch.add(next);
            }
            messagesDelivered.addAndGet(batch.size());
            return batch;
        }

        @Override
        public void advanceCheckpoint(SourceMessage last) throws IOException {
            ensureOpen();
            checkpointUpTo(last.position());
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                openReceivers.decrementAndGet();
            }
        }

        private void ensureOpen() throws IOException {
            if (closed.get()) {
                throw new IOException("Receiver of source '" + resourceName + "' is closed");
            }
        }
    }

    /**
     * A delivered message; settles once, later settlements are ignored.
     */
    final class InMemoryMessage implements SourceMessage, IAcknowledgeable {

        private final long position;
        private final byte[] body;
        private final Map<?, ?> properties;
        private final AtomicBoolean settled = new AtomicBoolean(false);

        private InMemoryMessage(long position, byte[] body, Map<?, ?> properties) {
            this.position = position;
            this.body = body;
            this.properties = properties;
        }

        @Override
        public MessageKind kind() {
            return kind;
        }

        @Override
        public long position() {
            return position;
        }

        @Override
        public byte[] body() {
            return body;
        }

        @Override
        public Map<?, ?> properties() {
            return properties;
        }

        @Override
        public Optional<String> topic() {
            return topic;
        }

        @Override
        public void acknowledge() {
            if (!settled.compareAndSet(false, true)) {
                log.debug("Message {} is already settled, ignoring acknowledge", position);
                return;
            }
            unacknowledged.remove(position);
            messagesAcknowledged.incrementAndGet();
        }

        @Override
        public void abandon() {
            if (!settled.compareAndSet(false, true)) {
                log.debug("Message {} is already settled, ignoring abandon", position);
                return;
            }
            // Redeliver as a fresh delivery so it can be settled again
            queue.addFirst(new InMemoryMessage(position, body, properties));
            messagesAbandoned.incrementAndGet();
            log.debug("Message {} abandoned on source '{}', queued for redelivery", position, resourceName);
        }
    }
}
