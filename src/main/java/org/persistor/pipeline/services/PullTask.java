package org.persistor.pipeline.services;

import org.persistor.pipeline.api.contracts.Record;
import org.persistor.pipeline.api.resources.sources.IAcknowledgeable;
import org.persistor.pipeline.api.resources.sources.IMessageReceiver;
import org.persistor.pipeline.api.resources.sources.IMessageSource;
import org.persistor.pipeline.api.resources.sources.SourceMessage;
import org.persistor.pipeline.api.resources.storage.StoragePath;
import org.persistor.pipeline.api.resources.storage.StorageTargetException;
import org.persistor.pipeline.api.resources.storage.StoreFailureException;
import org.persistor.pipeline.api.resources.storage.WriteResult;
import org.persistor.pipeline.config.PersistorSettings;
import org.persistor.pipeline.formatting.FormatException;
import org.persistor.pipeline.formatting.RecordFormatter;
import org.persistor.pipeline.formatting.RecordSerializer;
import org.persistor.pipeline.services.PullTaskResult.Outcome;
import org.persistor.pipeline.storage.AppendTargetRotator;
import org.persistor.pipeline.storage.BatchStoreWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * One continuous receive loop against a message source.
 * <p>
 * Messages are formatted into a {@link Batch}; every {@code batchSize} source messages the
 * batch is flushed. A fetch never asks for more than the open batch still takes, so with several
 * tasks on one source every full batch is fetched by the task that stores it. A flush writes the records, then acknowledges the queue messages, then
 * advances the checkpoint, then counts the records. A failed write ends the task with
 * {@link Outcome#STORE_FAILED} so that nothing past undurable data is ever checkpointed.
 * <p>
 * The task leaves its loop when the stream ends, when the {@link ReceiveContext} is cancelled,
 * or when its thread is interrupted. On every exit path the cleanup runs:
 * <ul>
 *   <li>the remainder is flushed unless the task failed,</li>
 *   <li>fetched messages that never made it into a stored batch are abandoned,</li>
 *   <li>any durable but not yet checkpointed position is checkpointed,</li>
 *   <li>the receiver is closed.</li>
 * </ul>
 * <p>
 * <strong>Thread Safety:</strong> an instance runs on exactly one thread and owns its receiver.
 */
public class PullTask implements Callable<PullTaskResult> {

    private static final Logger log = LoggerFactory.getLogger(PullTask.class);

    private final int taskId;
    private final IMessageSource source;
    private final RecordFormatter formatter;
    private final RecordSerializer serializer;
    private final BatchStoreWriter writer;
    private final AppendTargetRotator rotator;
    private final PersistorSettings settings;
    private final int batchSize;
    private final ReceiveContext context;
    private final ProcessedCounter counter;

    private final Batch batch = new Batch();
    private final Deque<SourceMessage> fetched = new ArrayDeque<>();
    private SourceMessage lastDurable;
    private int uncheckpointed;
    private int batchesFlushed;
    private long recordsStored;
    private long acknowledged;
    private long abandoned;

    /**
     * @param rotator the run's rotator; required in append mode, may be {@code null} otherwise
     * @throws StorageTargetException if append mode is enabled without a rotator
     */
    public PullTask(int taskId,
                    IMessageSource source,
                    RecordFormatter formatter,
                    RecordSerializer serializer,
                    BatchStoreWriter writer,
                    AppendTargetRotator rotator,
                    PersistorSettings settings,
                    int batchSize,
                    ReceiveContext context,
                    ProcessedCounter counter) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        if (settings.append() && rotator == null) {
            throw new StorageTargetException("Append mode is enabled but no append target rotator was given");
        }
        this.taskId = taskId;
        this.source = source;
        this.formatter = formatter;
        this.serializer = serializer;
        this.writer = writer;
        this.rotator = rotator;
        this.settings = settings;
        this.batchSize = batchSize;
        this.context = context;
        this.counter = counter;
    }

    @Override
    public PullTaskResult call() {
        if (settings.append() && rotator.currentPath().isEmpty()) {
            throw new StorageTargetException("Append mode is enabled but no append target was resolved");
        }

        IMessageReceiver receiver;
        try {
            receiver = source.openReceiver();
        } catch (IOException e) {
            log.warn("Task {}: failed to open receiver on '{}': {}", taskId, source.getResourceName(), e.getMessage());
            return result(Outcome.RECEIVER_FAULT, e.getMessage());
        }

        Outcome outcome = Outcome.COMPLETED;
        String detail = null;
        try {
            receiveLoop(receiver);
            if (context.isCancelled()) {
                outcome = Outcome.CANCELLED;
            }
        } catch (InterruptedException e) {
            log.debug("Task {}: interrupted, cleaning up", taskId);
            Thread.currentThread().interrupt();
            outcome = Outcome.CANCELLED;
        } catch (StoreFailureException e) {
            outcome = Outcome.STORE_FAILED;
            detail = e.getMessage();
        } catch (IOException e) {
            log.warn("Task {}: error occurred with receiver, stopping: {}", taskId, e.getMessage());
            log.debug("Receiver failure of task {}", taskId, e);
            outcome = Outcome.RECEIVER_FAULT;
            detail = e.getMessage();
        } finally {
            // Cleanup must not be cut short by the interrupt that cancelled us
            boolean wasInterrupted = Thread.interrupted();
            try {
                if (outcome == Outcome.COMPLETED || outcome == Outcome.CANCELLED) {
                    try {
                        flush(receiver);
                    } catch (StoreFailureException e) {
                        outcome = Outcome.STORE_FAILED;
                        detail = e.getMessage();
                    } catch (InterruptedException e) {
                        log.debug("Task {}: interrupted while storing the remainder", taskId);
                        wasInterrupted = true;
                    }
                }
                if (!batch.isEmpty()) {
                    abandonAll(batch.messages());
                    batch.clear();
                }
                abandonAll(fetched);
                fetched.clear();
                checkpoint(receiver);
            } finally {
                closeQuietly(receiver);
                if (wasInterrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        }

        log.debug("Task {} finished: {} ({} batches, {} records)", taskId, outcome, batchesFlushed, recordsStored);
        return result(outcome, detail);
    }

    private void receiveLoop(IMessageReceiver receiver) throws IOException, InterruptedException {
        int prefetch = settings.prefetch() > 0 ? settings.prefetch() : batchSize;
        while (!context.isCancelled()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Task " + taskId + " interrupted before fetch");
            }
            // Never hold more than the open batch can take, siblings get the rest
            int fetchSize = Math.min(prefetch, batchSize - batch.messageCount());
            List<SourceMessage> messages = receiver.fetchBatch(fetchSize, settings.fetchTimeoutMs(), TimeUnit.MILLISECONDS);
            if (messages.isEmpty()) {
                log.debug("Task {}: source stream ended", taskId);
                return;
            }
            fetched.addAll(messages);

            while (!fetched.isEmpty()) {
                if (context.isCancelled()) {
                    return;
                }
                incorporate(fetched.pollFirst());
                if (batch.messageCount() >= batchSize) {
                    flush(receiver);
                }
            }
        }
    }

    private void incorporate(SourceMessage message) {
        try {
            Record record = formatter.format(message, settings.getMetadata());
            batch.add(message, record);
        } catch (FormatException e) {
            log.warn("Task {}: skipping message {}: {}", taskId, message.position(), e.getMessage());
            batch.addSkipped(message);
        }
    }

    /**
     * Stores the batch and settles its messages. Leaves the batch untouched if the write is
     * interrupted, so the cleanup can store it.
     */
    private void flush(IMessageReceiver receiver) throws InterruptedException {
        if (batch.isEmpty()) {
            return;
        }
        if (batch.recordCount() > 0) {
            List<String> lines = new ArrayList<>(batch.recordCount());
            for (Record record : batch.records()) {
                lines.add(serializer.serialize(record));
            }
            StoragePath target = settings.append() ? rotator.currentPath().orElse(null) : null;
            WriteResult result = writer.write(lines, target, settings.append());
            if (!result.success()) {
                throw new StoreFailureException("Task " + taskId + ": batch of " + lines.size()
                    + " records could not be stored to '" + result.path() + "' after " + result.attempts() + " attempts");
            }
            batchesFlushed++;
        }

        for (SourceMessage message : batch.messages()) {
            if (message instanceof IAcknowledgeable ackable) {
                try {
                    ackable.acknowledge();
                    acknowledged++;
                } catch (IOException e) {
                    // Stored already; the source redelivers it, which at-least-once permits
                    log.warn("Task {}: failed to acknowledge message {}: {}", taskId, message.position(), e.getMessage());
                }
            }
        }

        lastDurable = batch.last();
        uncheckpointed += batch.messageCount();
        if (uncheckpointed >= settings.checkpointUpdateRate()) {
            checkpoint(receiver);
        }

        counter.add(batch.recordCount());
        recordsStored += batch.recordCount();
        batch.clear();
    }

    private void checkpoint(IMessageReceiver receiver) {
        if (uncheckpointed == 0 || lastDurable == null) {
            return;
        }
        try {
            receiver.advanceCheckpoint(lastDurable);
            uncheckpointed = 0;
        } catch (IOException e) {
            log.warn("Task {}: failed to advance checkpoint to {}: {}", taskId, lastDurable.position(), e.getMessage());
        }
    }

    private void abandonAll(Collection<SourceMessage> messages) {
        for (SourceMessage message : messages) {
            if (message instanceof IAcknowledgeable ackable) {
                try {
                    ackable.abandon();
                    abandoned++;
                } catch (IOException e) {
                    log.debug("Task {}: failed to abandon message {}: {}", taskId, message.position(), e.getMessage());
                }
            }
        }
    }

    private void closeQuietly(IMessageReceiver receiver) {
        try {
            receiver.close();
        } catch (IOException e) {
            log.debug("Task {}: failed to close receiver: {}", taskId, e.getMessage());
        }
    }

    private PullTaskResult result(Outcome outcome, String detail) {
        return new PullTaskResult(taskId, outcome, batchesFlushed, recordsStored, acknowledged, abandoned, detail);
    }
}
