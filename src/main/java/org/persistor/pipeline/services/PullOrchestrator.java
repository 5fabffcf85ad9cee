package org.persistor.pipeline.services;

import org.persistor.pipeline.api.resources.IMonitorable;
import org.persistor.pipeline.api.resources.OperationalError;
import org.persistor.pipeline.api.resources.sources.IMessageSource;
import org.persistor.pipeline.api.resources.storage.IBlobStore;
import org.persistor.pipeline.api.resources.storage.StoragePath;
import org.persistor.pipeline.api.resources.storage.StorageTargetException;
import org.persistor.pipeline.api.resources.storage.StoreFailureException;
import org.persistor.pipeline.config.PersistorSettings;
import org.persistor.pipeline.config.PullConfigurationException;
import org.persistor.pipeline.config.PullRequestParameters;
import org.persistor.pipeline.formatting.RecordFormatter;
import org.persistor.pipeline.formatting.RecordSerializer;
import org.persistor.pipeline.services.PullTaskResult.Outcome;
import org.persistor.pipeline.storage.AppendTargetRotator;
import org.persistor.pipeline.storage.BatchStoreWriter;
import org.persistor.pipeline.storage.DestinationNamer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the pull variant: N concurrent {@link PullTask}s against one message source, bounded
 * by an optional time budget.
 * <p>
 * Everything a run mutates (cancellation token, processed counter, "finished" latch and the
 * rotation state) is allocated fresh per {@link #run(int, int, Duration)} call, so one
 * instance may serve overlapping runs. The writer and the metrics are shared.
 * <p>
 * In append mode the append target is resolved once before any task starts. With timed
 * append an additional refresh thread re-resolves it every
 * {@link PersistorSettings#rotationRefreshInterval()} until all tasks have finished; it is
 * never interrupted, it observes the latch and exits on its own.
 * <p>
 * Failures inside one task never abort its siblings. A run only fails as a whole when every
 * task failed to store and nothing was stored.
 */
public class PullOrchestrator implements IMonitorable {

    private static final Logger log = LoggerFactory.getLogger(PullOrchestrator.class);
    private static final AtomicInteger RUN_IDS = new AtomicInteger(0);

    private final IMessageSource source;
    private final IBlobStore store;
    private final PersistorSettings settings;
    private final DestinationNamer namer;
    private final RecordFormatter formatter = new RecordFormatter();
    private final RecordSerializer serializer = new RecordSerializer();
    private final BatchStoreWriter writer;

    private static final int MAX_ERRORS = 1000;
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();
    private final AtomicLong runsCompleted = new AtomicLong(0);
    private final AtomicLong recordsStored = new AtomicLong(0);
    private final AtomicLong messagesAcknowledged = new AtomicLong(0);
    private final AtomicLong messagesAbandoned = new AtomicLong(0);
    private final AtomicLong rotations = new AtomicLong(0);
    private final Map<Outcome, AtomicLong> taskOutcomes = new EnumMap<>(Outcome.class);

    public PullOrchestrator(IMessageSource source, IBlobStore store, PersistorSettings settings) {
        this(source, store, settings, Clock.systemDefaultZone());
    }

    /**
     * @param clock wall clock used for destination names and rotation
     * @throws PullConfigurationException if the output binding is enabled, which the pull variant does not
     *                                    support, or no store key is configured
     */
    public PullOrchestrator(IMessageSource source, IBlobStore store, PersistorSettings settings, Clock clock) {
        if (settings.outputBinding()) {
            throw new PullConfigurationException("Output binding must not be enabled for the pull variant");
        }
        if (!settings.hasStoreKey()) {
            throw new PullConfigurationException("No store key given (persistor.storeKey / STORE_PARAM)");
        }
        this.source = source;
        this.store = store;
        this.settings = settings;
        this.namer = new DestinationNamer(clock);
        this.writer = new BatchStoreWriter(store, namer, settings.storeKey(), settings.writer());
        for (Outcome outcome : Outcome.values()) {
            taskOutcomes.put(outcome, new AtomicLong(0));
        }
    }

    /**
     * Runs with the request parameters; the request's receive duration wins over the configured one.
     *
     * @return the processed count as text
     */
    public String handle(PullRequestParameters parameters) throws InterruptedException {
        Duration budget = parameters.receiveDurationOverride().or(settings::receiveDurationBudget).orElse(null);
        return String.valueOf(run(parameters.taskCount(), parameters.batchStoreSize(), budget));
    }

    /**
     * Spawns the pull tasks and waits for them.
     * <p>
     * Without a budget the run lasts until every task's stream ended. With a budget the run
     * lasts for the whole budget: tasks still running when it elapses are cancelled uniformly
     * and awaited (bounded by the cleanup timeout) until they stored their remainders and
     * abandoned what they could not. Tasks whose streams ended earlier do not shorten the run.
     *
     * @param taskCount  number of concurrent pull tasks
     * @param batchSize  source messages per stored batch
     * @param timeBudget overall receive duration, {@code null} for unbounded
     * @return number of records durably stored by this run
     * @throws StoreFailureException if every task failed to store and nothing was stored
     * @throws StorageTargetException if append mode is enabled but no append target can be used
     * @throws InterruptedException if the calling thread is interrupted; the tasks are cancelled first
     */
    public long run(int taskCount, int batchSize, Duration timeBudget) throws InterruptedException {
        if (taskCount < 1) {
            throw new IllegalArgumentException("taskCount must be at least 1");
        }
        int runId = RUN_IDS.incrementAndGet();
        ReceiveContext context = new ReceiveContext();
        ProcessedCounter counter = new ProcessedCounter();
        CountDownLatch finished = new CountDownLatch(1);

        AppendTargetRotator rotator = null;
        ExecutorService refresher = null;
        if (settings.append()) {
            rotator = new AppendTargetRotator(store, namer);
            StoragePath initial = rotator.resolvePath(settings.storeKey(), settings.timedAppend());
            log.debug("Run {}: initial append target '{}'", runId, initial);
            if (settings.timedAppend()) {
                AppendTargetRotator runRotator = rotator;
                refresher = Executors.newSingleThreadExecutor(namedThreads("rotation-refresh-" + runId));
                refresher.execute(() -> refreshLoop(runRotator, finished));
            }
        }

        log.info("Run {}: starting {} pull tasks on '{}' (batch size {}, budget {})",
            runId, taskCount, source.getResourceName(), batchSize, timeBudget == null ? "none" : timeBudget);

        ExecutorService pool = Executors.newFixedThreadPool(taskCount, namedThreads("pull-task-" + runId));
        List<Future<PullTaskResult>> futures = new ArrayList<>(taskCount);
        try {
            for (int i = 0; i < taskCount; i++) {
                futures.add(pool.submit(new PullTask(i, source, formatter, serializer, writer, rotator,
                    settings, batchSize, context, counter)));
            }
            pool.shutdown();

            if (timeBudget == null) {
                pool.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
            } else {
                long deadline = System.nanoTime() + timeBudget.toNanos();
                if (pool.awaitTermination(timeBudget.toNanos(), TimeUnit.NANOSECONDS)) {
                    long remaining = deadline - System.nanoTime();
                    if (remaining > 0) {
                        log.debug("Run {}: all streams ended, keeping the receive duration for another {} ms",
                            runId, TimeUnit.NANOSECONDS.toMillis(remaining));
                        TimeUnit.NANOSECONDS.sleep(remaining);
                    }
                } else {
                    log.info("Run {}: receive duration {} elapsed, cancelling pull tasks", runId, timeBudget);
                    cancelAndAwait(runId, context, pool);
                }
            }
        } catch (InterruptedException e) {
            log.debug("Run {}: interrupted, cancelling pull tasks", runId);
            cancelAndAwait(runId, context, pool);
            Thread.currentThread().interrupt();
            throw e;
        } finally {
            finished.countDown();
            pool.shutdownNow();
            if (refresher != null) {
                stopRefresher(runId, refresher);
            }
            if (rotator != null) {
                rotations.addAndGet(rotator.getRotationCount());
            }
        }

        return aggregate(runId, futures, counter);
    }

    private void cancelAndAwait(int runId, ReceiveContext context, ExecutorService pool) {
        context.cancel();
        pool.shutdownNow();
        boolean wasInterrupted = Thread.interrupted();
        try {
            if (!pool.awaitTermination(settings.cleanupTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Run {}: pull tasks did not finish their cleanup within {}", runId, settings.cleanupTimeout());
                recordError("CLEANUP_TIMEOUT", "Pull tasks did not finish their cleanup",
                    "Run " + runId + ", timeout " + settings.cleanupTimeout());
            }
        } catch (InterruptedException e) {
            log.debug("Run {}: interrupted while waiting for task cleanup", runId);
            wasInterrupted = true;
        } finally {
            if (wasInterrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void refreshLoop(AppendTargetRotator rotator, CountDownLatch finished) {
        long intervalMs = settings.rotationRefreshInterval().toMillis();
        try {
            while (!finished.await(intervalMs, TimeUnit.MILLISECONDS)) {
                try {
                    rotator.resolvePath(settings.storeKey(), true);
                } catch (RuntimeException e) {
                    log.warn("Failed to refresh append target, keeping '{}': {}",
                        rotator.currentPath().map(StoragePath::asString).orElse("none"), e.getMessage());
                }
            }
        } catch (InterruptedException e) {
            log.debug("Rotation refresh interrupted");
            Thread.currentThread().interrupt();
        }
    }

    private void stopRefresher(int runId, ExecutorService refresher) {
        refresher.shutdown();
        boolean wasInterrupted = Thread.interrupted();
        try {
            if (!refresher.awaitTermination(settings.cleanupTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Run {}: rotation refresh did not stop within {}", runId, settings.cleanupTimeout());
                refresher.shutdownNow();
            }
        } catch (InterruptedException e) {
            wasInterrupted = true;
            refresher.shutdownNow();
        } finally {
            if (wasInterrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private long aggregate(int runId, List<Future<PullTaskResult>> futures, ProcessedCounter counter) {
        int storeFailures = 0;
        int reported = 0;
        StorageTargetException targetError = null;
        for (Future<PullTaskResult> future : futures) {
            if (!future.isDone()) {
                log.warn("Run {}: a pull task did not report a result", runId);
                continue;
            }
            try {
                PullTaskResult result = future.get();
                reported++;
                taskOutcomes.get(result.outcome()).incrementAndGet();
                messagesAcknowledged.addAndGet(result.messagesAcknowledged());
                messagesAbandoned.addAndGet(result.messagesAbandoned());
                switch (result.outcome()) {
                    case STORE_FAILED -> {
                        storeFailures++;
                        recordError("STORE_FAILED", "Pull task stopped on a store failure", result.detail());
                    }
                    case RECEIVER_FAULT ->
                        recordError("RECEIVER_FAULT", "Pull task stopped on a receiver fault", result.detail());
                    default -> { }
                }
            } catch (ExecutionException e) {
                reported++;
                if (e.getCause() instanceof StorageTargetException ste) {
                    targetError = ste;
                } else {
                    log.error("Run {}: pull task failed unexpectedly: {}", runId, String.valueOf(e.getCause()));
                    recordError("TASK_FAILED", "Pull task failed unexpectedly", String.valueOf(e.getCause()));
                }
            } catch (InterruptedException e) {
                // Unreachable for a completed future
                Thread.currentThread().interrupt();
            } catch (CancellationException e) {
                log.debug("Run {}: pull task was cancelled before it started", runId);
            }
        }

        long processed = counter.get();
        recordsStored.addAndGet(processed);
        runsCompleted.incrementAndGet();

        if (targetError != null) {
            log.error("Run {}: append target unavailable: {}", runId, targetError.getMessage());
            throw targetError;
        }
        if (reported > 0 && storeFailures == reported && processed == 0) {
            log.error("Run {}: all {} pull tasks failed to store, nothing was persisted", runId, reported);
            throw new StoreFailureException("All " + reported + " pull tasks failed to store");
        }
        log.info("Run {}: {} records stored ({} of {} tasks failed to store)", runId, processed, storeFailures, futures.size());
        return processed;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger index = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + index.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

    private void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        while (errors.size() > MAX_ERRORS) {
            errors.pollFirst();
        }
    }

    @Override
    public Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("runs_completed", runsCompleted.get());
        metrics.put("records_stored", recordsStored.get());
        metrics.put("batches_written", writer.getBatchesWritten());
        metrics.put("write_retries", writer.getWriteRetries());
        metrics.put("write_failures", writer.getWriteFailures());
        metrics.put("messages_acknowledged", messagesAcknowledged.get());
        metrics.put("messages_abandoned", messagesAbandoned.get());
        metrics.put("append_rotations", rotations.get());
        taskOutcomes.forEach((outcome, count) -> metrics.put("tasks_" + outcome.name().toLowerCase(Locale.ROOT), count.get()));
        metrics.put("error_count", errors.size());
        return metrics;
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    @Override
    public boolean isHealthy() {
        return errors.isEmpty();
    }
}
