package org.persistor.pipeline.services;

import java.util.concurrent.atomic.LongAdder;

/**
 * Number of records durably stored by all pull tasks of one orchestrator run.
 * <p>
 * Tasks add without any lock. {@link #get()} is not an atomic snapshot: while tasks are still
 * adding it may miss increments that are in flight. This is accepted because the value is only
 * read for reporting, and the final read happens after every task has finished.
 * Allocate one counter per run; never share it between runs.
 */
public final class ProcessedCounter {

    private final LongAdder count = new LongAdder();

    public void add(long records) {
        count.add(records);
    }

    public long get() {
        return count.sum();
    }
}
