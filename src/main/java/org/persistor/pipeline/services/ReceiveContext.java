package org.persistor.pipeline.services;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation token shared by the pull tasks of one orchestrator run.
 * <p>
 * Tasks check it before every fetch and before incorporating every message. Setting it does
 * not stop anything by itself; the orchestrator additionally interrupts the task threads so
 * that blocking fetches wake up.
 */
public final class ReceiveContext {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Requests cancellation.
     *
     * @return {@code true} if this call changed the state
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
