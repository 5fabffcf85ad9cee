package org.persistor.pipeline.services;

/**
 * Outcome of one pull task.
 *
 * @param taskId               Index of the task within its run.
 * @param outcome              How the task ended.
 * @param batchesFlushed       Number of batches durably written.
 * @param recordsStored        Number of records durably written.
 * @param messagesAcknowledged Number of queue messages acknowledged after a successful write.
 * @param messagesAbandoned    Number of messages released back to the source.
 * @param detail               Failure description, {@code null} unless the task failed.
 */
public record PullTaskResult(
    int taskId,
    Outcome outcome,
    int batchesFlushed,
    long recordsStored,
    long messagesAcknowledged,
    long messagesAbandoned,
    String detail
) {

    public enum Outcome {
        /** The source stream ended and the remainder was stored. */
        COMPLETED,
        /** The run was cancelled; the remainder was stored and unincorporated messages abandoned. */
        CANCELLED,
        /** The receiver failed; the task stopped without storing its remainder. */
        RECEIVER_FAULT,
        /** A batch could not be stored; the task stopped without checkpointing it. */
        STORE_FAILED
    }
}
