package com.umitunal.cronq.worker;

import com.umitunal.cronq.core.JobDocument;

/**
 * Lifecycle notifications from a {@link CronWorker}. All methods are called on the
 * worker thread and the worker waits for them to return. Exceptions thrown here are
 * logged and otherwise ignored.
 */
public interface CronListener {

    default void onStart(CronWorker worker) {
    }

    default void onStop(CronWorker worker) {
    }

    /**
     * Called once when a claim finds nothing due, and again only after a job has been processed.
     */
    default void onIdle(CronWorker worker) {
    }

    /**
     * @param error a {@link JobProcessingException} or a store failure
     * @param job the job being handled, or null if the failure happened while claiming
     */
    default void onError(Throwable error, JobDocument job, CronWorker worker) {
    }
}
