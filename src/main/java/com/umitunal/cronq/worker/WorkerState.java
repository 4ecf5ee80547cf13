package com.umitunal.cronq.worker;

/**
 * Lifecycle of a {@link CronWorker}.
 */
public enum WorkerState {
    STOPPED,
    STARTING,
    IDLE,        // polling for due jobs
    PROCESSING,  // a claimed job is being handled and rescheduled
    STOPPING
}
