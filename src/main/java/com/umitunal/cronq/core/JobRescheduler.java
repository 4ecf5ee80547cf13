package com.umitunal.cronq.core;

import com.umitunal.cronq.config.CronConfig;
import com.umitunal.cronq.schedule.IntervalEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Decides and persists the fate of a processed job.
 *
 * Recurring jobs (non-empty interval) get their next occurrence after the lock time,
 * bounded by repeat-until. Jobs without an interval, and recurring jobs without a further
 * occurrence, stop sleeping for good: the sleep-until field is removed, or the whole
 * document when auto-remove is true.
 */
public class JobRescheduler {
    private static final Logger log = LoggerFactory.getLogger(JobRescheduler.class);

    private final DocumentStore store;
    private final CronConfig config;
    private final IntervalEvaluator evaluator;

    public JobRescheduler(DocumentStore store, CronConfig config) {
        this(store, config, new IntervalEvaluator(config.getTimeZone()));
    }

    public JobRescheduler(DocumentStore store, CronConfig config, IntervalEvaluator evaluator) {
        this.store = store;
        this.config = config;
        this.evaluator = evaluator;
    }

    /**
     * Compute the fate without touching the store.
     */
    public JobFate decide(JobDocument job) {
        String interval = job.getText(config.getIntervalField());
        boolean recurring = interval != null && !interval.isEmpty();
        boolean autoRemove = job.isTrue(config.getAutoRemoveField());

        if (!recurring) {
            return autoRemove ? JobFate.removed(false) : JobFate.completed();
        }

        Instant repeatUntil = job.getInstant(config.getRepeatUntilField());
        Optional<Instant> next = evaluator.next(interval, job.getLockedAt(), repeatUntil);
        if (next.isPresent()) {
            return JobFate.rescheduled(next.get());
        }
        return autoRemove ? JobFate.removed(true) : JobFate.expired();
    }

    /**
     * Compute the fate and write it to the store.
     */
    public JobFate reschedule(JobDocument job) throws StoreException {
        JobFate fate = decide(job);
        String id = job.getId();
        String sleepUntil = config.getSleepUntilField();

        switch (fate.getOutcome()) {
            case REMOVED -> store.deleteOne(id);
            case COMPLETED, EXPIRED -> store.updateOne(id, DocumentUpdate.unset(sleepUntil));
            case RESCHEDULED -> store.updateOne(id, DocumentUpdate.setInstant(sleepUntil, fate.getNextRun()));
        }

        log.debug("Job {} {}", id, fate);
        return fate;
    }
}
