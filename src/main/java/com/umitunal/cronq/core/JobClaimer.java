package com.umitunal.cronq.core;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.cronq.config.CronConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Locks the next due job.
 *
 * A job is due when its sleep-until field exists and is null or not in the future.
 * Locking pushes that field {@code lockDuration} into the future in the same atomic
 * store operation, so the job stays invisible to other workers until the lock expires
 * or the worker reschedules it. There is no separate lock flag.
 */
public class JobClaimer {
    private static final Logger log = LoggerFactory.getLogger(JobClaimer.class);

    private final DocumentStore store;
    private final CronConfig config;

    public JobClaimer(DocumentStore store, CronConfig config) {
        this.store = store;
        this.config = config;
    }

    /**
     * Claim one due job.
     *
     * @param now the current time; also recorded as the job's lock time
     * @return the locked job, or null when nothing is due
     */
    public JobDocument claim(Instant now) throws StoreException {
        String sleepUntil = config.getSleepUntilField();

        DocumentFilter filter = DocumentFilter.exists(sleepUntil)
                .and(DocumentFilter.dueBy(sleepUntil, now));
        if (config.getCondition() != null) {
            filter = filter.and(config.getCondition());
        }

        Instant lockedUntil = now.plusMillis(config.getLockDuration());
        ObjectNode locked = store.findOneAndUpdate(filter, DocumentUpdate.setInstant(sleepUntil, lockedUntil));
        if (locked == null) {
            return null;
        }

        JobDocument job = new JobDocument(locked, now);
        log.debug("Locked job {} until {}", job.getId(), lockedUntil);
        return job;
    }
}
