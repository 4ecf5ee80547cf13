package com.umitunal.cronq.core;

import java.time.Instant;

/**
 * What happens to a job after it has been processed.
 */
public final class JobFate {

    public enum Outcome {
        /** Non-recurring job finished; its sleep-until field is cleared. */
        COMPLETED,
        /** Recurring job has no further occurrence; its sleep-until field is cleared. */
        EXPIRED,
        /** Job deleted because auto-remove is set. */
        REMOVED,
        /** Recurring job set to sleep until its next occurrence. */
        RESCHEDULED
    }

    private final Outcome outcome;
    private final Instant nextRun;
    private final boolean recurring;

    private JobFate(Outcome outcome, Instant nextRun, boolean recurring) {
        this.outcome = outcome;
        this.nextRun = nextRun;
        this.recurring = recurring;
    }

    static JobFate completed() {
        return new JobFate(Outcome.COMPLETED, null, false);
    }

    static JobFate expired() {
        return new JobFate(Outcome.EXPIRED, null, true);
    }

    static JobFate removed(boolean recurring) {
        return new JobFate(Outcome.REMOVED, null, recurring);
    }

    static JobFate rescheduled(Instant nextRun) {
        return new JobFate(Outcome.RESCHEDULED, nextRun, true);
    }

    public Outcome getOutcome() { return outcome; }

    /**
     * @return next run time, only for {@link Outcome#RESCHEDULED}
     */
    public Instant getNextRun() { return nextRun; }

    /**
     * Whether the job carried an interval expression.
     */
    public boolean isRecurring() { return recurring; }

    @Override
    public String toString() {
        return outcome == Outcome.RESCHEDULED ? "RESCHEDULED(" + nextRun + ")" : outcome.name();
    }
}
