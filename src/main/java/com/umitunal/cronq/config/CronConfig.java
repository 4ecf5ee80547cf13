package com.umitunal.cronq.config;

import com.umitunal.cronq.core.DocumentFilter;
import com.umitunal.cronq.core.FieldPath;

import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Configuration for job claiming, rescheduling and worker pacing.
 * All durations are in milliseconds.
 */
public class CronConfig {
    public static final long DEFAULT_LOCK_DURATION = 600_000;

    private final long lockDuration;
    private final long nextDelay;
    private final long reprocessDelay;
    private final long idleDelay;
    private final String sleepUntilField;
    private final String intervalField;
    private final String repeatUntilField;
    private final String autoRemoveField;
    private final DocumentFilter condition;
    private final ZoneId timeZone;

    private CronConfig(Builder builder) {
        this.lockDuration = builder.lockDuration;
        this.nextDelay = builder.nextDelay;
        this.reprocessDelay = builder.reprocessDelay;
        this.idleDelay = builder.idleDelay;
        this.sleepUntilField = builder.sleepUntilField;
        this.intervalField = builder.intervalField;
        this.repeatUntilField = builder.repeatUntilField;
        this.autoRemoveField = builder.autoRemoveField;
        this.condition = builder.condition;
        this.timeZone = builder.timeZone;
    }

    public long getLockDuration() { return lockDuration; }
    public long getNextDelay() { return nextDelay; }
    public long getReprocessDelay() { return reprocessDelay; }
    public long getIdleDelay() { return idleDelay; }
    public String getSleepUntilField() { return sleepUntilField; }
    public String getIntervalField() { return intervalField; }
    public String getRepeatUntilField() { return repeatUntilField; }
    public String getAutoRemoveField() { return autoRemoveField; }
    public ZoneId getTimeZone() { return timeZone; }

    /**
     * Extra predicate AND-ed into every claim, or null.
     */
    public DocumentFilter getCondition() { return condition; }

    public static CronConfig defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .withLockDuration(lockDuration)
                .withNextDelay(nextDelay)
                .withReprocessDelay(reprocessDelay)
                .withIdleDelay(idleDelay)
                .withSleepUntilField(sleepUntilField)
                .withIntervalField(intervalField)
                .withRepeatUntilField(repeatUntilField)
                .withAutoRemoveField(autoRemoveField)
                .withCondition(condition)
                .withTimeZone(timeZone);
    }

    @Override
    public String toString() {
        return String.format(
            "CronConfig{lockDuration=%d, nextDelay=%d, reprocessDelay=%d, idleDelay=%d, fields=[%s, %s, %s, %s], zone=%s}",
            lockDuration, nextDelay, reprocessDelay, idleDelay,
            sleepUntilField, intervalField, repeatUntilField, autoRemoveField, timeZone
        );
    }

    public static class Builder {
        private long lockDuration = DEFAULT_LOCK_DURATION;
        private long nextDelay = 0;
        private long reprocessDelay = 0;
        private long idleDelay = 0;
        private String sleepUntilField = "sleepUntil";
        private String intervalField = "interval";
        private String repeatUntilField = "repeatUntil";
        private String autoRemoveField = "autoRemove";
        private DocumentFilter condition;
        private ZoneId timeZone = ZoneOffset.UTC;

        private Builder() {
        }

        /**
         * How long a claimed job stays locked. Must exceed the worst-case processing time,
         * otherwise another worker may pick the job up while it is still running.
         * Default: 600000 (10 minutes)
         */
        public Builder withLockDuration(long millis) {
            this.lockDuration = millis;
            return this;
        }

        /**
         * Pause after a job that is not rescheduled. Default: 0
         */
        public Builder withNextDelay(long millis) {
            this.nextDelay = millis;
            return this;
        }

        /**
         * Pause after a recurring job has been rescheduled. Default: 0
         */
        public Builder withReprocessDelay(long millis) {
            this.reprocessDelay = millis;
            return this;
        }

        /**
         * Pause after a claim attempt finds nothing or the store fails. Default: 0
         */
        public Builder withIdleDelay(long millis) {
            this.idleDelay = millis;
            return this;
        }

        public Builder withSleepUntilField(String path) {
            this.sleepUntilField = path;
            return this;
        }

        public Builder withIntervalField(String path) {
            this.intervalField = path;
            return this;
        }

        public Builder withRepeatUntilField(String path) {
            this.repeatUntilField = path;
            return this;
        }

        public Builder withAutoRemoveField(String path) {
            this.autoRemoveField = path;
            return this;
        }

        public Builder withCondition(DocumentFilter condition) {
            this.condition = condition;
            return this;
        }

        /**
         * Zone used to interpret interval expressions. Default: UTC
         */
        public Builder withTimeZone(ZoneId zone) {
            this.timeZone = zone;
            return this;
        }

        public CronConfig build() {
            requireNonNegative("lockDuration", lockDuration);
            requireNonNegative("nextDelay", nextDelay);
            requireNonNegative("reprocessDelay", reprocessDelay);
            requireNonNegative("idleDelay", idleDelay);
            FieldPath.of(sleepUntilField);
            FieldPath.of(intervalField);
            FieldPath.of(repeatUntilField);
            FieldPath.of(autoRemoveField);
            if (timeZone == null) {
                throw new IllegalArgumentException("timeZone must not be null");
            }
            return new CronConfig(this);
        }

        private static void requireNonNegative(String name, long value) {
            if (value < 0) {
                throw new IllegalArgumentException(name + " must not be negative: " + value);
            }
        }
    }
}
