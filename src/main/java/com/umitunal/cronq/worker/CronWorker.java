package com.umitunal.cronq.worker;

import com.umitunal.cronq.config.CronConfig;
import com.umitunal.cronq.core.DocumentStore;
import com.umitunal.cronq.core.JobClaimer;
import com.umitunal.cronq.core.JobDocument;
import com.umitunal.cronq.core.JobFate;
import com.umitunal.cronq.core.JobRescheduler;
import com.umitunal.cronq.core.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * A worker that continuously claims due jobs from a document store, hands them to a
 * {@link JobProcessor} and reschedules or retires them afterwards.
 *
 * Each worker owns one background thread and runs strictly one job at a time. Any number
 * of workers may share a store; the store's atomic claim keeps them from running the same
 * job concurrently. Failures never end the loop: they are reported to
 * {@link CronListener#onError} and the loop carries on, pausing for the idle delay after
 * store failures. Only {@link #stop()} ends it.
 *
 * If the process dies while a job is locked, nothing is cleaned up. The job becomes due
 * again once its lock expires and the next claim by any worker picks it up.
 */
public class CronWorker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CronWorker.class);

    private final String workerId;
    private final JobProcessor processor;
    private final CronListener listener;
    private final CronConfig config;
    private final Clock clock;
    private final JobClaimer claimer;
    private final JobRescheduler rescheduler;
    private final AtomicLong processedCount;
    private final AtomicLong failedCount;

    // guards lifecycle transitions; wakeup cuts delays short on stop
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeup = lock.newCondition();

    private volatile WorkerState state = WorkerState.STOPPED;
    private volatile boolean stopRequested;
    private volatile boolean idle;
    private boolean manualCycle;
    private Thread workerThread;
    private CompletableFuture<Void> started = CompletableFuture.completedFuture(null);
    private CompletableFuture<Void> stopped = CompletableFuture.completedFuture(null);

    private CronWorker(Builder builder) {
        this.workerId = builder.workerId;
        this.processor = builder.processor;
        this.listener = builder.listener;
        this.config = builder.config;
        this.clock = builder.clock;
        this.claimer = new JobClaimer(builder.store, config);
        this.rescheduler = new JobRescheduler(builder.store, config);
        this.processedCount = new AtomicLong(0);
        this.failedCount = new AtomicLong(0);
    }

    /**
     * Start the worker in the background. Does nothing if it is already running.
     *
     * @return completes once the start notification has run and the worker is polling
     */
    public CompletableFuture<Void> start() {
        lock.lock();
        try {
            if (state != WorkerState.STOPPED) {
                return started;
            }
            if (manualCycle) {
                throw new IllegalStateException("Worker " + workerId + " is running processOne()");
            }
            state = WorkerState.STARTING;
            stopRequested = false;
            idle = false;
            CompletableFuture<Void> startFuture = new CompletableFuture<>();
            CompletableFuture<Void> stopFuture = new CompletableFuture<>();
            started = startFuture;
            stopped = stopFuture;

            workerThread = new Thread(() -> run(startFuture, stopFuture), "CronWorker-" + workerId);
            workerThread.setDaemon(false);
            workerThread.start();
            return started;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ask the worker to stop. A job that is being processed is finished and rescheduled
     * first; pending delays are cut short. Does nothing if the worker is stopped.
     *
     * @return completes once the worker is stopped and the stop notification has run
     */
    public CompletableFuture<Void> stop() {
        lock.lock();
        try {
            if (state == WorkerState.STOPPED) {
                return stopped;
            }
            stopRequested = true;
            wakeup.signalAll();
            return stopped;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run a single claim, process and reschedule cycle on the calling thread, without delays.
     * Only allowed while the background loop is stopped.
     *
     * @return true if a job was claimed and handled, false if nothing was due
     * @throws StoreException if claiming or rescheduling fails
     */
    public boolean processOne() throws StoreException, InterruptedException {
        lock.lock();
        try {
            if (state != WorkerState.STOPPED || manualCycle) {
                throw new IllegalStateException("Worker " + workerId + " is already running");
            }
            manualCycle = true;
        } finally {
            lock.unlock();
        }

        try {
            JobDocument job = claimer.claim(clock.instant());
            if (job == null) {
                return false;
            }
            handle(job);
            return true;
        } finally {
            lock.lock();
            try {
                manualCycle = false;
            } finally {
                lock.unlock();
            }
        }
    }

    private void run(CompletableFuture<Void> startFuture, CompletableFuture<Void> stopFuture) {
        log.info("Worker {} starting", workerId);
        notifyListener("onStart", l -> l.onStart(this));
        setState(WorkerState.IDLE);
        startFuture.complete(null);

        try {
            while (!stopRequested && !Thread.currentThread().isInterrupted()) {
                long delay = tick();
                if (!pause(delay)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker {} interrupted", workerId);
        } finally {
            setState(WorkerState.STOPPING);
            notifyListener("onStop", l -> l.onStop(this));

            lock.lock();
            try {
                state = WorkerState.STOPPED;
                idle = false;
            } finally {
                lock.unlock();
            }
            stopFuture.complete(null);
            log.info("Worker {} stopped (processed={}, failed={})", workerId, processedCount.get(), failedCount.get());
        }
    }

    /**
     * One loop iteration.
     *
     * @return how long to pause before the next iteration
     */
    private long tick() throws InterruptedException {
        JobDocument job;
        try {
            job = claimer.claim(clock.instant());
        } catch (StoreException | RuntimeException | Error e) {
            log.warn("Worker {} failed to claim a job: {}", workerId, e.getMessage());
            notifyListener("onError", l -> l.onError(e, null, this));
            return config.getIdleDelay();
        }

        if (job == null) {
            if (!idle) {
                idle = true;
                notifyListener("onIdle", l -> l.onIdle(this));
            }
            return config.getIdleDelay();
        }

        idle = false;
        setState(WorkerState.PROCESSING);
        try {
            JobFate fate = handle(job);
            return fate.getOutcome() == JobFate.Outcome.RESCHEDULED
                    ? config.getReprocessDelay()
                    : config.getNextDelay();
        } catch (StoreException | RuntimeException | Error e) {
            log.warn("Worker {} failed to reschedule job {}: {}", workerId, job.getId(), e.getMessage());
            notifyListener("onError", l -> l.onError(e, job, this));
            return config.getIdleDelay();
        } finally {
            setState(WorkerState.IDLE);
        }
    }

    /**
     * Process a claimed job, then apply its fate. Processing failures are reported
     * and do not prevent rescheduling.
     */
    private JobFate handle(JobDocument job) throws StoreException {
        JobProcessingException failure = null;
        try {
            JobProcessor.ProcessingResult result = processor.process(job);
            if (result != null && !result.isSuccess()) {
                failure = new JobProcessingException(job.getId(), String.valueOf(result.getMessage()), null);
            }
        } catch (InterruptedException e) {
            // finish the cycle; the next pause sees the flag and ends the loop
            Thread.currentThread().interrupt();
            failure = new JobProcessingException(job.getId(), "interrupted", e);
        } catch (Throwable e) {
            // errors from user code fail the job, not the loop
            failure = new JobProcessingException(job.getId(), String.valueOf(e.getMessage()), e);
        }

        if (failure == null) {
            processedCount.incrementAndGet();
        } else {
            failedCount.incrementAndGet();
            log.warn("Worker {}: {}", workerId, failure.getMessage());
            JobProcessingException error = failure;
            notifyListener("onError", l -> l.onError(error, job, this));
        }

        return rescheduler.reschedule(job);
    }

    /**
     * Wait for the given delay unless a stop is requested.
     *
     * @return false if the worker should stop
     */
    private boolean pause(long millis) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            long nanos = TimeUnit.MILLISECONDS.toNanos(millis);
            while (!stopRequested && nanos > 0) {
                nanos = wakeup.awaitNanos(nanos);
            }
            return !stopRequested;
        } finally {
            lock.unlock();
        }
    }

    private void setState(WorkerState next) {
        lock.lock();
        try {
            state = next;
        } finally {
            lock.unlock();
        }
    }

    private void notifyListener(String event, Consumer<CronListener> call) {
        try {
            call.accept(listener);
        } catch (Throwable e) {
            log.warn("Worker {} listener {} threw", workerId, event, e);
        }
    }

    public String getWorkerId() { return workerId; }
    public long getProcessedCount() { return processedCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
    public WorkerState getState() { return state; }
    public CronConfig getConfig() { return config; }

    /**
     * True from {@link #start()} until the loop has fully stopped, including while a
     * stop request waits for an in-flight job.
     */
    public boolean isRunning() { return state != WorkerState.STOPPED; }

    public boolean isProcessing() { return state == WorkerState.PROCESSING; }

    /**
     * True when the last claim attempt found no due job.
     */
    public boolean isIdle() { return idle && isRunning(); }

    /**
     * Stop and wait for the worker to finish its current job.
     */
    @Override
    public void close() {
        CompletableFuture<Void> done = stop();
        if (Thread.currentThread() != workerThread) {
            done.join();
        }
    }

    public static Builder builder(String workerId, DocumentStore store, JobProcessor processor) {
        return new Builder(workerId, store, processor);
    }

    public static class Builder {
        private final String workerId;
        private final DocumentStore store;
        private final JobProcessor processor;
        private CronConfig config = CronConfig.defaults();
        private CronListener listener = new CronListener() { };
        private Clock clock = Clock.systemUTC();

        private Builder(String workerId, DocumentStore store, JobProcessor processor) {
            this.workerId = workerId;
            this.store = store;
            this.processor = processor;
        }

        public Builder withConfig(CronConfig config) {
            this.config = config;
            return this;
        }

        public Builder withListener(CronListener listener) {
            this.listener = listener;
            return this;
        }

        /**
         * Clock used for claim times. Default: system UTC clock
         */
        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CronWorker build() {
            if (workerId == null || store == null || processor == null) {
                throw new IllegalArgumentException("workerId, store and processor are required");
            }
            return new CronWorker(this);
        }
    }
}
