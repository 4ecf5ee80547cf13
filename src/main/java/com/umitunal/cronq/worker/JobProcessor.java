package com.umitunal.cronq.worker;

import com.umitunal.cronq.core.JobDocument;

import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * User code that handles a claimed job.
 *
 * The job stays locked while this runs. Whatever the result, the worker
 * reschedules or retires the job afterwards.
 */
@FunctionalInterface
public interface JobProcessor {

    /**
     * Process a job and return the result.
     *
     * @param job the claimed job
     * @return processing result
     * @throws Exception if processing fails
     */
    ProcessingResult process(JobDocument job) throws Exception;

    /**
     * Adapt an asynchronous handler. The worker waits for the returned stage to settle.
     */
    static JobProcessor async(Function<JobDocument, ? extends CompletionStage<?>> handler) {
        return job -> {
            try {
                handler.apply(job).toCompletableFuture().get();
                return ProcessingResult.success();
            } catch (ExecutionException | CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof Exception) {
                    throw (Exception) cause;
                }
                throw e;
            }
        };
    }

    /**
     * Result of job processing.
     */
    class ProcessingResult {
        private final boolean success;
        private final String message;

        private ProcessingResult(boolean success, String message) {
            this.success = success;
            this.message = message;
        }

        public boolean isSuccess() { return success; }
        public String getMessage() { return message; }

        public static ProcessingResult success() {
            return new ProcessingResult(true, null);
        }

        public static ProcessingResult failure(String message) {
            return new ProcessingResult(false, message);
        }
    }
}
