package com.umitunal.cronq.worker;

/**
 * A job processor threw or reported failure.
 */
public class JobProcessingException extends Exception {
    private final String jobId;

    public JobProcessingException(String jobId, String message, Throwable cause) {
        super("Job " + jobId + " failed: " + message, cause);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
