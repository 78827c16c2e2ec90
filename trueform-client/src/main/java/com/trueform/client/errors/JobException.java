package com.trueform.client.errors;

import lombok.Getter;

/**
 * A polled job ended badly or never ended.
 */
@Getter
public class JobException extends TrueNasException {

    public enum Reason {
        FAILED,
        ABORTED,
        TIMEOUT,
        NOT_FOUND
    }

    private final long jobId;
    private final Reason reason;

    private JobException(long jobId, Reason reason, String message) {
        super(message);
        this.jobId = jobId;
        this.reason = reason;
    }

    public static JobException failed(long jobId, String error) {
        return new JobException(jobId, Reason.FAILED, "job " + jobId + " failed: " + error);
    }

    public static JobException aborted(long jobId) {
        return new JobException(jobId, Reason.ABORTED, "job " + jobId + " was aborted");
    }

    public static JobException timeout(long jobId) {
        return new JobException(jobId, Reason.TIMEOUT, "timeout waiting for job " + jobId + " to complete");
    }

    public static JobException notFound(long jobId) {
        return new JobException(jobId, Reason.NOT_FOUND, "job " + jobId + " not found");
    }
}
