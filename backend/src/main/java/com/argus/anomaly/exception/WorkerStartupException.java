package com.argus.anomaly.exception;

import com.argus.anomaly.model.FailureReason;

public class WorkerStartupException extends DetectionPipelineException {

    public WorkerStartupException(String message, Throwable cause) {
        super(message, cause != null ? cause.getMessage() : null, cause);
    }

    public WorkerStartupException(String message) {
        super(message, null);
    }

    @Override
    public FailureReason getFailureReason() {
        return FailureReason.WORKER_STARTUP;
    }
}
