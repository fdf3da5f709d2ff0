package com.argus.anomaly.exception;

import com.argus.anomaly.model.FailureReason;

import java.time.Duration;

public class WorkerTimeoutException extends DetectionPipelineException {

    private final Duration timeout;

    public WorkerTimeoutException(Duration timeout) {
        super("Detection worker timed out and was terminated.",
                "Worker exceeded the configured timeout of " + timeout.toMillis() + " ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public FailureReason getFailureReason() {
        return FailureReason.TIMEOUT;
    }
}
