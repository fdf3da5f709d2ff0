package com.argus.anomaly.exception;

import com.argus.anomaly.model.FailureReason;

/** Alert could not be stored. Not retried here; the caller may resubmit. */
public class PersistenceException extends DetectionPipelineException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause != null ? cause.getClass().getSimpleName() : null, cause);
    }

    @Override
    public FailureReason getFailureReason() {
        return FailureReason.PERSISTENCE_ERROR;
    }
}
