package com.argus.anomaly.exception;

import com.argus.anomaly.model.FailureReason;
import org.springframework.http.HttpStatus;

/** Upload rejected before any worker was spawned or any row written. */
public class ValidationException extends DetectionPipelineException {

    private final HttpStatus status;

    public ValidationException(String message) {
        this(message, null, HttpStatus.BAD_REQUEST, null);
    }

    private ValidationException(String message, String detail, HttpStatus status, Throwable cause) {
        super(message, detail, cause);
        this.status = status;
    }

    /** The payload was acceptable but could not be written to scratch storage. */
    public static ValidationException stagingFailed(String detail, Throwable cause) {
        return new ValidationException("Could not stage uploaded file.", detail, HttpStatus.INTERNAL_SERVER_ERROR, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return status;
    }

    @Override
    public FailureReason getFailureReason() {
        return null;
    }
}
