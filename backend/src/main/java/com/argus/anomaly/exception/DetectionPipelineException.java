package com.argus.anomaly.exception;

import com.argus.anomaly.model.FailureReason;
import org.springframework.http.HttpStatus;

/**
 * Base of every failure the upload pipeline reports to its caller.
 * <p>
 * {@link #getDetail()} carries operator-facing diagnostics (worker stderr, raw stdout, ...)
 * and is returned in the error body; stack traces are not.
 */
public abstract class DetectionPipelineException extends RuntimeException {

    private final String detail;

    protected DetectionPipelineException(String message, String detail) {
        super(message);
        this.detail = detail;
    }

    protected DetectionPipelineException(String message, String detail, Throwable cause) {
        super(message, cause);
        this.detail = detail;
    }

    public String getDetail() {
        return detail;
    }

    public HttpStatus getStatus() {
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    /** The job failure this exception corresponds to, or null when no job was created. */
    public abstract FailureReason getFailureReason();
}
