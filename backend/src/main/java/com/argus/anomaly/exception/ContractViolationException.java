package com.argus.anomaly.exception;

import com.argus.anomaly.model.FailureReason;

/** Worker stdout carried a result line that failed validation. The detail is stdout verbatim. */
public class ContractViolationException extends DetectionPipelineException {

    private final String violation;

    public ContractViolationException(String violation, String rawOutput) {
        super("Detection worker output violated the result contract: " + violation, rawOutput);
        this.violation = violation;
    }

    public String getViolation() {
        return violation;
    }

    @Override
    public FailureReason getFailureReason() {
        return FailureReason.CONTRACT_VIOLATION;
    }
}
