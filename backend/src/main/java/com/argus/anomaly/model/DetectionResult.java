package com.argus.anomaly.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Interpretation of a finished worker's stdout. Exactly one of the three kinds:
 * <ul>
 *   <li>{@link Kind#NO_DETECTION}: no JSON line was printed, nothing else is set</li>
 *   <li>{@link Kind#DETECTED}: {@link #getPayload()} holds the validated report</li>
 *   <li>{@link Kind#CONTRACT_VIOLATION}: {@link #getRawOutput()} holds stdout verbatim and
 *       {@link #getViolation()} says what was wrong with it</li>
 * </ul>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DetectionResult {

    public enum Kind {
        NO_DETECTION,
        DETECTED,
        CONTRACT_VIOLATION
    }

    private static final DetectionResult NONE = new DetectionResult(Kind.NO_DETECTION, null, null, null);

    Kind kind;
    DetectionOutput payload;
    String rawOutput;
    String violation;

    public static DetectionResult noDetection() {
        return NONE;
    }

    public static DetectionResult detected(DetectionOutput payload) {
        return new DetectionResult(Kind.DETECTED, payload, null, null);
    }

    public static DetectionResult contractViolation(String rawOutput, String violation) {
        return new DetectionResult(Kind.CONTRACT_VIOLATION, null, rawOutput, violation);
    }
}
