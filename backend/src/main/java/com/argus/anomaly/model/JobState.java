package com.argus.anomaly.model;

public enum JobState {
    RECEIVED,
    PROCESSING,
    NO_ANOMALY,
    ANOMALY_DETECTED,
    FAILED,
    CLEANED;

    public boolean isTerminal() {
        return this == NO_ANOMALY || this == ANOMALY_DETECTED || this == FAILED;
    }
}
