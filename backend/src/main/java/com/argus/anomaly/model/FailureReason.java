package com.argus.anomaly.model;

public enum FailureReason {
    WORKER_STARTUP,
    TIMEOUT,
    WORKER_ERROR,
    CONTRACT_VIOLATION,
    PERSISTENCE_ERROR,
    UNEXPECTED
}
