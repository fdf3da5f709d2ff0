package com.argus.anomaly.model;

import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.time.Instant;
import java.util.UUID;

/**
 * One staged upload travelling through the detection pipeline.
 * <p>
 * Created by the ingestion gateway in {@link JobState#RECEIVED}; every later transition is made by
 * the orchestrator. The scratch file belongs to the job until it reaches {@link JobState#CLEANED}.
 */
@Getter
@ToString
public class UploadJob {

    private final UUID id;
    private final Path scratchPath;
    private final String originalFilename;
    private final Instant receivedAt;

    private JobState state = JobState.RECEIVED;
    private JobState terminalState;
    private FailureReason failureReason;

    public UploadJob(UUID id, Path scratchPath, String originalFilename, Instant receivedAt) {
        this.id = id;
        this.scratchPath = scratchPath;
        this.originalFilename = originalFilename;
        this.receivedAt = receivedAt;
    }

    public synchronized JobState getState() {
        return state;
    }

    public synchronized JobState getTerminalState() {
        return terminalState;
    }

    public synchronized FailureReason getFailureReason() {
        return failureReason;
    }

    public synchronized void startProcessing() {
        require(JobState.RECEIVED, JobState.PROCESSING);
        state = JobState.PROCESSING;
    }

    public synchronized void complete(boolean anomalyDetected) {
        JobState next = anomalyDetected ? JobState.ANOMALY_DETECTED : JobState.NO_ANOMALY;
        require(JobState.PROCESSING, next);
        state = next;
        terminalState = next;
    }

    /** Allowed from any non-terminal state, so a job that never reached the worker can still fail. */
    public synchronized void fail(FailureReason reason) {
        if (state != JobState.RECEIVED && state != JobState.PROCESSING) {
            throw new IllegalStateException("Job " + id + " cannot fail from state " + state);
        }
        state = JobState.FAILED;
        terminalState = JobState.FAILED;
        failureReason = reason;
    }

    public synchronized void markCleaned() {
        if (!state.isTerminal()) {
            throw new IllegalStateException("Job " + id + " cannot be cleaned from state " + state);
        }
        state = JobState.CLEANED;
    }

    private void require(JobState expected, JobState next) {
        if (state != expected) {
            throw new IllegalStateException("Job " + id + " cannot move from " + state + " to " + next);
        }
    }
}
