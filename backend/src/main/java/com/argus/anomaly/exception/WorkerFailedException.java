package com.argus.anomaly.exception;

import com.argus.anomaly.model.FailureReason;

/** The worker ran but exited nonzero. The detail is its stderr. */
public class WorkerFailedException extends DetectionPipelineException {

    private final int exitCode;

    public WorkerFailedException(int exitCode, String stderr) {
        super("Video processing script failed.", describe(exitCode, stderr));
        this.exitCode = exitCode;
    }

    private static String describe(int exitCode, String stderr) {
        if (stderr == null || stderr.isBlank()) {
            return "Script exited with non-zero code (" + exitCode + ") but no specific stderr output.";
        }
        return stderr;
    }

    public int getExitCode() {
        return exitCode;
    }

    @Override
    public FailureReason getFailureReason() {
        return FailureReason.WORKER_ERROR;
    }
}
