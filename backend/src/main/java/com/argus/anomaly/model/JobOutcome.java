package com.argus.anomaly.model;

import lombok.Value;

import java.util.UUID;

/** Successful end of a job: either nothing was found, or an alert exists for the reported frame. */
@Value
public class JobOutcome {
    UUID jobId;
    boolean anomalyDetected;
    AlertRecord alert;
    /** True when the alert already existed for this frame key and no row was inserted. */
    boolean duplicate;

    public static JobOutcome noAnomaly(UUID jobId) {
        return new JobOutcome(jobId, false, null, false);
    }

    public static JobOutcome recorded(UUID jobId, AlertRecord alert, boolean duplicate) {
        return new JobOutcome(jobId, true, alert, duplicate);
    }
}
