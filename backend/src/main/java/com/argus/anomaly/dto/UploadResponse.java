package com.argus.anomaly.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UploadResponse {
    String message;
    @JsonProperty("anomaly_detected")
    boolean anomalyDetected;
    AlertView alert;
    /** Only set when the alert already existed for the reported frame. */
    Boolean duplicate;

    public static UploadResponse noAnomaly() {
        return new UploadResponse("Video processed successfully. No anomalies detected.", false, null, null);
    }

    public static UploadResponse created(AlertView alert) {
        return new UploadResponse("Anomaly detected and alert created!", true, alert, null);
    }

    public static UploadResponse alreadyRecorded(AlertView alert) {
        return new UploadResponse("Anomaly detected; an alert for this frame was already recorded.", true, alert, Boolean.TRUE);
    }
}
