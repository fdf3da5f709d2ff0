package com.argus.anomaly.model;

import lombok.Value;

@Value
public class AlertWriteResult {
    AlertRecord alert;
    /** False when the frame key was already recorded and the existing row is returned. */
    boolean created;

    public static AlertWriteResult created(AlertRecord alert) {
        return new AlertWriteResult(alert, true);
    }

    public static AlertWriteResult existing(AlertRecord alert) {
        return new AlertWriteResult(alert, false);
    }
}
