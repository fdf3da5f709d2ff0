package com.argus.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/** A validated anomaly report produced by the detection worker. */
@Value
@Builder
public class DetectionOutput {
    String alertType;
    String message;
    String frameKey;
    Map<String, Object> details;
}
