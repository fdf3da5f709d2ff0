package com.argus.anomaly.dto;

import com.argus.anomaly.model.AlertRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class AlertView {
    Long id;
    Instant timestamp;
    @JsonProperty("alert_type")
    String alertType;
    String message;
    @JsonProperty("frame_filename")
    String frameFilename;
    Map<String, Object> details;
    @JsonProperty("created_at")
    Instant createdAt;
    String frameUrl;

    public static AlertView of(AlertRecord alert, String frameUrl) {
        return AlertView.builder()
                .id(alert.getId())
                .timestamp(alert.getTimestamp())
                .alertType(alert.getAlertType())
                .message(alert.getMessage())
                .frameFilename(alert.getFrameStorageKey())
                .details(alert.getDetails())
                .createdAt(alert.getCreatedAt())
                .frameUrl(frameUrl)
                .build();
    }
}
