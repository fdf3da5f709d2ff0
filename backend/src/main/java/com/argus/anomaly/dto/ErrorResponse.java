package com.argus.anomaly.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    String error;
    String details;
    /** Present only when stack traces are exposed for development. */
    String stack;
}
