package com.flagship.wager_escrow.wager.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wager_escrow.wager.WagerStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body of every failed API call.
 *
 * {@code reason} is the machine-readable code; {@code current_state} is only
 * present on state conflicts.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

    @JsonProperty("error")
    String error;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("message")
    String message;

    @JsonProperty("current_state")
    WagerStatus currentState;

    @JsonProperty("retryable")
    boolean retryable;

    @JsonProperty("details")
    Map<String, String> details;

    @JsonProperty("timestamp")
    Instant timestamp;
}
