package com.flagship.banking_ledger.api;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body of every failed request. {@code kind} is the stable identifier clients branch on;
 * {@code message} is for humans.
 */
@Value
@Builder
public class ApiError {
    String error;
    String kind;
    String message;
    Instant timestamp;
    Map<String, String> details;
}
