package com.give.payout.api.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.give.payout.domain.exception.ErrorCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Error body returned by every endpoint
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private String errorCode;
    private ErrorCategory category;
    private boolean retryable;
    private String message;
    private int status;
    private Instant timestamp;
    private String path;
}
