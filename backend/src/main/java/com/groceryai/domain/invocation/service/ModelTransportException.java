package com.groceryai.domain.invocation.service;

import java.time.Duration;

/**
 * A provider-side failure of a single transport attempt.
 * Carries what the retry policy needs to classify it.
 */
public class ModelTransportException extends RuntimeException {

    private final String errorCode;
    private final int httpStatus;
    private final Duration retryAfter;

    public ModelTransportException(String message, String errorCode, int httpStatus, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
        this.retryAfter = retryAfter;
    }

    public ModelTransportException(String message, String errorCode, int httpStatus) {
        this(message, errorCode, httpStatus, null, null);
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * HTTP status of the failed call, 0 when no response was received.
     */
    public int getHttpStatus() {
        return httpStatus;
    }

    /**
     * Provider retry-after hint, or null.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
