package com.groceryai.infrastructure.ai;

import java.time.Duration;

/**
 * Base failure of a model invocation. Carries the provider error code when there is one.
 */
public class ModelInvocationException extends RuntimeException {

    private final String errorCode;
    private final Duration retryAfter;

    public ModelInvocationException(String message) {
        this(message, null, null, null);
    }

    public ModelInvocationException(String message, String errorCode, Throwable cause) {
        this(message, errorCode, null, cause);
    }

    public ModelInvocationException(String message, String errorCode, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryAfter = retryAfter;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
