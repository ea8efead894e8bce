package com.groceryai.infrastructure.ai;

import java.time.Duration;

public class RateLimitException extends ModelInvocationException {

    public RateLimitException(String message, String errorCode, Duration retryAfter, Throwable cause) {
        super(message, errorCode, retryAfter, cause);
    }
}
