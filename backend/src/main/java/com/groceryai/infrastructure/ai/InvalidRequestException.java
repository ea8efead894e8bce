package com.groceryai.infrastructure.ai;

/**
 * Caller input or model configuration that can never succeed. Never retried.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
