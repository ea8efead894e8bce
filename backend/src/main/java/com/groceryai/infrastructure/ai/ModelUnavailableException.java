package com.groceryai.infrastructure.ai;

public class ModelUnavailableException extends ModelInvocationException {

    public ModelUnavailableException(String message, String errorCode, Throwable cause) {
        super(message, errorCode, cause);
    }
}
