package com.groceryai.infrastructure.ai;

public class InvocationCancelledException extends ModelInvocationException {

    public InvocationCancelledException(String message) {
        super(message);
    }
}
