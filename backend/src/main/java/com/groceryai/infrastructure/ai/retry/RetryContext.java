package com.groceryai.infrastructure.ai.retry;

/**
 * Per-call retry state visible to the caller after the loop ends.
 */
public class RetryContext {

    private final CancellationToken cancellation;
    private int retryCount;

    public RetryContext(CancellationToken cancellation) {
        this.cancellation = cancellation == null ? CancellationToken.none() : cancellation;
    }

    public RetryContext() {
        this(CancellationToken.none());
    }

    public CancellationToken getCancellation() {
        return cancellation;
    }

    public int getRetryCount() {
        return retryCount;
    }

    void recordRetry() {
        retryCount++;
    }
}
