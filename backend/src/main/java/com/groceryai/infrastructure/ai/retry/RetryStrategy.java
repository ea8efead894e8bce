package com.groceryai.infrastructure.ai.retry;

import com.groceryai.domain.invocation.service.ModelTransportException;
import com.groceryai.infrastructure.ai.InvocationCancelledException;
import com.groceryai.infrastructure.ai.RateLimitException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with optional jitter for transient provider failures.
 * <p>
 * Delay for retry {@code i} (0-based) is {@code min(base * 2^i, max)}, with ±25% uniform jitter
 * when enabled. A provider retry-after hint replaces the computed delay.
 */
@Slf4j
public class RetryStrategy {

    static final Set<String> RETRYABLE_ERROR_CODES = Set.of(
            "ThrottlingException",
            "ServiceUnavailableException",
            "ModelStreamErrorException",
            "InternalServerException",
            "ModelTimeoutException",
            "ModelErrorException",
            "RequestTimeout"
    );

    static final Set<Integer> RETRYABLE_STATUS_CODES = Set.of(429, 500, 502, 503, 504);

    private static final double JITTER_RATIO = 0.25;

    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final boolean jitter;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public RetryStrategy(int maxRetries, Duration baseDelay, Duration maxDelay, boolean jitter) {
        this(maxRetries, baseDelay, maxDelay, jitter, Sleeper.THREAD, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random supplies uniform values in [0, 1) for jitter
     */
    public RetryStrategy(int maxRetries, Duration baseDelay, Duration maxDelay, boolean jitter,
                         Sleeper sleeper, DoubleSupplier random) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
        this.sleeper = sleeper;
        this.random = random;
    }

    /**
     * @param error   the failure of the attempt
     * @param attempt number of retries already performed
     */
    public boolean shouldRetry(Throwable error, int attempt) {
        if (attempt >= maxRetries) {
            return false;
        }
        if (error instanceof RateLimitException) {
            return true;
        }
        if (error instanceof ModelTransportException e) {
            return (e.getErrorCode() != null && RETRYABLE_ERROR_CODES.contains(e.getErrorCode()))
                    || RETRYABLE_STATUS_CODES.contains(e.getHttpStatus());
        }
        return false;
    }

    public Duration getDelay(int attempt, Duration retryAfter) {
        if (retryAfter != null) {
            return retryAfter.compareTo(maxDelay) > 0 ? maxDelay : retryAfter;
        }
        double exponential = baseDelay.toMillis() * Math.pow(2, attempt);
        double delayMs = Math.min(exponential, maxDelay.toMillis());
        if (jitter) {
            double jitterRange = delayMs * JITTER_RATIO;
            delayMs += (random.getAsDouble() * 2 - 1) * jitterRange;
        }
        return Duration.ofMillis(Math.max(0L, Math.round(delayMs)));
    }

    public Duration getDelay(int attempt) {
        return getDelay(attempt, null);
    }

    /**
     * Runs the operation, retrying transient failures. After exhaustion or a non-retryable
     * failure the original exception is rethrown unchanged.
     *
     * @throws InvocationCancelledException when the context is cancelled or its deadline
     *                                      would pass during a backoff sleep
     */
    public <T> T executeWithRetry(Callable<T> operation, RetryContext context) throws Exception {
        CancellationToken cancellation = context.getCancellation();
        int attempt = 0;
        while (true) {
            if (cancellation.isCancelled()) {
                throw new InvocationCancelledException("Invocation cancelled before attempt " + (attempt + 1));
            }
            try {
                return operation.call();
            } catch (Exception e) {
                if (!shouldRetry(e, attempt)) {
                    throw e;
                }
                Duration delay = getDelay(attempt, retryAfterOf(e));
                log.warn("Retry {}/{} after {}ms: {}", attempt + 1, maxRetries, delay.toMillis(), describe(e));

                if (cancellation.isCancelled() || cancellation.wouldExceedDeadline(delay)) {
                    throw new InvocationCancelledException(
                            "Invocation deadline reached after " + (attempt + 1) + " attempt(s)");
                }
                sleep(delay);
                attempt++;
                context.recordRetry();
            }
        }
    }

    private void sleep(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new InvocationCancelledException("Interrupted during retry backoff");
        }
    }

    private static Duration retryAfterOf(Exception e) {
        if (e instanceof ModelTransportException mte) {
            return mte.getRetryAfter();
        }
        if (e instanceof RateLimitException rle) {
            return rle.getRetryAfter();
        }
        return null;
    }

    private static String describe(Exception e) {
        if (e instanceof ModelTransportException mte) {
            return mte.getErrorCode() + " (HTTP " + mte.getHttpStatus() + ")";
        }
        return e.getClass().getSimpleName();
    }
}
