package io.bastion.core.ratelimit;

import java.time.Duration;

/**
 * Thrown by {@link RateLimiter#acquire} when the operation is throttled.
 *
 * <p>Recoverable: callers map it to a "too many requests" response and retry
 * after {@link #getRetryAfter()}.</p>
 *
 * @since 1.0.0
 */
public class RateLimitedException extends RuntimeException {

    private final String operationClass;
    private final Duration retryAfter;

    public RateLimitedException(String operationClass, Duration retryAfter) {
        super("Rate limit exceeded for '" + operationClass + "', retry after " + retryAfter.toMillis() + "ms");
        this.operationClass = operationClass;
        this.retryAfter = retryAfter;
    }

    public String getOperationClass() {
        return operationClass;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
