package io.bastion.core.ratelimit;

/**
 * Per-identifier throttling of repeated operations.
 *
 * <p>Identifiers are typically a caller id (user, API key, remote address).
 * Operation classes ("login", "generate", "export") select the policy; calls
 * without one use {@link #DEFAULT_OPERATION_CLASS}.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * RateDecision decision = rateLimiter.allow("generate", userId);
 * if (decision.denied()) {
 *     return tooManyRequests(decision.retryAfter());
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public interface RateLimiter {

    /** Operation class used by {@link #allow(String)}. */
    String DEFAULT_OPERATION_CLASS = "default";

    /**
     * Records one operation for the identifier under the default policy.
     *
     * @param identifier caller identifier
     * @return the decision
     */
    default RateDecision allow(String identifier) {
        return allow(DEFAULT_OPERATION_CLASS, identifier);
    }

    /**
     * Records one operation for the identifier under the operation class's policy.
     *
     * @param operationClass operation class selecting the policy
     * @param identifier caller identifier
     * @return the decision
     */
    RateDecision allow(String operationClass, String identifier);

    /**
     * Like {@link #allow(String, String)} but throws on denial.
     *
     * @param operationClass operation class selecting the policy
     * @param identifier caller identifier
     * @throws RateLimitedException if the operation is throttled
     */
    default void acquire(String operationClass, String identifier) {
        RateDecision decision = allow(operationClass, identifier);
        if (decision.denied()) {
            throw new RateLimitedException(operationClass, decision.retryAfter());
        }
    }

    /**
     * Returns how many operations remain in the identifier's current window
     * without consuming one.
     *
     * @param operationClass operation class selecting the policy
     * @param identifier caller identifier
     * @return remaining operations
     */
    long remaining(String operationClass, String identifier);

    /**
     * Returns the policy applied to an operation class.
     *
     * @param operationClass operation class
     * @return the override, or the default policy
     */
    RatePolicy policyFor(String operationClass);

    /**
     * Returns the number of identifier windows currently tracked.
     * @return tracked windows
     */
    long trackedWindows();

    /**
     * Returns the number of denied calls since creation.
     * @return denied count
     */
    long deniedCount();
}
