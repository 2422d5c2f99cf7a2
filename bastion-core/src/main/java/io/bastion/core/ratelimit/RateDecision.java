package io.bastion.core.ratelimit;

import java.time.Duration;

/**
 * Outcome of {@link RateLimiter#allow}. A denial is a normal value, not an error.
 *
 * @param allowed whether the operation may proceed
 * @param retryAfter time until the current window rolls over; zero when allowed
 * @param remaining operations still permitted in the current window
 * @param limit the limit of the policy that was applied
 *
 * @since 1.0.0
 */
public record RateDecision(boolean allowed, Duration retryAfter, long remaining, int limit) {

    static RateDecision allow(long remaining, int limit) {
        return new RateDecision(true, Duration.ZERO, remaining, limit);
    }

    static RateDecision deny(Duration retryAfter, int limit) {
        return new RateDecision(false, retryAfter, 0, limit);
    }

    public boolean denied() {
        return !allowed;
    }
}
