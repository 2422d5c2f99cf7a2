package io.bastion.core.ratelimit;

import io.bastion.core.event.Event;

import java.time.Duration;
import java.time.Instant;

/**
 * Published when a call is denied by a {@link RateLimiter}.
 *
 * @since 1.0.0
 */
public record RateLimitedEvent(
        String operationClass,
        String identifier,
        Duration retryAfter,
        Instant timestamp
) implements Event {
}
