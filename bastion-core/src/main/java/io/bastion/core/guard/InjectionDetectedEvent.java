package io.bastion.core.guard;

import io.bastion.core.event.Event;

import java.time.Instant;

/**
 * Published when a {@link QueryGuard} rejects query text. Carries the label only.
 *
 * @since 1.0.0
 */
public record InjectionDetectedEvent(String label, Instant timestamp) implements Event {
}
