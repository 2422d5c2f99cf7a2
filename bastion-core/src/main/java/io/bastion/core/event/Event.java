package io.bastion.core.event;

import java.time.Instant;

/**
 * Marker interface for events published on {@link EventBus}.
 *
 * <p>Events are immutable records describing something that already happened
 * (an eviction, a denied request, a rejected query). They never carry cached
 * values or the offending query text.</p>
 *
 * @since 1.0.0
 */
public interface Event {

    /**
     * Returns the timestamp when the event occurred.
     * @return event time
     */
    Instant timestamp();
}
