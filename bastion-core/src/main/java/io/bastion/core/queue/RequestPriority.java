package io.bastion.core.queue;

/**
 * Admission priority of a queued request. Declaration order is service order.
 *
 * @since 1.0.0
 */
public enum RequestPriority {
    HIGH,
    NORMAL,
    LOW
}
