package io.bastion.core.guard;

import java.util.Optional;

/**
 * Result of {@link QueryGuard#inspect}: accepted, or rejected with the matching label.
 *
 * @since 1.0.0
 */
public record GuardVerdict(boolean accepted, String label) {

    public static final GuardVerdict ACCEPTED = new GuardVerdict(true, null);

    static GuardVerdict rejected(String label) {
        return new GuardVerdict(false, label);
    }

    public boolean rejected() {
        return !accepted;
    }

    public Optional<String> rejectionLabel() {
        return Optional.ofNullable(label);
    }

    /**
     * Converts a rejection into an exception.
     *
     * @throws InjectionDetectedException if this verdict is a rejection
     */
    public void orThrow() {
        if (!accepted) {
            throw new InjectionDetectedException(label);
        }
    }
}
