package io.bastion.core.guard;

/**
 * Thrown when a rule set cannot be loaded or compiled.
 *
 * @since 1.0.0
 */
public class GuardConfigurationException extends RuntimeException {

    public GuardConfigurationException(String message) {
        super(message);
    }

    public GuardConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
