package io.bastion.core.key;

/**
 * Thrown when a key part cannot be brought into canonical form.
 *
 * <p>Recoverable: callers should skip caching for keys that cannot be encoded.</p>
 *
 * @since 1.0.0
 */
public class KeyEncodingException extends RuntimeException {

    public KeyEncodingException(String message) {
        super(message);
    }

    public KeyEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
