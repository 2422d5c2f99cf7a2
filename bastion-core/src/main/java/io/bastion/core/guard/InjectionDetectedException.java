package io.bastion.core.guard;

/**
 * Thrown when query text matches an injection signature.
 *
 * <p>The calling operation must be aborted. The message carries only the rule
 * label, never the offending text, so it is safe to log.</p>
 *
 * @since 1.0.0
 */
public class InjectionDetectedException extends RuntimeException {

    private final String label;

    public InjectionDetectedException(String label) {
        super("Query text rejected by rule '" + label + "'");
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
