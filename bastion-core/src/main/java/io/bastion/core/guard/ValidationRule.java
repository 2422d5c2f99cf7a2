package io.bastion.core.guard;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One injection signature: a compiled pattern and the label reported when it matches.
 *
 * <p>Immutable; a rule set is shared read-only by every {@link QueryGuard} call.</p>
 *
 * @since 1.0.0
 */
public record ValidationRule(String label, Pattern pattern) {

    /** Flags applied when a rule does not specify any. */
    public static final int DEFAULT_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    public ValidationRule {
        Objects.requireNonNull(pattern, "pattern must not be null");
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label must not be blank");
        }
    }

    /**
     * Compiles a rule with the default case-insensitive flags.
     *
     * @param label label reported on match
     * @param regex the signature
     * @return the rule
     * @throws GuardConfigurationException if the regex does not compile
     */
    public static ValidationRule of(String label, String regex) {
        return of(label, regex, DEFAULT_FLAGS);
    }

    /**
     * Compiles a rule with explicit {@link Pattern} flags.
     *
     * @param label label reported on match
     * @param regex the signature
     * @param flags pattern flags
     * @return the rule
     * @throws GuardConfigurationException if the regex does not compile
     */
    public static ValidationRule of(String label, String regex, int flags) {
        try {
            return new ValidationRule(label, Pattern.compile(regex, flags));
        } catch (PatternSyntaxException e) {
            throw new GuardConfigurationException("Rule '" + label + "' has an invalid pattern", e);
        }
    }

    /**
     * Returns true if the signature occurs anywhere in the text.
     * @param text text to scan
     * @return true on match
     */
    public boolean matches(CharSequence text) {
        return pattern.matcher(text).find();
    }
}
