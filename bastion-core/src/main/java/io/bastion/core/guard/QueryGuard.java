package io.bastion.core.guard;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.bastion.core.event.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.text.Normalizer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Screens free-form query text for injection signatures before it reaches a
 * data store.
 *
 * <p>Checks run in a fixed order and the first failure wins:</p>
 * <ol>
 *   <li>{@code null-input} for a null text</li>
 *   <li>{@code oversized-input} for text longer than {@code maxTextLength}</li>
 *   <li>{@code control-character} for control characters other than tab, LF and CR</li>
 *   <li>each {@link ValidationRule} in order, against the raw text and its NFKC form</li>
 *   <li>{@code excessive-complexity} when {@link #complexity(String, int)} exceeds {@code maxComplexity}</li>
 * </ol>
 *
 * <p>Rules are data. The default set is read from
 * {@value #DEFAULT_RULES_RESOURCE} on the classpath; each element is
 * {@code {"label": ..., "pattern": ..., "flags": [...]}} where {@code flags}
 * names {@link Pattern} constants and defaults to case-insensitive matching.</p>
 *
 * <p>Rejections are logged by label only. The text itself is never logged
 * nor placed in exception messages.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * QueryGuard guard = QueryGuard.defaults();
 *
 * guard.validate(searchText);             // throws InjectionDetectedException
 * GuardVerdict verdict = guard.inspect(searchText);
 * }</pre>
 *
 * @since 1.0.0
 */
public class QueryGuard {

    private static final Logger log = LoggerFactory.getLogger(QueryGuard.class);

    public static final String DEFAULT_RULES_RESOURCE = "bastion/injection-patterns.json";
    public static final int DEFAULT_MAX_TEXT_LENGTH = 4096;

    public static final String NULL_INPUT = "null-input";
    public static final String OVERSIZED_INPUT = "oversized-input";
    public static final String CONTROL_CHARACTER = "control-character";
    public static final String EXCESSIVE_COMPLEXITY = "excessive-complexity";

    /** Default complexity ceiling, roughly a thousand words of query text. */
    public static final int DEFAULT_MAX_COMPLEXITY = 1000;

    private static final Pattern JOIN = Pattern.compile("JOIN", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHERE = Pattern.compile("WHERE", Pattern.CASE_INSENSITIVE);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Map<String, Integer> FLAG_NAMES = Map.of(
            "CASE_INSENSITIVE", Pattern.CASE_INSENSITIVE,
            "UNICODE_CASE", Pattern.UNICODE_CASE,
            "MULTILINE", Pattern.MULTILINE,
            "DOTALL", Pattern.DOTALL,
            "COMMENTS", Pattern.COMMENTS,
            "LITERAL", Pattern.LITERAL);

    private final List<ValidationRule> rules;
    private final int maxTextLength;
    private final int maxComplexity;
    private final EventBus eventBus;
    private final Clock clock;
    private final LongAdder rejected = new LongAdder();
    private final LongAdder inspected = new LongAdder();

    private QueryGuard(Builder builder) {
        this.rules = List.copyOf(builder.rules);
        this.maxTextLength = builder.maxTextLength;
        this.maxComplexity = builder.maxComplexity;
        this.eventBus = builder.eventBus;
        this.clock = builder.clock;
    }

    /**
     * Creates a guard with the bundled rule set and default limits.
     * @return new guard
     */
    public static QueryGuard defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Validates query text, throwing on the first failed check.
     *
     * @param text the text to screen
     * @throws InjectionDetectedException if any check fails
     */
    public void validate(String text) {
        inspect(text).orThrow();
    }

    /**
     * Validates query text bound to {@code parameterCount} parameters.
     *
     * @param text the text to screen
     * @param parameterCount number of bound parameters, counted towards complexity
     * @throws InjectionDetectedException if any check fails
     */
    public void validate(String text, int parameterCount) {
        inspect(text, parameterCount).orThrow();
    }

    /**
     * Screens query text and returns a verdict instead of throwing.
     *
     * @param text the text to screen, may be null
     * @return the verdict
     */
    public GuardVerdict inspect(String text) {
        return inspect(text, 0);
    }

    /**
     * Screens query text bound to {@code parameterCount} parameters.
     *
     * @param text the text to screen, may be null
     * @param parameterCount number of bound parameters, not negative
     * @return the verdict
     */
    public GuardVerdict inspect(String text, int parameterCount) {
        if (parameterCount < 0) {
            throw new IllegalArgumentException("parameterCount must not be negative");
        }
        inspected.increment();
        String label = firstFailure(text, parameterCount);
        if (label == null) {
            return GuardVerdict.ACCEPTED;
        }
        rejected.increment();
        log.warn("[BASTION] Query text rejected by rule '{}'", label);
        eventBus.publish(new InjectionDetectedEvent(label, clock.instant()));
        return GuardVerdict.rejected(label);
    }

    private String firstFailure(String text, int parameterCount) {
        if (text == null) {
            return NULL_INPUT;
        }
        if (text.length() > maxTextLength) {
            return OVERSIZED_INPUT;
        }
        if (containsControlCharacter(text)) {
            return CONTROL_CHARACTER;
        }
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFKC);
        boolean differs = !normalized.equals(text);
        for (ValidationRule rule : rules) {
            if (rule.matches(text) || (differs && rule.matches(normalized))) {
                return rule.label();
            }
        }
        if (complexity(text, parameterCount) > maxComplexity) {
            return EXCESSIVE_COMPLEXITY;
        }
        return null;
    }

    /**
     * Scores how expensive query text is likely to be: one point per
     * whitespace-separated token, ten per {@code JOIN}, five per {@code WHERE}
     * and two per bound parameter. Keywords are counted case-insensitively,
     * wherever they occur.
     *
     * @param text query text, not null
     * @param parameterCount number of bound parameters
     * @return complexity score
     */
    public static int complexity(String text, int parameterCount) {
        Objects.requireNonNull(text, "text must not be null");
        long score = countTokens(text)
                + 10L * count(JOIN, text)
                + 5L * count(WHERE, text)
                + 2L * parameterCount;
        return (int) Math.min(Integer.MAX_VALUE, score);
    }

    private static int countTokens(String text) {
        int tokens = 0;
        boolean inToken = false;
        for (int i = 0; i < text.length(); i++) {
            boolean space = Character.isWhitespace(text.charAt(i));
            if (!space && !inToken) {
                tokens++;
            }
            inToken = !space;
        }
        return tokens;
    }

    private static int count(Pattern keyword, String text) {
        int found = 0;
        Matcher matcher = keyword.matcher(text);
        while (matcher.find()) {
            found++;
        }
        return found;
    }

    static boolean containsControlCharacter(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\t' || c == '\n' || c == '\r') {
                continue;
            }
            if (c < 0x20 || (c >= 0x7F && c <= 0x9F)) {
                return true;
            }
        }
        return false;
    }

    public long rejectedCount() {
        return rejected.sum();
    }

    public long inspectedCount() {
        return inspected.sum();
    }

    public int ruleCount() {
        return rules.size();
    }

    public int maxTextLength() {
        return maxTextLength;
    }

    public int maxComplexity() {
        return maxComplexity;
    }

    public List<ValidationRule> rules() {
        return rules;
    }

    // ==================== Rule loading ====================

    /**
     * Loads a rule set from a classpath resource.
     *
     * @param resource resource path, without a leading slash
     * @return the compiled rules
     * @throws GuardConfigurationException if the resource is missing or malformed
     */
    public static List<ValidationRule> loadRules(String resource) {
        ClassLoader loader = QueryGuard.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new GuardConfigurationException("Rule resource not found: " + resource);
            }
            return loadRules(in);
        } catch (IOException e) {
            throw new GuardConfigurationException("Failed to read rule resource: " + resource, e);
        }
    }

    /**
     * Loads a rule set from a JSON array.
     *
     * @param in the JSON stream, not closed by this method
     * @return the compiled rules
     * @throws GuardConfigurationException if the document is malformed or a pattern does not compile
     */
    public static List<ValidationRule> loadRules(InputStream in) {
        JsonNode root;
        try {
            root = MAPPER.readTree(in);
        } catch (JsonProcessingException e) {
            throw new GuardConfigurationException("Rule document is not valid JSON", e);
        } catch (IOException e) {
            throw new GuardConfigurationException("Failed to read rule document", e);
        }
        if (root == null || !root.isArray()) {
            throw new GuardConfigurationException("Rule document must be a JSON array");
        }

        List<ValidationRule> loaded = new ArrayList<>(root.size());
        int index = 0;
        for (JsonNode node : root) {
            loaded.add(toRule(node, index++));
        }
        return loaded;
    }

    private static ValidationRule toRule(JsonNode node, int index) {
        JsonNode label = node.get("label");
        JsonNode pattern = node.get("pattern");
        if (label == null || !label.isTextual() || label.asText().isBlank()) {
            throw new GuardConfigurationException("Rule #" + index + " has no label");
        }
        if (pattern == null || !pattern.isTextual() || pattern.asText().isEmpty()) {
            throw new GuardConfigurationException("Rule '" + label.asText() + "' has no pattern");
        }
        return ValidationRule.of(label.asText(), pattern.asText(), flagsOf(node.get("flags"), label.asText()));
    }

    private static int flagsOf(JsonNode flags, String label) {
        if (flags == null || flags.isNull()) {
            return ValidationRule.DEFAULT_FLAGS;
        }
        if (!flags.isArray()) {
            throw new GuardConfigurationException("Rule '" + label + "' flags must be an array");
        }
        int bits = 0;
        for (JsonNode flag : flags) {
            Integer bit = FLAG_NAMES.get(flag.asText());
            if (bit == null) {
                throw new GuardConfigurationException(
                        "Rule '" + label + "' has unknown flag '" + flag.asText() + "'");
            }
            bits |= bit;
        }
        return bits;
    }

    /**
     * Builder for QueryGuard.
     */
    public static class Builder {
        private List<ValidationRule> rules;
        private int maxTextLength = DEFAULT_MAX_TEXT_LENGTH;
        private int maxComplexity = DEFAULT_MAX_COMPLEXITY;
        private EventBus eventBus;
        private Clock clock = Clock.systemUTC();

        /**
         * Replaces the rule set. Defaults to the bundled resource.
         *
         * @param rules rules in evaluation order
         * @return this builder
         */
        public Builder rules(List<ValidationRule> rules) {
            Objects.requireNonNull(rules, "rules must not be null");
            this.rules = new ArrayList<>(rules);
            return this;
        }

        public Builder rulesResource(String resource) {
            this.rules = loadRules(resource);
            return this;
        }

        public Builder rules(InputStream in) {
            this.rules = loadRules(in);
            return this;
        }

        public Builder maxTextLength(int maxTextLength) {
            if (maxTextLength <= 0) {
                throw new IllegalArgumentException("maxTextLength must be positive");
            }
            this.maxTextLength = maxTextLength;
            return this;
        }

        /**
         * Sets the complexity ceiling above which text is rejected.
         * @param maxComplexity positive ceiling
         * @return this builder
         */
        public Builder maxComplexity(int maxComplexity) {
            if (maxComplexity <= 0) {
                throw new IllegalArgumentException("maxComplexity must be positive");
            }
            this.maxComplexity = maxComplexity;
            return this;
        }

        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public QueryGuard build() {
            if (rules == null) {
                rules = loadRules(DEFAULT_RULES_RESOURCE);
            }
            if (eventBus == null) {
                eventBus = EventBus.create();
            }
            return new QueryGuard(this);
        }
    }
}
