package io.github.cyfko.formulalint.core.config;

/**
 * Limits applied while parsing formulas and building suggestions.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxFormulaLength</strong>: Maximum character length of a formula (default: 5000)</li>
 *   <li><strong>maxNestingDepth</strong>: Maximum nesting of formula bodies, parenthesized arguments
 *       and function-style parameters (default: 32)</li>
 *   <li><strong>maxSuggestionDistance</strong>: Maximum edit distance of a "did you mean" suggestion (default: 3)</li>
 *   <li><strong>maxSuggestions</strong>: Maximum number of suggestions per diagnostic (default: 3)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (hand-authored mod files)
 * FormulaPolicy policy = FormulaPolicy.defaults();
 *
 * // Strict (formulas coming from an untrusted web form)
 * FormulaPolicy policy = FormulaPolicy.strict();
 *
 * // Relaxed (generated content)
 * FormulaPolicy policy = FormulaPolicy.relaxed();
 *
 * // Custom
 * FormulaPolicy policy = FormulaPolicy.builder()
 *     .maxNestingDepth(8)
 *     .build();
 * }</pre>
 *
 * @param policyName            name of the policy, used in error messages
 * @param maxFormulaLength      maximum character length of a formula
 * @param maxNestingDepth       maximum nesting depth of sub-formulas
 * @param maxSuggestionDistance maximum edit distance for suggestions
 * @param maxSuggestions        maximum number of suggestions per diagnostic
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FormulaPolicy(
    String policyName,
    int maxFormulaLength,
    int maxNestingDepth,
    int maxSuggestionDistance,
    int maxSuggestions
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public FormulaPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxFormulaLength <= 0) {
            throw new IllegalArgumentException("maxFormulaLength must be positive, got: " + maxFormulaLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        if (maxSuggestionDistance < 0) {
            throw new IllegalArgumentException("maxSuggestionDistance must not be negative, got: " + maxSuggestionDistance);
        }
        if (maxSuggestions < 0) {
            throw new IllegalArgumentException("maxSuggestions must not be negative, got: " + maxSuggestions);
        }
    }

    /**
     * Default configuration, suitable for hand-authored mod files.
     * <ul>
     *   <li>Max Formula Length: 5000 characters</li>
     *   <li>Max Nesting Depth: 32</li>
     *   <li>Suggestions: 3 at most, within 3 edits</li>
     * </ul>
     *
     * @return default configuration
     */
    public static FormulaPolicy defaults() {
        return new FormulaPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 32, 3, 3);
    }

    /**
     * Strict configuration for formulas coming from untrusted sources.
     * <ul>
     *   <li>Max Formula Length: 1000 characters</li>
     *   <li>Max Nesting Depth: 16</li>
     *   <li>Suggestions: 3 at most, within 2 edits</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static FormulaPolicy strict() {
        return new FormulaPolicy(PolicyName.STRICT_POLICY.name(), 1000, 16, 2, 3);
    }

    /**
     * Relaxed configuration for generated or bulk content.
     * <ul>
     *   <li>Max Formula Length: 20000 characters</li>
     *   <li>Max Nesting Depth: 128</li>
     *   <li>Suggestions: 5 at most, within 3 edits</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static FormulaPolicy relaxed() {
        return new FormulaPolicy(PolicyName.RELAXED_POLICY.name(), 20000, 128, 3, 5);
    }

    /**
     * Creates a custom configuration. Builder parameters start from the default values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxFormulaLength = 5000;
        private int _maxNestingDepth = 32;
        private int _maxSuggestionDistance = 3;
        private int _maxSuggestions = 3;

        private Builder() {}

        public FormulaPolicy build() {
            return new FormulaPolicy(_policyName, _maxFormulaLength, _maxNestingDepth, _maxSuggestionDistance, _maxSuggestions);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxFormulaLength(int maxFormulaLength) { this._maxFormulaLength = maxFormulaLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
        public Builder maxSuggestionDistance(int maxSuggestionDistance) { this._maxSuggestionDistance = maxSuggestionDistance; return this; }
        public Builder maxSuggestions(int maxSuggestions) { this._maxSuggestions = maxSuggestions; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
