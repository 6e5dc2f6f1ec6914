package io.github.cyfko.truthtable.core.config;

import java.util.Locale;

/**
 * Resource limits applied while parsing an expression and building its truth table.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: Maximum character length of the expression text (default: 5000)</li>
 *   <li><strong>maxVariables</strong>: Maximum number of distinct variables, the table holds 2^n rows (default: 20)</li>
 *   <li><strong>maxNestingDepth</strong>: Maximum depth of parentheses and NOT chains (default: 256)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * TruthTablePolicy policy = TruthTablePolicy.defaults();
 *
 * // Strict (for untrusted input)
 * TruthTablePolicy policy = TruthTablePolicy.strict();
 *
 * // Relaxed (for large offline tables)
 * TruthTablePolicy policy = TruthTablePolicy.relaxed();
 *
 * // Custom
 * TruthTablePolicy policy = TruthTablePolicy.builder()
 *     .maxVariables(8)
 *     .build();
 * }</pre>
 *
 * @param policyName          name reported in limit violation messages
 * @param maxExpressionLength maximum character length of the expression string
 * @param maxVariables        maximum number of distinct variables
 * @param maxNestingDepth     maximum nesting depth accepted by the parser
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TruthTablePolicy(
        String policyName,
        int maxExpressionLength,
        int maxVariables,
        int maxNestingDepth
) {

    /**
     * Upper bound for {@link #maxVariables()}: a table keeps its {@code 2^n} rows in a single list.
     */
    public static final int VARIABLES_HARD_LIMIT = 30;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public TruthTablePolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxVariables <= 0 || maxVariables > VARIABLES_HARD_LIMIT) {
            throw new IllegalArgumentException(String.format(
                    "maxVariables must be between 1 and %d, got: %d", VARIABLES_HARD_LIMIT, maxVariables));
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Expression Length: 5000 characters</li>
     *   <li>Max Variables: 20 (1 048 576 rows)</li>
     *   <li>Max Nesting Depth: 256</li>
     * </ul>
     *
     * @return default configuration
     */
    public static TruthTablePolicy defaults() {
        return new TruthTablePolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 20, 256);
    }

    /**
     * Strict configuration for untrusted input.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     *   <li>Max Variables: 16</li>
     *   <li>Max Nesting Depth: 64</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static TruthTablePolicy strict() {
        return new TruthTablePolicy(PolicyName.STRICT_POLICY.name(), 1000, 16, 64);
    }

    /**
     * Relaxed configuration for trusted, offline use.
     * <ul>
     *   <li>Max Expression Length: 10000 characters</li>
     *   <li>Max Variables: 24</li>
     *   <li>Max Nesting Depth: 1024</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static TruthTablePolicy relaxed() {
        return new TruthTablePolicy(PolicyName.RELAXED_POLICY.name(), 10000, 24, 1024);
    }

    /**
     * Resolves a preset by its short name ({@code default}, {@code strict} or {@code relaxed}), case-insensitive.
     *
     * @param name the preset name
     * @return the matching preset
     * @throws IllegalArgumentException if no preset has that name
     */
    public static TruthTablePolicy named(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Policy name is required");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "default", "defaults" -> defaults();
            case "strict" -> strict();
            case "relaxed" -> relaxed();
            default -> throw new IllegalArgumentException(
                    "Unknown policy '" + name + "'. Expected one of: default, strict, relaxed");
        };
    }

    /**
     * Creates a custom configuration.
     * <p>
     * Builder parameters are initialized exactly as in {@link #defaults()}.
     * </p>
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-filled with this policy's limits, renamed as a custom policy.
     *
     * @return a builder copying this policy
     */
    public Builder toBuilder() {
        return new Builder()
                .maxExpressionLength(maxExpressionLength)
                .maxVariables(maxVariables)
                .maxNestingDepth(maxNestingDepth);
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;
        private int _maxVariables = 20;
        private int _maxNestingDepth = 256;

        private Builder() {}

        public TruthTablePolicy build() {
            return new TruthTablePolicy(_policyName, _maxExpressionLength, _maxVariables, _maxNestingDepth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxVariables(int maxVariables) { this._maxVariables = maxVariables; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
