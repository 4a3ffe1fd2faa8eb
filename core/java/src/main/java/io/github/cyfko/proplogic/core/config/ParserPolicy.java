package io.github.cyfko.proplogic.core.config;

/**
 * Input limits applied by the formula parser.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: maximum character length of one formula text</li>
 *   <li><strong>maxNestingDepth</strong>: maximum recursion depth of the parser, counting
 *       parentheses, negations and chained {@code ->}/{@code <->} operators</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * ParserPolicy.defaults();   // 5000 characters, depth 500
 * ParserPolicy.strict();     // 1000 characters, depth 100
 * ParserPolicy.relaxed();    // 10000 characters, depth 1000
 *
 * ParserPolicy custom = ParserPolicy.builder()
 *     .maxExpressionLength(200)
 *     .maxNestingDepth(10)
 *     .build();
 * }</pre>
 *
 * @param policyName          name reported in limit violation messages
 * @param maxExpressionLength maximum character length of a formula text
 * @param maxNestingDepth     maximum parser recursion depth
 * @author PropLogic Team
 * @since 1.0.0
 */
public record ParserPolicy(
    String policyName,
    int maxExpressionLength,
    int maxNestingDepth
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the name is blank or a limit is not positive
     */
    public ParserPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
    }

    public static ParserPolicy defaults() {
        return new ParserPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 500);
    }

    /**
     * Strict configuration for untrusted input.
     *
     * @return strict configuration
     */
    public static ParserPolicy strict() {
        return new ParserPolicy(PolicyName.STRICT_POLICY.name(), 1000, 100);
    }

    public static ParserPolicy relaxed() {
        return new ParserPolicy(PolicyName.RELAXED_POLICY.name(), 10000, 1000);
    }

    /**
     * Creates a custom configuration. Unset parameters keep the {@link #defaults()} values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;
        private int _maxNestingDepth = 500;

        private Builder() {}

        public ParserPolicy build() {
            return new ParserPolicy(_policyName, _maxExpressionLength, _maxNestingDepth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
