package io.github.cyfko.proplogic.core.config;

/**
 * Settings of the parse-result cache of {@code BasicFormulaParser}.
 * <p>
 * Parsed formulas are immutable, so a cached tree can be handed out to any number of callers.
 * The cache is keyed by the exact input text, which means {@code "p&q"} and {@code "p & q"}
 * occupy two entries even though they parse to equal formulas.
 * </p>
 *
 * <pre>{@code
 * CachePolicy.defaults();          // 1000 formulas
 * CachePolicy.disabled();          // every call parses
 * CachePolicy.maxFormulas(64);     // small working set, e.g. one proof's premises
 * }</pre>
 *
 * @param enabled     whether parsed formulas are kept
 * @param maxFormulas how many formulas are kept before the least recently used one is dropped;
 *                    {@code 0} when the cache is disabled
 * @since 1.0.0
 */
public record CachePolicy(boolean enabled, int maxFormulas) {

    private static final int DEFAULT_MAX_FORMULAS = 1000;

    public CachePolicy {
        if (enabled && maxFormulas <= 0) {
            throw new IllegalArgumentException("maxFormulas must be positive for an enabled cache, got: " + maxFormulas);
        }
        if (!enabled && maxFormulas != 0) {
            throw new IllegalArgumentException("maxFormulas must be 0 for a disabled cache, got: " + maxFormulas);
        }
    }

    public static CachePolicy defaults() {
        return maxFormulas(DEFAULT_MAX_FORMULAS);
    }

    public static CachePolicy disabled() {
        return new CachePolicy(false, 0);
    }

    /**
     * @param maxFormulas cache capacity, at least 1
     * @return an enabled policy of the given capacity
     * @throws IllegalArgumentException if maxFormulas is not positive
     */
    public static CachePolicy maxFormulas(int maxFormulas) {
        return new CachePolicy(true, maxFormulas);
    }
}
