package io.github.cyfko.proplogic.core.impl;

import io.github.cyfko.proplogic.core.api.Formula;
import io.github.cyfko.proplogic.core.api.FormulaParser;
import io.github.cyfko.proplogic.core.cache.BoundedLRUCache;
import io.github.cyfko.proplogic.core.config.CachePolicy;
import io.github.cyfko.proplogic.core.config.ParserPolicy;
import io.github.cyfko.proplogic.core.exception.FormulaSyntaxException;
import io.github.cyfko.proplogic.core.parsing.FormulaLexer;
import io.github.cyfko.proplogic.core.parsing.RecursiveDescentParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Default {@link FormulaParser}: a {@link FormulaLexer} feeding a {@link RecursiveDescentParser}.
 *
 * <h2>Limits</h2>
 * <p>
 * Input length and parser recursion depth are bounded by the {@link ParserPolicy}, so hostile
 * input fails with a {@link FormulaSyntaxException} instead of exhausting the stack.
 * </p>
 *
 * <h2>Caching</h2>
 * <p>
 * Successfully parsed formulas are kept in a {@link BoundedLRUCache} keyed by the input text,
 * as configured by the {@link CachePolicy}. Failures are never cached. Since formulas are
 * immutable, returning the same instance to several callers is safe.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * A fresh lexer and parser are created for each call and the cache is synchronized, so one
 * instance can be shared between threads.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * FormulaParser parser = new BasicFormulaParser();
 * Formula f = parser.parse("(p -> q) & p -> q");
 *
 * FormulaParser strictParser = new BasicFormulaParser(ParserPolicy.strict(), CachePolicy.disabled());
 * List<Formula> premises = strictParser.parseList("p -> q, q -> r, p");
 * }</pre>
 *
 * @author PropLogic Team
 * @since 1.0.0
 */
public class BasicFormulaParser implements FormulaParser {

    private static final Logger log = Logger.getLogger(BasicFormulaParser.class.getName());

    private final ParserPolicy parserPolicy;
    protected final BoundedLRUCache<String, Formula> cache;

    /**
     * Default constructor using {@link ParserPolicy#defaults()} and {@link CachePolicy#defaults()}.
     */
    public BasicFormulaParser() {
        this(ParserPolicy.defaults(), CachePolicy.defaults());
    }

    /**
     * @param parserPolicy the input limits
     * @throws IllegalArgumentException if parserPolicy is null
     */
    public BasicFormulaParser(ParserPolicy parserPolicy) {
        this(parserPolicy, CachePolicy.defaults());
    }

    /**
     * @param parserPolicy the input limits
     * @param cachePolicy  the cache settings
     * @throws IllegalArgumentException if a policy is null
     */
    public BasicFormulaParser(ParserPolicy parserPolicy, CachePolicy cachePolicy) {
        if (parserPolicy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }

        if (cachePolicy == null) {
            throw new IllegalArgumentException("Cache policy is required");
        }

        this.parserPolicy = parserPolicy;
        this.cache = cachePolicy.enabled()
            ? new BoundedLRUCache<>(cachePolicy.maxFormulas())
            : null;
    }

    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    /**
     * Returns cache statistics (if caching is enabled).
     *
     * @return map containing cache statistics or {@code {enabled=false}} if the cache is disabled
     */
    public Map<String, Object> getCacheStats() {
        if (cache == null) {
            return Map.of("enabled", false);
        }

        return Map.of(
            "enabled", true,
            "size", cache.size(),
            "maxSize", cache.getMaxSize()
        );
    }

    @Override
    public Formula parse(String text) throws FormulaSyntaxException {
        Objects.requireNonNull(text, "Formula text cannot be null");

        if (cache == null) {
            return doParse(text);
        }

        Formula cached = cache.get(text);
        if (cached != null) {
            log.finest(() -> String.format("Formula cache hit for '%s'", text));
            return cached;
        }

        Formula formula = doParse(text);
        cache.put(text, formula);
        return formula;
    }

    @Override
    public List<Formula> parseList(String text) throws FormulaSyntaxException {
        Objects.requireNonNull(text, "Formula list text cannot be null");

        if (text.codePoints().allMatch(FormulaLexer::isWhitespace)) {
            return List.of();
        }

        String[] segments = text.split(",", -1);
        List<Formula> formulas = new ArrayList<>(segments.length);
        for (String segment : segments) {
            formulas.add(parse(segment));
        }

        log.fine(() -> String.format("Parsed %d formulas from list", formulas.size()));
        return List.copyOf(formulas);
    }

    private Formula doParse(String text) {
        Formula formula = new RecursiveDescentParser(text, parserPolicy).parseFormula();
        log.fine(() -> String.format("Parsed formula '%s' as %s", text, formula));
        return formula;
    }
}
