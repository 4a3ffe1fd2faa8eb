package io.github.cyfko.proplogic.core;

import io.github.cyfko.proplogic.core.api.Atomic;
import io.github.cyfko.proplogic.core.api.Formula;
import io.github.cyfko.proplogic.core.api.FormulaParser;
import io.github.cyfko.proplogic.core.config.ParserPolicy;
import io.github.cyfko.proplogic.core.exception.FormulaSyntaxException;
import io.github.cyfko.proplogic.core.impl.BasicFormulaParser;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Static entry point for the most common operations.
 * <p>
 * Parsing goes through a shared {@link BasicFormulaParser} with default policies. Use a
 * dedicated {@link FormulaParser} instance to customise limits or caching.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Formula f = Formulas.parse("p & q | r");               // ((p & q) | r)
 * List<Formula> fs = Formulas.parseList("p, q -> r");    // [p, (q -> r)]
 * List<Atomic> vars = Formulas.atomics("p q r");          // [p, q, r]
 * }</pre>
 *
 * @author PropLogic Team
 * @since 1.0.0
 */
public final class Formulas {

    private static final FormulaParser DEFAULT_PARSER = new BasicFormulaParser();

    private Formulas() {}

    /**
     * Parses exactly one formula with the default parser.
     * <p>
     * The default parser uses {@link ParserPolicy#defaults()}: text over 5000 characters or
     * nested deeper than 500 levels is rejected. Use a {@link BasicFormulaParser} built with
     * {@link ParserPolicy#relaxed()} or a custom policy for larger formulas.
     * </p>
     *
     * @see FormulaParser#parse(String)
     */
    public static Formula parse(String text) throws FormulaSyntaxException {
        return DEFAULT_PARSER.parse(text);
    }

    /**
     * Parses a comma-separated list of formulas with the default parser.
     *
     * @see FormulaParser#parseList(String)
     */
    public static List<Formula> parseList(String text) throws FormulaSyntaxException {
        return DEFAULT_PARSER.parseList(text);
    }

    /**
     * Creates one {@link Atomic} per whitespace-separated word of {@code names}.
     * <p>
     * Words are not validated, so {@code "1234 %()$&"} yields the atomics {@code 1234} and
     * {@code %()$&}. Blank text yields an empty list.
     * </p>
     * <p>
     * Word separators are every Unicode space: the characters of {@link Character#isWhitespace},
     * the no-break spaces of {@link Character#isSpaceChar} and {@code U+0085}. This is a wider set
     * than the one the formula lexer skips.
     * </p>
     *
     * @param names whitespace-separated variable names
     * @return the atomics in order, as an unmodifiable list
     */
    public static List<Atomic> atomics(String names) {
        Objects.requireNonNull(names, "names cannot be null");
        List<String> words = new ArrayList<>();
        int wordStart = -1;
        int i = 0;
        while (i < names.length()) {
            int c = names.codePointAt(i);
            if (isWordSeparator(c)) {
                if (wordStart >= 0) {
                    words.add(names.substring(wordStart, i));
                    wordStart = -1;
                }
            } else if (wordStart < 0) {
                wordStart = i;
            }
            i += Character.charCount(c);
        }
        if (wordStart >= 0) {
            words.add(names.substring(wordStart));
        }
        return atomics(words);
    }

    private static boolean isWordSeparator(int c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\u0085';
    }

    /**
     * Creates one {@link Atomic} per element of {@code names}, each taken verbatim.
     *
     * @param names variable names, which may contain whitespace
     * @return the atomics in iteration order, as an unmodifiable list
     */
    public static List<Atomic> atomics(Collection<String> names) {
        Objects.requireNonNull(names, "names cannot be null");
        List<Atomic> result = new ArrayList<>(names.size());
        for (String name : names) {
            result.add(new Atomic(name));
        }
        return List.copyOf(result);
    }
}
