package io.github.cyfko.proplogic.core.api;

import io.github.cyfko.proplogic.core.exception.FormulaSyntaxException;

import java.util.List;

/**
 * Parser for the textual notation of propositional formulas.
 *
 * <h2>Notation</h2>
 * <table border="1">
 * <caption>Operator Reference</caption>
 * <thead>
 * <tr><th>Operator</th><th>Symbol</th><th>Precedence</th><th>Associativity</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Parentheses</td><td>( )</td><td>Highest</td><td>N/A</td><td>(p | q)</td></tr>
 * <tr><td>NOT</td><td>~</td><td>5</td><td>Prefix</td><td>~p</td></tr>
 * <tr><td>AND</td><td>&amp;</td><td>4</td><td>Left</td><td>p &amp; q</td></tr>
 * <tr><td>OR</td><td>|</td><td>3</td><td>Left</td><td>p | q</td></tr>
 * <tr><td>IMPLIES</td><td>-&gt;</td><td>2</td><td>Right</td><td>p -&gt; q</td></tr>
 * <tr><td>IFF</td><td>&lt;-&gt;</td><td>1</td><td>Right</td><td>p &lt;-&gt; q</td></tr>
 * </tbody>
 * </table>
 *
 * <h2>Grammar (EBNF)</h2>
 * <pre>
 * bic   := cond ("&lt;-&gt;" bic)?
 * cond  := disj ("-&gt;" cond)?
 * disj  := conj ("|" conj)*
 * conj  := neg ("&amp;" neg)*
 * neg   := "~" neg | unit
 * unit  := IDENT | "(" bic ")"
 * IDENT := [a-zA-Z_][a-zA-Z0-9_]*
 * </pre>
 * <p>
 * Whitespace ({@code ' ', '\t', '\f', '\r', '\n'}) separates tokens and is otherwise ignored.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * FormulaParser parser = new BasicFormulaParser();
 *
 * parser.parse("p & q | r");      // ((p & q) | r)
 * parser.parse("p -> q -> r");    // (p -> (q -> r))
 * parser.parse("~(p <-> q)");     // ~(p <-> q)
 *
 * parser.parseList("p, q & r");   // [p, (q & r)]
 * parser.parseList("");           // []
 * }</pre>
 *
 * @see Formula
 * @see FormulaSyntaxException
 * @author PropLogic Team
 * @since 1.0.0
 */
public interface FormulaParser {

    /**
     * Parses exactly one formula.
     * <p>
     * Implementations may bound the input. {@code BasicFormulaParser} applies a
     * {@code ParserPolicy}, which by default rejects text longer than 5000 characters or nested
     * deeper than 500 levels even when it is otherwise well formed.
     * </p>
     *
     * @param text the formula text
     * @return the parsed formula
     * @throws FormulaSyntaxException if the text is empty, malformed, has trailing tokens or
     *                                exceeds the parser limits
     * @throws NullPointerException   if text is null
     */
    Formula parse(String text) throws FormulaSyntaxException;

    /**
     * Parses a comma-separated list of formulas.
     * <p>
     * The text is split on every {@code ','} (there is no escaping, and commas inside parentheses
     * are not treated specially), and each segment is parsed with {@link #parse(String)} from
     * left to right. The first failing segment aborts the whole call: no partial list is
     * returned and later segments are not examined.
     * </p>
     * <p>
     * Text made only of the separators the lexer skips ({@code ' ', '\t', '\f', '\r', '\n'})
     * yields an empty list. An empty segment inside non-blank text, as in {@code "p,,q"} or
     * {@code "p,"}, is an error. The length limit of {@link #parse(String)} applies per segment.
     * </p>
     *
     * @param text the comma-separated formulas
     * @return the parsed formulas in input order, as an unmodifiable list
     * @throws FormulaSyntaxException if any segment fails to parse
     * @throws NullPointerException   if text is null
     */
    List<Formula> parseList(String text) throws FormulaSyntaxException;
}
