package io.github.cyfko.proplogic.core.parsing;

/**
 * Kinds of tokens produced by {@link FormulaLexer}.
 *
 * @since 1.0.0
 */
public enum TokenType {
    IDENT,
    NOT,
    AND,
    OR,
    IMPLIES,
    IFF,
    LPAREN,
    RPAREN
}
