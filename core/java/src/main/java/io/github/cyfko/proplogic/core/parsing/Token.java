package io.github.cyfko.proplogic.core.parsing;

/**
 * A lexed token.
 *
 * @param type     the token kind
 * @param lexeme   the exact source text of the token
 * @param position zero-based offset of the first character of the token
 * @since 1.0.0
 */
public record Token(TokenType type, String lexeme, int position) {
}
