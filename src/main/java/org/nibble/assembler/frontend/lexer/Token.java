package org.nibble.assembler.frontend.lexer;

import org.nibble.assembler.frontend.source.Span;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 * The token text is recovered through the {@link org.nibble.assembler.frontend.source.SourceIndex}.
 *
 * @param type The type of the token.
 * @param span The location of the token in the source text.
 */
public record Token(TokenType type, Span span) {

    /**
     * Convenience factory for tests and the lexer.
     * @param type The token type.
     * @param offset The offset of the first character.
     * @param length The number of characters.
     * @return A new token.
     */
    public static Token of(TokenType type, int offset, int length) {
        return new Token(type, new Span(offset, length));
    }
}
