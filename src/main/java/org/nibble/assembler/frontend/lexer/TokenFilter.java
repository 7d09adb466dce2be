package org.nibble.assembler.frontend.lexer;

import org.nibble.assembler.api.AssemblerErrorCode;

import java.util.ArrayList;
import java.util.List;

/**
 * Prepares the lexer output for the parser: comments are dropped and the first
 * lexical error aborts the run.
 */
public final class TokenFilter {

    private TokenFilter() {}

    /**
     * Filters a token sequence.
     * @param tokens The complete lexer output.
     * @return The tokens the parser consumes, in source order.
     * @throws LexicalException on the first {@link TokenType#INVALID_TOKEN} or {@link TokenType#INVALID_INTEGER}.
     */
    public static List<Token> filter(List<Token> tokens) throws LexicalException {
        List<Token> valid = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            switch (token.type()) {
                case INVALID_TOKEN -> throw new LexicalException(AssemblerErrorCode.INVALID_TOKEN, token);
                case INVALID_INTEGER -> throw new LexicalException(AssemblerErrorCode.INVALID_INTEGER, token);
                case COMMENT -> { }
                default -> valid.add(token);
            }
        }
        return valid;
    }
}
