package org.nibble.assembler.frontend.lexer;

import org.nibble.assembler.api.AssemblerErrorCode;

/**
 * Thrown when the token stream contains an invalid token or a malformed integer.
 */
public class LexicalException extends Exception {

    private final AssemblerErrorCode code;
    private final Token token;

    /**
     * @param code Either {@link AssemblerErrorCode#INVALID_TOKEN} or {@link AssemblerErrorCode#INVALID_INTEGER}.
     * @param token The offending token.
     */
    public LexicalException(AssemblerErrorCode code, Token token) {
        super(code + " at " + token.span());
        this.code = code;
        this.token = token;
    }

    public AssemblerErrorCode code() {
        return code;
    }

    public Token token() {
        return token;
    }
}
