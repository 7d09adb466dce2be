package org.nibble.assembler.isa;

import org.nibble.assembler.frontend.lexer.TokenType;

/**
 * The kinds of value an instruction operand position may accept.
 */
public enum OperandKind {
    /** A register name, lexed as an identifier. */
    REGISTER("register", TokenType.IDENTIFIER),
    /** A decimal immediate. */
    INTEGER("integer", TokenType.INTEGER),
    /** A label reference, lexed as an identifier. */
    LABEL("label", TokenType.IDENTIFIER);

    private final String displayName;
    private final TokenType tokenType;

    OperandKind(String displayName, TokenType tokenType) {
        this.displayName = displayName;
        this.tokenType = tokenType;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * @return The token type an operand of this kind is written as.
     */
    public TokenType tokenType() {
        return tokenType;
    }
}
