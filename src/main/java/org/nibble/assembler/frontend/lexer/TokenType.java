package org.nibble.assembler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** A mnemonic, register name or label reference. */
    IDENTIFIER("Identifier"),
    /** A label definition; the span includes the trailing ':'. */
    LABEL("Label"),
    /** The ',' separating two operands. */
    COMMA("Comma"),
    /** A decimal digit run. */
    INTEGER("Integer"),
    /** A '\n' line terminator. */
    NEWLINE("Newline"),
    /** A ';' comment running to the end of the line. */
    COMMENT("Comment"),

    // Lexical errors. Never handed to the parser.
    /** A single character that cannot start any token. */
    INVALID_TOKEN("InvalidToken"),
    /** A digit run that contains letters, such as {@code 12ab}. */
    INVALID_INTEGER("InvalidInteger");

    private final String displayName;

    TokenType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return The name used for this token type in diagnostics.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * @return {@code true} for the two lexical error types.
     */
    public boolean isError() {
        return this == INVALID_TOKEN || this == INVALID_INTEGER;
    }
}
