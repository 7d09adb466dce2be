package org.nibble.assembler.frontend.parser;

import org.nibble.assembler.api.AssemblerErrorCode;
import org.nibble.assembler.frontend.lexer.Token;
import org.nibble.assembler.frontend.lexer.TokenType;
import org.nibble.assembler.isa.OperandRule;

import java.util.Optional;

/**
 * A syntax or static-semantics error found by the {@link Parser}. Parsing stops at the first one.
 */
public class ParseException extends Exception {

    private final AssemblerErrorCode code;
    private final Token token;
    private final TokenType expectedType;
    private final String expectedOperands;

    private ParseException(AssemblerErrorCode code, Token token, TokenType expectedType, String expectedOperands) {
        super(code + (token != null ? " at " + token.span() : ""));
        this.code = code;
        this.token = token;
        this.expectedType = expectedType;
        this.expectedOperands = expectedOperands;
    }

    /**
     * Creates an error that only needs the offending token.
     * @param code The error code.
     * @param token The offending token.
     * @return The exception.
     */
    public static ParseException at(AssemblerErrorCode code, Token token) {
        return new ParseException(code, token, null, null);
    }

    static ParseException unexpectedToken(TokenType expected, Token found) {
        return new ParseException(AssemblerErrorCode.UNEXPECTED_TOKEN, found, expected, null);
    }

    static ParseException missingToken(TokenType expected) {
        return new ParseException(AssemblerErrorCode.MISSING_TOKEN, null, expected, null);
    }

    static ParseException expectedOperand(Token found, OperandRule rule) {
        return new ParseException(AssemblerErrorCode.EXPECTED_OPERAND, found, null, rule.describe());
    }

    public AssemblerErrorCode code() {
        return code;
    }

    /**
     * @return The offending token; empty only for {@link AssemblerErrorCode#MISSING_TOKEN}.
     */
    public Optional<Token> token() {
        return Optional.ofNullable(token);
    }

    /**
     * @return The token type that was required, for UNEXPECTED_TOKEN and MISSING_TOKEN.
     */
    public Optional<TokenType> expectedType() {
        return Optional.ofNullable(expectedType);
    }

    /**
     * @return The accepted operand kinds, for EXPECTED_OPERAND.
     */
    public Optional<String> expectedOperands() {
        return Optional.ofNullable(expectedOperands);
    }
}
