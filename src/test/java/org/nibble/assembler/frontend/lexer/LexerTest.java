package org.nibble.assembler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that the lexer converts source strings into a stream of tokens with
 * the right types and spans, including the error tokens for malformed input.
 */
@Tag("unit")
public class LexerTest {

    /**
     * Verifies the token stream for a line with a label, a mnemonic, two operands and a comment.
     */
    @Test
    void tokenizesLabelledInstructionWithComment() {
        // Arrange
        String source = "loop: add r1, r2 ; sum\nj loop";

        // Act
        List<Token> tokens = new Lexer(source).scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.LABEL, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.COMMA,
                TokenType.IDENTIFIER, TokenType.COMMENT, TokenType.NEWLINE,
                TokenType.IDENTIFIER, TokenType.IDENTIFIER);
        assertThat(tokens.get(0)).isEqualTo(Token.of(TokenType.LABEL, 0, 5));
        assertThat(tokens.get(5)).isEqualTo(Token.of(TokenType.COMMENT, 17, 5));
        assertThat(tokens.get(6)).isEqualTo(Token.of(TokenType.NEWLINE, 22, 1));
    }

    @Test
    void emptySourceProducesNoTokens() {
        assertThat(new Lexer("").scanTokens()).isEmpty();
        assertThat(new Lexer("  \t \r").scanTokens()).isEmpty();
    }

    @Test
    void integersAreScannedAsSingleToken() {
        List<Token> tokens = new Lexer("ldi r0, 127").scanTokens();

        assertThat(tokens.get(3)).isEqualTo(Token.of(TokenType.INTEGER, 8, 3));
    }

    /**
     * Verifies that a digit run containing letters becomes one invalid integer token.
     */
    @Test
    void digitsFollowedByLettersAreInvalidInteger() {
        List<Token> tokens = new Lexer("12ab, 3").scanTokens();

        assertThat(tokens.get(0)).isEqualTo(Token.of(TokenType.INVALID_INTEGER, 0, 4));
        assertThat(tokens.get(2)).isEqualTo(Token.of(TokenType.INTEGER, 6, 1));
    }

    @Test
    void identifiersMayContainUnderscoreAndHyphen() {
        List<Token> tokens = new Lexer("my_label-2:").scanTokens();

        assertThat(tokens).containsExactly(Token.of(TokenType.LABEL, 0, 11));
    }

    /**
     * Verifies that a minus sign is not the start of a negative literal.
     */
    @Test
    void unknownCharactersAreInvalidTokens() {
        List<Token> tokens = new Lexer("ldi r0, -1").scanTokens();

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.COMMA,
                TokenType.INVALID_TOKEN, TokenType.INTEGER);
        assertThat(tokens.get(3).span().offset()).isEqualTo(8);
    }

    @Test
    void commentRunsToEndOfLineWithoutNewline() {
        List<Token> tokens = new Lexer("; only a comment\nnop").scanTokens();

        assertThat(tokens).extracting(Token::type)
                .containsExactly(TokenType.COMMENT, TokenType.NEWLINE, TokenType.IDENTIFIER);
        assertThat(tokens.get(0).span().length()).isEqualTo(16);
    }

    @Test
    void colonWithoutIdentifierIsInvalid() {
        List<Token> tokens = new Lexer(":").scanTokens();

        assertThat(tokens).containsExactly(Token.of(TokenType.INVALID_TOKEN, 0, 1));
    }

    /**
     * Verifies that a letter outside the Basic Multilingual Plane is scanned as one character,
     * so it can start a label while spans still count UTF-16 units.
     */
    @Test
    void supplementaryLetterStartsIdentifier() {
        // Arrange
        String source = "\uD835\uDC65: nop";

        // Act
        List<Token> tokens = new Lexer(source).scanTokens();

        // Assert
        assertThat(tokens).containsExactly(
                Token.of(TokenType.LABEL, 0, 3),
                Token.of(TokenType.IDENTIFIER, 4, 3));
    }

    @Test
    void supplementarySymbolIsOneInvalidToken() {
        List<Token> tokens = new Lexer("nop \uD83D\uDE00").scanTokens();

        assertThat(tokens).containsExactly(
                Token.of(TokenType.IDENTIFIER, 0, 3),
                Token.of(TokenType.INVALID_TOKEN, 4, 2));
    }
}
