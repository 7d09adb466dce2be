package org.nibble.assembler.frontend.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) converts the source text into a
 * sequence of tokens in a single left-to-right pass.
 * <p>
 * Lexing never fails: malformed input is represented by {@link TokenType#INVALID_TOKEN}
 * and {@link TokenType#INVALID_INTEGER} tokens, which the caller reports.
 */
public class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return The recognized tokens, in source order.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        return tokens;
    }

    private void scanToken() {
        int c = advance();
        switch (c) {
            case ' ', '\r', '\t':
                break;
            case '\n':
                addToken(TokenType.NEWLINE);
                break;
            case ',':
                addToken(TokenType.COMMA);
                break;
            case ';':
                while (peek() != '\n' && !isAtEnd()) advance();
                addToken(TokenType.COMMENT);
                break;
            default:
                if (isDigit(c)) {
                    integer();
                } else if (Character.isLetter(c)) {
                    identifier();
                } else {
                    addToken(TokenType.INVALID_TOKEN);
                }
                break;
        }
    }

    private void integer() {
        boolean valid = true;
        while (!isAtEnd()) {
            int c = peek();
            if (isDigit(c)) {
                advance();
            } else if (Character.isLetter(c)) {
                valid = false;
                advance();
            } else {
                break;
            }
        }
        addToken(valid ? TokenType.INTEGER : TokenType.INVALID_INTEGER);
    }

    private void identifier() {
        while (isIdentifierPart(peek()) && !isAtEnd()) advance();

        if (peek() == ':' && !isAtEnd()) {
            advance();
            addToken(TokenType.LABEL);
        } else {
            addToken(TokenType.IDENTIFIER);
        }
    }

    private void addToken(TokenType type) {
        tokens.add(Token.of(type, start, current - start));
    }

    // Code points outside the BMP span two chars; spans stay in UTF-16 units.
    private int advance() {
        int c = source.codePointAt(current);
        current += Character.charCount(c);
        return c;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private int peek() {
        if (isAtEnd()) return '\0';
        return source.codePointAt(current);
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierPart(int c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }
}
