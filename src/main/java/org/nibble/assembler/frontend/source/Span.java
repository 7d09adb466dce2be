package org.nibble.assembler.frontend.source;

/**
 * A half-open range of characters in the source text that produced it.
 *
 * @param offset The index of the first character.
 * @param length The number of characters covered.
 */
public record Span(int offset, int length) {

    public Span {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("Span offset and length must be non-negative: " + offset + "+" + length);
        }
    }

    /**
     * @return The index one past the last character of the span.
     */
    public int end() {
        return offset + length;
    }
}
