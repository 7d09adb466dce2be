package org.nibble.assembler.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public assembler API and free of implementation details.
 *
 * @param fileName The file where the code is located.
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based rendered column.
 * @param lineContent The content of the line.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber, String lineContent) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
