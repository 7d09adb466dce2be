package org.nibble.assembler.frontend.source;

/**
 * The source line a span starts on, as needed for rendering a diagnostic.
 *
 * @param lineText The full text of the line, without its line terminator.
 * @param lineNumber The 1-based line number.
 * @param column The 0-based column of the span start, with tabs expanded to the tab width.
 */
public record LineInfo(String lineText, int lineNumber, int column) {}
