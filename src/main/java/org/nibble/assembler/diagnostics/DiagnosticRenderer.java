package org.nibble.assembler.diagnostics;

import org.nibble.assembler.frontend.source.LineInfo;
import org.nibble.assembler.frontend.source.SourceIndex;
import org.nibble.assembler.frontend.source.Span;

/**
 * Renders a {@link Diagnostic} for a terminal:
 * <pre>
 * error: Duplicate label `a:`
 *   --> prog.s:2:1
 *  2 | a: nop
 *      ^^
 * </pre>
 * The locator and excerpt lines are printed only when the diagnostic has a span.
 */
public final class DiagnosticRenderer {

    private DiagnosticRenderer() {}

    /**
     * @param diagnostic The diagnostic to render.
     * @param source The source the diagnostic's span refers to.
     * @return The rendered text, lines separated by {@code '\n'}, without a trailing newline.
     */
    public static String render(Diagnostic diagnostic, SourceIndex source) {
        StringBuilder sb = new StringBuilder(diagnostic.headline());
        if (diagnostic.span() == null) {
            return sb.toString();
        }

        Span span = diagnostic.span();
        LineInfo line = source.lineOf(span);
        String lineNumber = Integer.toString(line.lineNumber());
        String gutter = " ".repeat(lineNumber.length());

        sb.append('\n')
                .append(' ').append(gutter).append(" --> ")
                .append(source.fileName()).append(':').append(line.lineNumber()).append(':').append(line.column() + 1);
        sb.append('\n')
                .append(' ').append(lineNumber).append(" | ").append(source.expandTabs(line.lineText()));
        sb.append('\n')
                .append(gutter).append(" ".repeat(line.column() + 4)).append("^".repeat(caretWidth(source, span)));
        return sb.toString();
    }

    // One caret per code point of the underlined text.
    private static int caretWidth(SourceIndex source, Span span) {
        String text = source.text(span);
        return text.codePointCount(0, text.length());
    }
}
