package org.nibble.assembler.frontend.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Wraps the raw source text of one assembly run and resolves {@link Span}s against it.
 * No other component reads the text by offset.
 */
public final class SourceIndex {

    /** Number of columns a tab advances when no other width is configured. */
    public static final int DEFAULT_TAB_WIDTH = 4;

    private final String source;
    private final String fileName;
    private final int tabWidth;
    private final List<Integer> lineStarts;

    /**
     * Creates an index with the default tab width.
     * @param source The complete source text.
     * @param fileName The name shown in diagnostic locators.
     */
    public SourceIndex(String source, String fileName) {
        this(source, fileName, DEFAULT_TAB_WIDTH);
    }

    /**
     * Creates an index.
     * @param source The complete source text.
     * @param fileName The name shown in diagnostic locators.
     * @param tabWidth The number of columns a tab character is rendered as.
     */
    public SourceIndex(String source, String fileName, int tabWidth) {
        if (tabWidth < 1) {
            throw new IllegalArgumentException("Tab width must be positive: " + tabWidth);
        }
        this.source = source;
        this.fileName = fileName;
        this.tabWidth = tabWidth;
        this.lineStarts = computeLineStarts(source);
    }

    private static List<Integer> computeLineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return Collections.unmodifiableList(starts);
    }

    public String source() {
        return source;
    }

    public String fileName() {
        return fileName;
    }

    public int tabWidth() {
        return tabWidth;
    }

    /**
     * Returns the text covered by a span.
     * @param span The span to resolve.
     * @return The substring of the source.
     * @throws IllegalArgumentException if the span reaches past the end of the source.
     */
    public String text(Span span) {
        checkBounds(span);
        return source.substring(span.offset(), span.end());
    }

    /**
     * Finds the line a span starts on and the rendered column of its first character.
     * Columns count code points, with a tab counting as the tab width.
     * @param span The span to locate.
     * @return The line text, its 1-based number and the 0-based rendered column.
     * @throws IllegalArgumentException if the span reaches past the end of the source.
     */
    public LineInfo lineOf(Span span) {
        checkBounds(span);
        int lineIndex = lineIndexOf(span.offset());
        int lineStart = lineStarts.get(lineIndex);
        int lineEnd = source.indexOf('\n', lineStart);
        if (lineEnd < 0) {
            lineEnd = source.length();
        }
        String lineText = source.substring(lineStart, lineEnd);
        if (lineText.endsWith("\r")) {
            lineText = lineText.substring(0, lineText.length() - 1);
        }

        int column = 0;
        for (int i = lineStart; i < span.offset(); ) {
            int c = source.codePointAt(i);
            column += c == '\t' ? tabWidth : 1;
            i += Character.charCount(c);
        }
        return new LineInfo(lineText, lineIndex + 1, column);
    }

    /**
     * Replaces every tab in the given text with tab-width spaces.
     * @param text The text to expand.
     * @return The expanded text.
     */
    public String expandTabs(String text) {
        return text.replace("\t", " ".repeat(tabWidth));
    }

    private int lineIndexOf(int offset) {
        int low = 0;
        int high = lineStarts.size() - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts.get(mid) <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }

    private void checkBounds(Span span) {
        if (span.end() > source.length()) {
            throw new IllegalArgumentException("Span " + span + " exceeds source length " + source.length());
        }
    }
}
