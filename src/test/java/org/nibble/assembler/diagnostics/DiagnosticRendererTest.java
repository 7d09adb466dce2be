package org.nibble.assembler.diagnostics;

import org.nibble.assembler.api.AssemblerErrorCode;
import org.nibble.assembler.frontend.source.SourceIndex;
import org.nibble.assembler.frontend.source.Span;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link DiagnosticRenderer}.
 */
@Tag("unit")
public class DiagnosticRendererTest {

    /**
     * Verifies the headline, locator, excerpt and caret lines for a diagnostic with a span.
     */
    @Test
    void rendersLocatorExcerptAndCarets() {
        // Arrange
        SourceIndex source = new SourceIndex("a: nop\na: nop\n", "prog.s");
        Diagnostic diagnostic = Diagnostic.error(AssemblerErrorCode.DUPLICATE_LABEL, "Duplicate label `a:`", new Span(7, 2));

        // Act
        String rendered = DiagnosticRenderer.render(diagnostic, source);

        // Assert
        assertThat(rendered).isEqualTo(String.join("\n",
                "error: Duplicate label `a:`",
                "  --> prog.s:2:1",
                " 2 | a: nop",
                "     ^^"));
    }

    @Test
    void caretsFollowColumnOfSpan() {
        SourceIndex source = new SourceIndex("ldi r0, 200", "prog.s");
        Diagnostic diagnostic = Diagnostic.error(AssemblerErrorCode.INTEGER_OUT_OF_RANGE,
                "Value is out of range for an 8-bit signed integer value", new Span(8, 3));

        String[] lines = DiagnosticRenderer.render(diagnostic, source).split("\n");

        assertThat(lines[1]).isEqualTo("  --> prog.s:1:9");
        assertThat(lines[3]).isEqualTo(" ".repeat(13) + "^^^");
        assertThat(lines[3].indexOf('^')).isEqualTo(lines[2].indexOf("200"));
    }

    @Test
    void gutterWidensForMultiDigitLineNumbers() {
        SourceIndex source = new SourceIndex("nop\n".repeat(11) + "bad", "prog.s");
        Diagnostic diagnostic = Diagnostic.error(AssemblerErrorCode.INVALID_INSTRUCTION,
                "`bad` is not a valid instruction", new Span(44, 3));

        String[] lines = DiagnosticRenderer.render(diagnostic, source).split("\n");

        assertThat(lines[1]).isEqualTo("    --> prog.s:12:1");
        assertThat(lines[2]).isEqualTo(" 12 | bad");
        assertThat(lines[3]).isEqualTo("      ^^^");
    }

    /**
     * Verifies that tabs before the span are expanded in both the excerpt and the caret line.
     */
    @Test
    void tabsAreExpandedConsistently() {
        SourceIndex source = new SourceIndex("\tfoo", "prog.s", 4);
        Diagnostic diagnostic = Diagnostic.error(AssemblerErrorCode.INVALID_INSTRUCTION,
                "`foo` is not a valid instruction", new Span(1, 3));

        String[] lines = DiagnosticRenderer.render(diagnostic, source).split("\n");

        assertThat(lines[1]).endsWith("prog.s:1:5");
        assertThat(lines[2]).isEqualTo(" 1 |     foo");
        assertThat(lines[3].indexOf('^')).isEqualTo(lines[2].indexOf("foo"));
    }

    @Test
    void diagnosticWithoutSpanRendersHeadlineOnly() {
        Diagnostic diagnostic = Diagnostic.error(AssemblerErrorCode.MAXIMUM_INSTRUCTIONS,
                "Maximum number of instructions reached (32)", null);

        assertThat(DiagnosticRenderer.render(diagnostic, new SourceIndex("", "prog.s")))
                .isEqualTo("error: Maximum number of instructions reached (32)");
    }
}
