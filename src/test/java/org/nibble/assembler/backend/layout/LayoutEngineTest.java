package org.nibble.assembler.backend.layout;

import org.nibble.assembler.api.AssemblerErrorCode;
import org.nibble.assembler.backend.GeneratorException;
import org.nibble.assembler.frontend.lexer.Lexer;
import org.nibble.assembler.frontend.lexer.TokenFilter;
import org.nibble.assembler.frontend.parser.ParseResult;
import org.nibble.assembler.frontend.parser.Parser;
import org.nibble.assembler.frontend.source.SourceIndex;
import org.nibble.assembler.frontend.source.Span;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Contains unit tests for the {@link LayoutEngine}.
 */
@Tag("unit")
public class LayoutEngineTest {

    private static ParseResult parse(String source) throws Exception {
        return new Parser(TokenFilter.filter(new Lexer(source).scanTokens()), new SourceIndex(source, "test.s")).parse();
    }

    /**
     * Verifies that each label resolves to the index of the instruction that follows it.
     */
    @Test
    void labelsResolveToFollowingInstructionIndex() throws Exception {
        // Arrange
        ParseResult parsed = parse("start: nop\nnop\nloop:\n  add r1, r2\nend: j loop");

        // Act
        LayoutResult result = new LayoutEngine().layout(parsed.program(), parsed.labels());

        // Assert
        assertThat(result.instructionCount()).isEqualTo(4);
        assertThat(result.labelToAddress()).containsExactly(
                entry("start", 0),
                entry("loop", 2),
                entry("end", 3));
        int loopId = parsed.labels().idOf("loop").orElseThrow();
        assertThat(parsed.labels().resolvedOffsetOf(loopId)).contains((byte) 2);
    }

    @Test
    void emptyProgramHasNoInstructions() throws Exception {
        ParseResult parsed = parse("");

        LayoutResult result = new LayoutEngine().layout(parsed.program(), parsed.labels());

        assertThat(result.instructionCount()).isZero();
        assertThat(result.labelToAddress()).isEmpty();
    }

    @Test
    void thirtyTwoInstructionsFit() throws Exception {
        ParseResult parsed = parse("nop\n".repeat(32));

        assertThat(new LayoutEngine().layout(parsed.program(), parsed.labels()).instructionCount()).isEqualTo(32);
    }

    @Test
    void thirtyThreeInstructionsExceedMemory() throws Exception {
        ParseResult parsed = parse("nop\n".repeat(33));

        assertThatThrownBy(() -> new LayoutEngine().layout(parsed.program(), parsed.labels()))
                .isInstanceOfSatisfying(GeneratorException.class, e -> {
                    assertThat(e.code()).isEqualTo(AssemblerErrorCode.MAXIMUM_INSTRUCTIONS);
                    assertThat(e.span()).isEmpty();
                });
    }

    /**
     * Verifies that a label with no instruction after it is reported at its definition.
     */
    @Test
    void trailingLabelIsDangling() throws Exception {
        ParseResult parsed = parse("nop\nend:\n");

        assertThatThrownBy(() -> new LayoutEngine().layout(parsed.program(), parsed.labels()))
                .isInstanceOfSatisfying(GeneratorException.class, e -> {
                    assertThat(e.code()).isEqualTo(AssemblerErrorCode.DANGLING_LABEL);
                    assertThat(e.span()).contains(new Span(4, 4));
                });
    }
}
