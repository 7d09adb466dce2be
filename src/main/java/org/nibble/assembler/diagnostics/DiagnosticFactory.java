package org.nibble.assembler.diagnostics;

import org.nibble.assembler.api.AssemblerErrorCode;
import org.nibble.assembler.backend.GeneratorException;
import org.nibble.assembler.frontend.lexer.LexicalException;
import org.nibble.assembler.frontend.lexer.Token;
import org.nibble.assembler.frontend.parser.ParseException;
import org.nibble.assembler.frontend.source.SourceIndex;
import org.nibble.assembler.frontend.source.Span;
import org.nibble.assembler.isa.InstructionMemory;

/**
 * Translates lexer, parser and generator errors into {@link Diagnostic}s.
 * Stateless; the source index is used only to quote the offending text.
 */
public final class DiagnosticFactory {

    private DiagnosticFactory() {}

    public static Diagnostic fromLexicalError(LexicalException error, SourceIndex source) {
        Token token = error.token();
        String text = quote(source, token.span());
        String label = switch (error.code()) {
            case INVALID_TOKEN -> "Invalid token found `" + text + "`";
            case INVALID_INTEGER -> "Invalid integer value `" + text + "`";
            default -> throw new IllegalStateException("Internal assembler error: not a lexical error code " + error.code());
        };
        return Diagnostic.error(error.code(), label, token.span());
    }

    public static Diagnostic fromParseError(ParseException error, SourceIndex source) {
        AssemblerErrorCode code = error.code();
        if (code == AssemblerErrorCode.MISSING_TOKEN) {
            return Diagnostic.error(code, "Expected `" + expectedTypeName(error) + "`, found the end of file", null);
        }

        Token token = error.token().orElseThrow(() ->
                new IllegalStateException("Internal assembler error: " + code + " without a token"));
        String text = quote(source, token.span());
        String label = switch (code) {
            case UNEXPECTED_TOKEN -> "Expected `" + expectedTypeName(error) + "`, found `" + text + "`";
            case INVALID_INSTRUCTION -> "`" + text + "` is not a valid instruction";
            case EXPECTED_INSTRUCTION_BEFORE_LABEL -> "Expected instruction after label, found second label `" + text + "`";
            case DUPLICATE_LABEL -> "Duplicate label `" + text + "`";
            case EXPECTED_NO_OPERANDS -> "Instruction takes no operands, found `" + text + "`";
            case EXPECTED_INSTRUCTION -> "Expected an instruction, found `" + text + "`";
            case EXPECTED_OPERAND -> "Expected instruction operand (one of "
                    + error.expectedOperands().orElse("?") + "), found `" + text + "`";
            case EXPECTED_OPERAND_FOUND_EOF -> "Expected instruction operand for `" + text + "`, found end of file";
            case EXPECTED_REGISTER -> "Expected register for instruction operand, found `" + text + "`";
            case INTEGER_OUT_OF_RANGE -> "Value is out of range for an 8-bit signed integer value";
            default -> throw new IllegalStateException("Internal assembler error: not a parser error code " + code);
        };
        return Diagnostic.error(code, label, token.span());
    }

    public static Diagnostic fromGeneratorError(GeneratorException error, SourceIndex source) {
        AssemblerErrorCode code = error.code();
        if (code == AssemblerErrorCode.MAXIMUM_INSTRUCTIONS) {
            return Diagnostic.error(code,
                    "Maximum number of instructions reached (" + InstructionMemory.MAX_INSTRUCTIONS + ")", null);
        }

        Span span = error.span().orElseThrow(() ->
                new IllegalStateException("Internal assembler error: " + code + " without a span"));
        String text = quote(source, span);
        String label = switch (code) {
            case DANGLING_LABEL -> "Dangling label `" + text + "`";
            case SOURCE_OR_SINK_RANGE -> "Source or sink must be in the range of 0-"
                    + InstructionMemory.MAX_PORT + ", found `" + text + "`";
            case JUMP_DESTINATION_RANGE -> "Jump destination must be in the range of 0-"
                    + (InstructionMemory.MAX_INSTRUCTIONS - 1) + ", found `" + text + "`";
            case UNDEFINED_LABEL -> "Label `" + text + "` is undefined";
            default -> throw new IllegalStateException("Internal assembler error: not a generator error code " + code);
        };
        return Diagnostic.error(code, label, span);
    }

    /**
     * @param fileName The file that could not be read.
     * @param reason The I/O failure message.
     * @return A diagnostic without a span.
     */
    public static Diagnostic ioError(String fileName, String reason) {
        return Diagnostic.error(AssemblerErrorCode.IO_ERROR_READING_FILE,
                "Could not read `" + fileName + "`: " + reason, null);
    }

    private static String expectedTypeName(ParseException error) {
        return error.expectedType()
                .orElseThrow(() -> new IllegalStateException("Internal assembler error: " + error.code() + " without an expected token type"))
                .displayName();
    }

    private static String quote(SourceIndex source, Span span) {
        return source.text(span).replace("\r", "\\r").replace("\n", "\\n");
    }
}
