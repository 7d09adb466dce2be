package org.nibble.assembler;

import org.nibble.assembler.api.AssemblyException;
import org.nibble.assembler.api.IAssembler;
import org.nibble.assembler.api.ProgramImage;
import org.nibble.assembler.api.SourceInfo;
import org.nibble.assembler.backend.GeneratorException;
import org.nibble.assembler.backend.emit.Emitter;
import org.nibble.assembler.backend.layout.LayoutEngine;
import org.nibble.assembler.backend.layout.LayoutResult;
import org.nibble.assembler.diagnostics.AssemblerLogger;
import org.nibble.assembler.diagnostics.Diagnostic;
import org.nibble.assembler.diagnostics.DiagnosticFactory;
import org.nibble.assembler.diagnostics.DiagnosticRenderer;
import org.nibble.assembler.frontend.lexer.Lexer;
import org.nibble.assembler.frontend.lexer.LexicalException;
import org.nibble.assembler.frontend.lexer.Token;
import org.nibble.assembler.frontend.lexer.TokenFilter;
import org.nibble.assembler.frontend.parser.ParseException;
import org.nibble.assembler.frontend.parser.ParseResult;
import org.nibble.assembler.frontend.parser.Parser;
import org.nibble.assembler.frontend.source.LineInfo;
import org.nibble.assembler.frontend.source.SourceIndex;
import org.nibble.assembler.ir.IrInstruction;
import org.nibble.assembler.ir.IrItem;
import org.nibble.assembler.ir.IrProgram;
import org.nibble.assembler.isa.InstructionMemory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The main assembler implementation. It runs the pipeline
 * source text → tokens → items and labels → layout → encoded bytes → 64-byte image
 * and stops at the first error.
 * <p>
 * Every call to {@link #assemble(String, String)} works on fresh state, so one instance
 * can be reused. It is not thread-safe while {@link #setVerbosity(int)} is being changed.
 */
public class Assembler implements IAssembler {

    private final int tabWidth;
    private int verbosity = -1;

    public Assembler() {
        this(SourceIndex.DEFAULT_TAB_WIDTH);
    }

    /**
     * @param tabWidth The number of columns a tab is rendered as in diagnostics.
     */
    public Assembler(int tabWidth) {
        this.tabWidth = tabWidth;
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    @Override
    public ProgramImage assemble(String source, String programName) throws AssemblyException {
        if (verbosity >= 0) {
            AssemblerLogger.setLevel(verbosity);
        }
        AssemblerLogger.debug("Assembler: {}", programName);

        SourceIndex sourceIndex = new SourceIndex(source, programName, tabWidth);
        try {
            // Phase 1: Lexical Analysis
            List<Token> tokens = TokenFilter.filter(new Lexer(source).scanTokens());

            // Phase 2: Parsing (items and label table)
            ParseResult parsed = new Parser(tokens, sourceIndex).parse();
            IrProgram program = parsed.program();

            // Phase 3: Layout (label offsets, capacity check)
            LayoutResult layout = new LayoutEngine().layout(program, parsed.labels());

            // Phase 4: Emission
            byte[] code = new Emitter().emit(program, parsed.labels());
            byte[] image = Arrays.copyOf(code, InstructionMemory.SIZE_BYTES);

            return new ProgramImage(programName, image, layout.instructionCount(), layout.labelToAddress(),
                    sourceLines(program, sourceIndex));
        } catch (LexicalException e) {
            throw failure(DiagnosticFactory.fromLexicalError(e, sourceIndex), sourceIndex, e);
        } catch (ParseException e) {
            throw failure(DiagnosticFactory.fromParseError(e, sourceIndex), sourceIndex, e);
        } catch (GeneratorException e) {
            throw failure(DiagnosticFactory.fromGeneratorError(e, sourceIndex), sourceIndex, e);
        }
    }

    private static List<SourceInfo> sourceLines(IrProgram program, SourceIndex sourceIndex) {
        List<SourceInfo> lines = new ArrayList<>();
        for (IrItem item : program.items()) {
            if (item instanceof IrInstruction ins) {
                LineInfo line = sourceIndex.lineOf(ins.span());
                lines.add(new SourceInfo(sourceIndex.fileName(), line.lineNumber(), line.column() + 1, line.lineText()));
            }
        }
        return lines;
    }

    private static AssemblyException failure(Diagnostic diagnostic, SourceIndex sourceIndex, Exception cause) {
        AssemblerLogger.debug("Assembler: {} failed with {}", sourceIndex.fileName(), diagnostic);
        return new AssemblyException(diagnostic, DiagnosticRenderer.render(diagnostic, sourceIndex), cause);
    }
}
