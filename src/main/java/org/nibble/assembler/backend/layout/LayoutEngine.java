package org.nibble.assembler.backend.layout;

import org.nibble.assembler.api.AssemblerErrorCode;
import org.nibble.assembler.backend.GeneratorException;
import org.nibble.assembler.diagnostics.AssemblerLogger;
import org.nibble.assembler.frontend.semantics.LabelTable;
import org.nibble.assembler.frontend.source.Span;
import org.nibble.assembler.ir.IrInstruction;
import org.nibble.assembler.ir.IrItem;
import org.nibble.assembler.ir.IrLabelDef;
import org.nibble.assembler.ir.IrProgram;
import org.nibble.assembler.isa.InstructionMemory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * First backend pass: counts instructions and assigns every label the address of the
 * instruction that follows it. Operands are not looked at here; label references are
 * resolved by the {@link org.nibble.assembler.backend.emit.Emitter}.
 */
public final class LayoutEngine {

    /**
     * Lays out the program and records each label's address in the label table.
     * @param program The parsed program.
     * @param labels The label table produced by the parser; resolved offsets are written into it.
     * @return The instruction count and the label addresses.
     * @throws GeneratorException if the program exceeds the instruction memory or ends on a label.
     */
    public LayoutResult layout(IrProgram program, LabelTable labels) throws GeneratorException {
        Map<String, Integer> labelToAddress = new LinkedHashMap<>();
        int address = 0;
        IrLabelDef trailingLabel = null;

        for (IrItem item : program.items()) {
            if (item instanceof IrLabelDef lbl) {
                trailingLabel = lbl;
                labels.setResolvedOffset(lbl.labelId(), (byte) address);
                labelToAddress.put(labels.get(lbl.labelId()).name(), address);
            } else if (item instanceof IrInstruction) {
                trailingLabel = null;
                address++;
                if (address > InstructionMemory.MAX_INSTRUCTIONS) {
                    throw new GeneratorException(AssemblerErrorCode.MAXIMUM_INSTRUCTIONS, null);
                }
            }
        }

        if (trailingLabel != null) {
            int id = trailingLabel.labelId();
            Span span = labels.definitionSpanOf(id).orElseThrow(() ->
                    new IllegalStateException("Internal assembler error: label " + labels.get(id).name() + " has no definition span"));
            throw new GeneratorException(AssemblerErrorCode.DANGLING_LABEL, span);
        }

        AssemblerLogger.debug("Layout: {} instructions, labels {}", address, labelToAddress);
        return new LayoutResult(address, labelToAddress);
    }
}
