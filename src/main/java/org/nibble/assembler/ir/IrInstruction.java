package org.nibble.assembler.ir;

import org.nibble.assembler.frontend.source.Span;
import org.nibble.assembler.isa.Opcode;

import java.util.List;

/**
 * An instruction in the IR, one variant per operand arity.
 */
public sealed interface IrInstruction extends IrItem
        permits IrInstruction.NoOperand, IrInstruction.SingleOperand, IrInstruction.DoubleOperand {

    Opcode opcode();

    /**
     * @return The span of the mnemonic.
     */
    Span span();

    /**
     * @return The operands in source order.
     */
    List<IrOperand> operands();

    record NoOperand(Opcode opcode, Span span) implements IrInstruction {
        @Override
        public List<IrOperand> operands() {
            return List.of();
        }
    }

    record SingleOperand(Opcode opcode, IrOperand operand, Span span) implements IrInstruction {
        @Override
        public List<IrOperand> operands() {
            return List.of(operand);
        }
    }

    record DoubleOperand(Opcode opcode, IrOperand first, IrOperand second, Span span) implements IrInstruction {
        @Override
        public List<IrOperand> operands() {
            return List.of(first, second);
        }
    }
}
