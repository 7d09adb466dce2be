package org.nibble.assembler.backend.emit;

import org.nibble.assembler.api.AssemblerErrorCode;
import org.nibble.assembler.backend.GeneratorException;
import org.nibble.assembler.diagnostics.AssemblerLogger;
import org.nibble.assembler.frontend.semantics.LabelTable;
import org.nibble.assembler.ir.IrImm;
import org.nibble.assembler.ir.IrInstruction;
import org.nibble.assembler.ir.IrItem;
import org.nibble.assembler.ir.IrLabelRef;
import org.nibble.assembler.ir.IrOperand;
import org.nibble.assembler.ir.IrProgram;
import org.nibble.assembler.ir.IrReg;
import org.nibble.assembler.isa.InstructionMemory;
import org.nibble.assembler.isa.Opcode;
import org.nibble.assembler.isa.Register;

import java.io.ByteArrayOutputStream;

/**
 * Second backend pass: encodes every instruction into its two-byte form.
 * <p>
 * Byte 0 is {@code opcode << 4 | register}; byte 1 is either an 8-bit immediate, a second
 * register or a port in the high nibble, or zero. Label operands are replaced by the offsets
 * the {@link org.nibble.assembler.backend.layout.LayoutEngine} recorded in the label table,
 * so layout must have completed before emission.
 * <p>
 * Operand shapes the parser cannot produce raise {@link IllegalStateException}.
 */
public class Emitter {

    /**
     * Encodes the program.
     * @param program The parsed program.
     * @param labels The label table with resolved offsets.
     * @return Two bytes per instruction, without padding.
     * @throws GeneratorException on an undefined label or an out-of-range operand.
     */
    public byte[] emit(IrProgram program, LabelTable labels) throws GeneratorException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(InstructionMemory.SIZE_BYTES);

        for (IrItem item : program.items()) {
            if (item instanceof IrInstruction.NoOperand ins) {
                emitNoOperand(out, ins);
            } else if (item instanceof IrInstruction.SingleOperand ins) {
                emitSingleOperand(out, ins, labels);
            } else if (item instanceof IrInstruction.DoubleOperand ins) {
                emitDoubleOperand(out, ins, labels);
            }
        }

        byte[] code = out.toByteArray();
        AssemblerLogger.debug("Emitter: {} bytes", code.length);
        return code;
    }

    private void emitNoOperand(ByteArrayOutputStream out, IrInstruction.NoOperand ins) {
        if (ins.opcode() != Opcode.NOP) {
            throw internalError(ins);
        }
        // Everything but the opcode is ignored by the machine.
        writeImmediate(out, ins.opcode(), Register.R0, 0);
    }

    private void emitSingleOperand(ByteArrayOutputStream out, IrInstruction.SingleOperand ins, LabelTable labels)
            throws GeneratorException {
        IrOperand operand = ins.operand();
        switch (ins.opcode()) {
            case INV -> writeImmediate(out, ins.opcode(), register(operand, ins), 0);
            case J -> {
                // The register field of J is never read.
                if (operand instanceof IrImm imm) {
                    writeImmediate(out, ins.opcode(), Register.R0, imm.value());
                } else if (operand instanceof IrLabelRef ref) {
                    writeImmediate(out, ins.opcode(), Register.R0, resolve(ref, labels));
                } else {
                    throw internalError(ins);
                }
            }
            default -> throw internalError(ins);
        }
    }

    private void emitDoubleOperand(ByteArrayOutputStream out, IrInstruction.DoubleOperand ins, LabelTable labels)
            throws GeneratorException {
        Opcode opcode = ins.opcode();
        switch (opcode) {
            case ADD, SUB, AND, OR, XOR, SR, SL ->
                    writeDoubleRegister(out, opcode, register(ins.first(), ins), register(ins.second(), ins));
            case JZ, JLT -> {
                Register register = register(ins.first(), ins);
                if (ins.second() instanceof IrLabelRef ref) {
                    writeImmediate(out, opcode, register, resolve(ref, labels));
                } else if (ins.second() instanceof IrImm imm) {
                    if (imm.value() >= InstructionMemory.MAX_INSTRUCTIONS) {
                        throw new GeneratorException(AssemblerErrorCode.JUMP_DESTINATION_RANGE, imm.span());
                    }
                    writeImmediate(out, opcode, register, imm.value());
                } else {
                    throw internalError(ins);
                }
            }
            case LDI -> writeImmediate(out, opcode, register(ins.first(), ins), immediate(ins.second(), ins).value());
            case IN, OUT -> {
                Register register = register(ins.first(), ins);
                IrImm port = immediate(ins.second(), ins);
                int unsignedPort = port.value() & 0xFF;
                if (unsignedPort > InstructionMemory.MAX_PORT) {
                    throw new GeneratorException(AssemblerErrorCode.SOURCE_OR_SINK_RANGE, port.span());
                }
                writeImmediate(out, opcode, register, unsignedPort << 4);
            }
            default -> throw internalError(ins);
        }
    }

    private static int resolve(IrLabelRef ref, LabelTable labels) throws GeneratorException {
        Byte offset = labels.resolvedOffsetOf(ref.labelId()).orElse(null);
        if (offset == null) {
            throw new GeneratorException(AssemblerErrorCode.UNDEFINED_LABEL, ref.span());
        }
        return offset;
    }

    private static Register register(IrOperand operand, IrInstruction ins) {
        if (operand instanceof IrReg reg) {
            return reg.register();
        }
        throw internalError(ins);
    }

    private static IrImm immediate(IrOperand operand, IrInstruction ins) {
        if (operand instanceof IrImm imm) {
            return imm;
        }
        throw internalError(ins);
    }

    private static void writeImmediate(ByteArrayOutputStream out, Opcode opcode, Register register, int value) {
        out.write((opcode.encode() << 4) | register.encode());
        out.write(value & 0xFF);
    }

    private static void writeDoubleRegister(ByteArrayOutputStream out, Opcode opcode, Register first, Register second) {
        out.write((opcode.encode() << 4) | first.encode());
        out.write(second.encode() << 4);
    }

    private static IllegalStateException internalError(IrInstruction ins) {
        return new IllegalStateException("Internal assembler error: cannot encode " + ins);
    }
}
