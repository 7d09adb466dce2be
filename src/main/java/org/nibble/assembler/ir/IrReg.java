package org.nibble.assembler.ir;

import org.nibble.assembler.frontend.source.Span;
import org.nibble.assembler.isa.Register;

/**
 * Register operand.
 */
public record IrReg(Register register, Span span) implements IrOperand {}
