package org.nibble.assembler.ir;

import org.nibble.assembler.frontend.source.Span;

/**
 * Immediate operand holding a signed 8-bit value.
 */
public record IrImm(byte value, Span span) implements IrOperand {}
