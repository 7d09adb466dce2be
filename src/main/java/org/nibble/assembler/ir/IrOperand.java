package org.nibble.assembler.ir;

import org.nibble.assembler.frontend.source.Span;

/**
 * Base type for instruction operands. The span is the operand's source location and
 * is used only for diagnostics.
 */
public sealed interface IrOperand permits IrReg, IrImm, IrLabelRef {

    Span span();
}
