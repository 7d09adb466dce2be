package org.nibble.assembler.ir;

import org.nibble.assembler.frontend.source.Span;

/**
 * Symbolic label reference. Resolution to a byte offset happens in the backend.
 */
public record IrLabelRef(int labelId, Span span) implements IrOperand {}
