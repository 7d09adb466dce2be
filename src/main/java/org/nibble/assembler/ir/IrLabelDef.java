package org.nibble.assembler.ir;

/**
 * Label definition in the IR stream. It binds the label to the next instruction.
 *
 * @param labelId The label's id in the {@link org.nibble.assembler.frontend.semantics.LabelTable}.
 */
public record IrLabelDef(int labelId) implements IrItem {}
