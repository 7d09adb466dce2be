package org.nibble.assembler.ir;

/**
 * Marker interface for the items the parser emits and the backend consumes.
 * The order of items determines the byte offset of every instruction.
 */
public sealed interface IrItem permits IrLabelDef, IrInstruction {}
