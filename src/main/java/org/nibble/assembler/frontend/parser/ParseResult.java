package org.nibble.assembler.frontend.parser;

import org.nibble.assembler.frontend.semantics.LabelTable;
import org.nibble.assembler.ir.IrProgram;

/**
 * Output of the parser: the ordered items and the label table they refer to.
 *
 * @param program The parsed items.
 * @param labels The labels defined or referenced by the program.
 */
public record ParseResult(IrProgram program, LabelTable labels) {}
