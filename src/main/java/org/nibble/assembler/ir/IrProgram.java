package org.nibble.assembler.ir;

import java.util.List;

/**
 * Linear IR program container. The order of items is the emission order
 * as produced by the parser and must be preserved by the backend.
 */
public record IrProgram(List<IrItem> items) {

    public IrProgram {
        items = List.copyOf(items);
    }
}
