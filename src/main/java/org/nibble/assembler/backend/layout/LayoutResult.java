package org.nibble.assembler.backend.layout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of the layout pass.
 *
 * @param instructionCount The number of instructions in the program.
 * @param labelToAddress The resolved address of every defined label, in definition order.
 */
public record LayoutResult(int instructionCount, Map<String, Integer> labelToAddress) {

    public LayoutResult {
        labelToAddress = Collections.unmodifiableMap(new LinkedHashMap<>(labelToAddress));
    }
}
