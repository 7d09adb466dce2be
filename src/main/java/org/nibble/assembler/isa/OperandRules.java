package org.nibble.assembler.isa;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.nibble.assembler.isa.OperandKind.INTEGER;
import static org.nibble.assembler.isa.OperandKind.LABEL;
import static org.nibble.assembler.isa.OperandKind.REGISTER;

/**
 * Static operand table: for every opcode, the ordered list of operand positions and
 * the kinds each position accepts. Built once and never modified.
 */
public final class OperandRules {

    private static final OperandRule REG = OperandRule.of(REGISTER);
    private static final OperandRule IMM = OperandRule.of(INTEGER);
    private static final OperandRule TARGET = OperandRule.of(INTEGER, LABEL);

    private static final Map<Opcode, List<OperandRule>> RULES = buildRules();

    private OperandRules() {}

    private static Map<Opcode, List<OperandRule>> buildRules() {
        Map<Opcode, List<OperandRule>> rules = new EnumMap<>(Opcode.class);
        rules.put(Opcode.NOP, List.of());
        rules.put(Opcode.ADD, List.of(REG, REG));
        rules.put(Opcode.LDI, List.of(REG, IMM));
        rules.put(Opcode.SUB, List.of(REG, REG));
        rules.put(Opcode.AND, List.of(REG, REG));
        rules.put(Opcode.OR, List.of(REG, REG));
        rules.put(Opcode.INV, List.of(REG));
        rules.put(Opcode.XOR, List.of(REG, REG));
        rules.put(Opcode.SR, List.of(REG, REG));
        rules.put(Opcode.SL, List.of(REG, REG));
        rules.put(Opcode.IN, List.of(REG, IMM));
        rules.put(Opcode.OUT, List.of(REG, IMM));
        rules.put(Opcode.JZ, List.of(REG, TARGET));
        rules.put(Opcode.JLT, List.of(REG, TARGET));
        rules.put(Opcode.J, List.of(TARGET));

        for (Opcode opcode : Opcode.values()) {
            if (!rules.containsKey(opcode)) {
                throw new IllegalStateException("Internal assembler error: no operand rule for " + opcode);
            }
        }
        return Collections.unmodifiableMap(rules);
    }

    /**
     * @param opcode The opcode to look up.
     * @return The operand rules in position order; empty for opcodes without operands.
     */
    public static List<OperandRule> of(Opcode opcode) {
        return RULES.get(opcode);
    }

    /**
     * @param opcode The opcode to look up.
     * @return The number of operands the opcode takes (0, 1 or 2).
     */
    public static int arity(Opcode opcode) {
        return RULES.get(opcode).size();
    }
}
