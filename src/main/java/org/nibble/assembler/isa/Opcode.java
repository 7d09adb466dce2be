package org.nibble.assembler.isa;

import java.util.Locale;
import java.util.Optional;

/**
 * The fifteen operations of the target machine. Encoding 4 is reserved and unused,
 * so every constant carries its encoding explicitly.
 */
public enum Opcode {
    NOP(0),
    ADD(1),
    LDI(2),
    SUB(3),
    AND(5),
    OR(6),
    INV(7),
    XOR(8),
    SR(9),
    SL(10),
    IN(11),
    OUT(12),
    JZ(13),
    JLT(14),
    J(15);

    private final int encoding;

    Opcode(int encoding) {
        this.encoding = encoding;
    }

    /**
     * @return The 4-bit value placed in the high nibble of the first instruction byte.
     */
    public int encode() {
        return encoding;
    }

    /**
     * @return The lower-case mnemonic.
     */
    public String mnemonic() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a mnemonic, ignoring case.
     * @param text The candidate mnemonic.
     * @return The opcode, or empty if the text is no mnemonic.
     */
    public static Optional<Opcode> fromMnemonic(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (Opcode opcode : values()) {
            if (opcode.mnemonic().equals(lower)) {
                return Optional.of(opcode);
            }
        }
        return Optional.empty();
    }
}
