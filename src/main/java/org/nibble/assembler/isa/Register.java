package org.nibble.assembler.isa;

import java.util.Locale;
import java.util.Optional;

/**
 * The sixteen general-purpose registers. The encoding is written out per constant and
 * does not depend on declaration order.
 */
public enum Register {
    R0(0), R1(1), R2(2), R3(3),
    R4(4), R5(5), R6(6), R7(7),
    R8(8), R9(9), R10(10), R11(11),
    R12(12), R13(13), R14(14), R15(15);

    private final int encoding;

    Register(int encoding) {
        this.encoding = encoding;
    }

    /**
     * @return The 4-bit register number.
     */
    public int encode() {
        return encoding;
    }

    /**
     * Parses a register name such as {@code r7}, ignoring case.
     * @param text The candidate text.
     * @return The register, or empty if the text names none.
     */
    public static Optional<Register> fromName(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (Register register : values()) {
            if (register.name().toLowerCase(Locale.ROOT).equals(lower)) {
                return Optional.of(register);
            }
        }
        return Optional.empty();
    }
}
