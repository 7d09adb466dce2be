package org.nibble.assembler.isa;

/**
 * Fixed dimensions of the target machine's instruction memory.
 */
public final class InstructionMemory {

    /** Size of the instruction memory and of every output image. */
    public static final int SIZE_BYTES = 64;
    /** Every instruction encodes to exactly two bytes. */
    public static final int INSTRUCTION_SIZE_BYTES = 2;
    /** Number of instruction slots. */
    public static final int MAX_INSTRUCTIONS = SIZE_BYTES / INSTRUCTION_SIZE_BYTES;
    /** Largest port number an IN/OUT instruction can address. */
    public static final int MAX_PORT = 0b1111;

    private InstructionMemory() {}
}
