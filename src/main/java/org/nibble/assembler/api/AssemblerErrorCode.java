package org.nibble.assembler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during assembly.
 * This decouples the test logic from the rendered messages.
 */
public enum AssemblerErrorCode {
    // region Lexical Errors
    /** A character that cannot start any token. */
    INVALID_TOKEN,
    /** A digit run containing letters, such as {@code 12ab}. */
    INVALID_INTEGER,
    // endregion

    // region Parser Errors
    /** A token other than the expected one was found. */
    UNEXPECTED_TOKEN,
    /** The input ended where a specific token was required. */
    MISSING_TOKEN,
    /** An identifier in instruction position is no known mnemonic. */
    INVALID_INSTRUCTION,
    /** A label directly follows another label with no instruction in between. */
    EXPECTED_INSTRUCTION_BEFORE_LABEL,
    /** A label is defined more than once. */
    DUPLICATE_LABEL,
    /** A line starts with something other than a label, a mnemonic or a newline. */
    EXPECTED_INSTRUCTION,
    /** An instruction without operands is followed by more tokens. */
    EXPECTED_NO_OPERANDS,
    /** The input ended where an operand was required. */
    EXPECTED_OPERAND_FOUND_EOF,
    /** A token of the wrong kind was found in operand position. */
    EXPECTED_OPERAND,
    /** An identifier in register-only position is no register name. */
    EXPECTED_REGISTER,
    /** An integer literal does not fit into a signed 8-bit value. */
    INTEGER_OUT_OF_RANGE,
    // endregion

    // region Generator Errors
    /** An IN/OUT port outside 0-15. */
    SOURCE_OR_SINK_RANGE,
    /** A label at the end of the program with no instruction to bind to. */
    DANGLING_LABEL,
    /** The program has more instructions than the instruction memory holds. */
    MAXIMUM_INSTRUCTIONS,
    /** A label was referenced but never defined. */
    UNDEFINED_LABEL,
    /** A numeric jump destination outside the instruction memory. */
    JUMP_DESTINATION_RANGE,
    // endregion

    // region General Errors
    /** An I/O error occurred while reading the source file. */
    IO_ERROR_READING_FILE
    // endregion
}
