package org.nibble.assembler.api;

import org.nibble.assembler.isa.InstructionMemory;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The result of a successful assembly: the full instruction memory image plus metadata.
 * Instances are immutable; {@link #image()} returns a copy.
 */
public final class ProgramImage {

    private final String programName;
    private final byte[] image;
    private final int instructionCount;
    private final Map<String, Integer> labelOffsets;
    private final List<SourceInfo> sourceLines;

    /**
     * @param programName The name the program was assembled under.
     * @param image Exactly {@link InstructionMemory#SIZE_BYTES} bytes.
     * @param instructionCount The number of encoded instructions.
     * @param labelOffsets The resolved offset of every label, in definition order.
     * @param sourceLines The source position of each instruction, indexed by instruction number.
     */
    public ProgramImage(String programName, byte[] image, int instructionCount,
                        Map<String, Integer> labelOffsets, List<SourceInfo> sourceLines) {
        if (image.length != InstructionMemory.SIZE_BYTES) {
            throw new IllegalArgumentException("Image must be " + InstructionMemory.SIZE_BYTES + " bytes, was " + image.length);
        }
        this.programName = programName;
        this.image = image.clone();
        this.instructionCount = instructionCount;
        this.labelOffsets = Collections.unmodifiableMap(new LinkedHashMap<>(labelOffsets));
        this.sourceLines = List.copyOf(sourceLines);
    }

    public String programName() {
        return programName;
    }

    /**
     * @return A copy of the 64-byte image; bytes past {@code 2 * instructionCount()} are zero.
     */
    public byte[] image() {
        return image.clone();
    }

    public int instructionCount() {
        return instructionCount;
    }

    public Map<String, Integer> labelOffsets() {
        return labelOffsets;
    }

    public List<SourceInfo> sourceLines() {
        return sourceLines;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProgramImage that = (ProgramImage) o;
        return instructionCount == that.instructionCount
                && programName.equals(that.programName)
                && Arrays.equals(image, that.image)
                && labelOffsets.equals(that.labelOffsets);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(image) + programName.hashCode();
    }

    @Override
    public String toString() {
        return "ProgramImage{name='" + programName + "', instructions=" + instructionCount + ", labels=" + labelOffsets + '}';
    }
}
