package org.nibble.assembler.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface of the assembler.
 */
public interface IAssembler {

    /**
     * Assembles one source unit.
     *
     * @param source The complete source text.
     * @param programName The name shown in diagnostics, usually the file name.
     * @return The 64-byte image and its metadata.
     * @throws AssemblyException on the first lexical, syntax or generation error.
     */
    ProgramImage assemble(String source, String programName) throws AssemblyException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=errors only .. 4=trace).
     */
    void setVerbosity(int level);

    /**
     * Assembles the source code from a file read as UTF-8.
     * @param sourcePath The path to the source file.
     * @return The assembled image.
     * @throws AssemblyException if assembly fails.
     * @throws IOException if the file cannot be read.
     */
    default ProgramImage assemble(Path sourcePath) throws AssemblyException, IOException {
        return assemble(Files.readString(sourcePath, StandardCharsets.UTF_8), sourcePath.toString());
    }
}
