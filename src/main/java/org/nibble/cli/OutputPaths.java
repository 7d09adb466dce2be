package org.nibble.cli;

import java.nio.file.Path;

/**
 * Derives the default output file from the source file.
 */
public final class OutputPaths {

    private OutputPaths() {}

    /**
     * Replaces the last extension of the source file name, or appends one if there is none.
     * A leading dot (as in {@code .hidden}) is not treated as an extension separator.
     *
     * @param source The source file.
     * @param extension The output extension, without the dot.
     * @return The sibling path, e.g. {@code prog.s} → {@code prog.bin}.
     */
    public static Path derive(Path source, String extension) {
        Path fileName = source.getFileName();
        if (fileName == null) {
            throw new IllegalArgumentException("Source path has no file name: " + source);
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return source.resolveSibling(stem + "." + extension);
    }
}
