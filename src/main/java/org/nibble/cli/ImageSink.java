package org.nibble.cli;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Persists an assembled instruction image.
 */
public interface ImageSink {

    /**
     * @param target The destination file.
     * @param image The 64-byte image.
     * @throws IOException if the image cannot be written.
     */
    void write(Path target, byte[] image) throws IOException;
}
