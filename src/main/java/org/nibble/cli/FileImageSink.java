package org.nibble.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes images to the file system, creating missing parent directories.
 */
public class FileImageSink implements ImageSink {

    @Override
    public void write(Path target, byte[] image) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(target, image);
    }
}
