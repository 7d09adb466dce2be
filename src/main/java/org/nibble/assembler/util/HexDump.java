package org.nibble.assembler.util;

import java.util.Locale;

/**
 * Formats byte arrays as offset-prefixed hex lines, e.g. {@code 0000: 11 20 00 00}.
 */
public final class HexDump {

    /** Bytes per line when none is configured. */
    public static final int DEFAULT_BYTES_PER_LINE = 16;

    private HexDump() {}

    public static String format(byte[] data) {
        return format(data, DEFAULT_BYTES_PER_LINE);
    }

    /**
     * @param data The bytes to dump.
     * @param bytesPerLine The number of bytes per output line.
     * @return The dump, one line per row, each terminated by {@code '\n'}.
     */
    public static String format(byte[] data, int bytesPerLine) {
        if (bytesPerLine < 1) {
            throw new IllegalArgumentException("bytesPerLine must be positive: " + bytesPerLine);
        }
        StringBuilder sb = new StringBuilder();
        for (int offset = 0; offset < data.length; offset += bytesPerLine) {
            sb.append(String.format(Locale.ROOT, "%04x:", offset));
            int end = Math.min(offset + bytesPerLine, data.length);
            for (int i = offset; i < end; i++) {
                sb.append(String.format(Locale.ROOT, " %02x", data[i] & 0xFF));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * @param data The bytes to encode.
     * @return The bytes as one lower-case hex string without separators.
     */
    public static String toHexString(byte[] data) {
        StringBuilder sb = new StringBuilder(data.length * 2);
        for (byte b : data) {
            sb.append(String.format(Locale.ROOT, "%02x", b & 0xFF));
        }
        return sb.toString();
    }
}
