package org.nibble.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Typed view of the {@code assembler} block of the HOCON configuration.
 * Defaults live in {@code reference.conf}.
 *
 * @param tabWidth Columns a tab is rendered as in diagnostic excerpts.
 * @param outputExtension Extension of the derived output file, without the dot.
 * @param hexDump Whether a hex dump is printed after a successful run.
 * @param hexDumpBytesPerLine Bytes per hex dump line.
 */
public record AssemblerSettings(int tabWidth, String outputExtension, boolean hexDump, int hexDumpBytesPerLine) {

    private static final String ASSEMBLER_CONFIG_PATH = "assembler";

    public AssemblerSettings {
        if (tabWidth < 1) {
            throw new IllegalArgumentException("assembler.tab-width must be positive: " + tabWidth);
        }
        if (hexDumpBytesPerLine < 1) {
            throw new IllegalArgumentException("assembler.hex-dump-bytes-per-line must be positive: " + hexDumpBytesPerLine);
        }
        if (outputExtension.startsWith(".")) {
            outputExtension = outputExtension.substring(1);
        }
        if (outputExtension.isBlank() || outputExtension.contains("/") || outputExtension.contains("\\")) {
            throw new IllegalArgumentException("assembler.output-extension is not a valid extension: '" + outputExtension + "'");
        }
    }

    /**
     * Reads the settings from a resolved configuration.
     * @param config The application configuration; must contain the {@code assembler} block.
     * @return The settings.
     * @throws ConfigException if a key is missing or has the wrong type.
     */
    public static AssemblerSettings from(Config config) {
        Config assembler = config.getConfig(ASSEMBLER_CONFIG_PATH);
        return new AssemblerSettings(
                assembler.getInt("tab-width"),
                assembler.getString("output-extension"),
                assembler.getBoolean("hex-dump"),
                assembler.getInt("hex-dump-bytes-per-line"));
    }
}
