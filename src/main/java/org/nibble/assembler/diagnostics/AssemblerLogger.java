package org.nibble.assembler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal assembler-internal logger with integer verbosity levels on top of SLF4J.
 * Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE
 * <p>
 * The verbosity gate sits in front of the SLF4J level, so a message is written only if
 * both the assembler verbosity and the Logback configuration allow it.
 */
public final class AssemblerLogger {

    /** Log level for errors. */
    public static final int ERROR = 0;
    /** Log level for warnings. */
    public static final int WARN  = 1;
    /** Log level for informational messages. */
    public static final int INFO  = 2;
    /** Log level for debug messages. */
    public static final int DEBUG = 3;
    /** Log level for trace messages. */
    public static final int TRACE = 4;
    private static volatile int level = INFO;

    private static final Logger logger = LoggerFactory.getLogger(AssemblerLogger.class);

    private AssemblerLogger() {}

    /**
     * Sets the logging verbosity level, clamped to ERROR..TRACE.
     * @param newLevel The new level to set.
     */
    public static void setLevel(int newLevel) { level = Math.max(ERROR, Math.min(TRACE, newLevel)); }

    /**
     * @return The current verbosity level.
     */
    public static int getLevel() { return level; }

    public static void error(String msg) {
        if (level >= ERROR) logger.error(msg);
    }

    public static void warn(String msg) {
        if (level >= WARN) logger.warn(msg);
    }

    public static void info(String msg) {
        if (level >= INFO) logger.info(msg);
    }

    public static void debug(String format, Object... args) {
        if (level >= DEBUG) logger.debug(format, args);
    }

    public static void trace(String format, Object... args) {
        if (level >= TRACE) logger.trace(format, args);
    }
}
