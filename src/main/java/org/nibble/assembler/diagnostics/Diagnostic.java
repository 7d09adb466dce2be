package org.nibble.assembler.diagnostics;

import org.nibble.assembler.api.AssemblerErrorCode;
import org.nibble.assembler.frontend.source.Span;

import java.util.Locale;
import java.util.Optional;

/**
 * Represents the single diagnostic message an assembly run reports.
 *
 * @param type The type of the diagnostic.
 * @param code The error code, for programmatic checks.
 * @param message The rendered label, e.g. {@code Duplicate label `a:`}.
 * @param span The source location the label points at, or {@code null} if it concerns the whole program.
 */
public record Diagnostic(
        Type type,
        AssemblerErrorCode code,
        String message,
        Span span
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents assembly. */
        ERROR;

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Creates an error diagnostic.
     * @param code The error code.
     * @param message The label.
     * @param span The location, may be {@code null}.
     * @return The diagnostic.
     */
    public static Diagnostic error(AssemblerErrorCode code, String message, Span span) {
        return new Diagnostic(Type.ERROR, code, message, span);
    }

    public Optional<Span> location() {
        return Optional.ofNullable(span);
    }

    /**
     * @return The headline, e.g. {@code error: Dangling label `end:`}.
     */
    public String headline() {
        return type + ": " + message;
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", type, code, message);
    }
}
