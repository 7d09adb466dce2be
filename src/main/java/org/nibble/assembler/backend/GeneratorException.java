package org.nibble.assembler.backend;

import org.nibble.assembler.api.AssemblerErrorCode;
import org.nibble.assembler.frontend.source.Span;

import java.util.Optional;

/**
 * A layout or encoding error found by the backend. Generation stops at the first one.
 */
public class GeneratorException extends Exception {

    private final AssemblerErrorCode code;
    private final Span span;

    /**
     * @param code The error code.
     * @param span The source location, or {@code null} for errors that concern the whole program.
     */
    public GeneratorException(AssemblerErrorCode code, Span span) {
        super(code + (span != null ? " at " + span : ""));
        this.code = code;
        this.span = span;
    }

    public AssemblerErrorCode code() {
        return code;
    }

    public Optional<Span> span() {
        return Optional.ofNullable(span);
    }
}
