package org.nibble.assembler.api;

import org.nibble.assembler.diagnostics.Diagnostic;

/**
 * An exception that is thrown when assembly fails. It carries exactly one {@link Diagnostic},
 * the first error encountered, together with its rendered form.
 * <p>
 * It is part of the public API and hides the internal exception types of the assembler.
 */
public class AssemblyException extends Exception {

    private final Diagnostic diagnostic;
    private final String rendered;

    /**
     * @param diagnostic The diagnostic describing the failure.
     * @param rendered The diagnostic rendered with source locator and caret excerpt.
     * @param cause The internal exception, may be {@code null}.
     */
    public AssemblyException(Diagnostic diagnostic, String rendered, Throwable cause) {
        super(diagnostic.headline(), cause);
        this.diagnostic = diagnostic;
        this.rendered = rendered;
    }

    public Diagnostic diagnostic() {
        return diagnostic;
    }

    public AssemblerErrorCode code() {
        return diagnostic.code();
    }

    /**
     * @return The multi-line terminal rendering of the diagnostic.
     */
    public String rendered() {
        return rendered;
    }
}
