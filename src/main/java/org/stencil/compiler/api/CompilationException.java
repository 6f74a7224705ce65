package org.stencil.compiler.api;

import org.stencil.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * An exception that is thrown when one or more errors occur during the compilation process.
 * <p>
 * It is part of the public API and carries the diagnostics collected up to the failing phase.
 */
public class CompilationException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        super(message, null);
        this.diagnostics = List.of();
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(String message, Throwable cause) {
        super(message, cause);
        this.diagnostics = List.of();
    }

    /**
     * Constructs a new compilation exception from the diagnostics of a failed phase.
     * @param message The detail message, usually the diagnostics summary.
     * @param diagnostics The collected diagnostics.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics) {
        super(message, null);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The diagnostics that caused this exception, possibly empty.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * @return The error kind of the first error diagnostic, or {@code null} if none is attached.
     */
    public ErrorKind kind() {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR)
                .map(d -> d.code().kind())
                .findFirst()
                .orElse(null);
    }
}
