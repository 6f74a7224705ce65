package org.stencil.compiler.diagnostics;

import org.stencil.compiler.api.CompilerErrorCode;
import org.stencil.compiler.api.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur during the compilation process.
 * <p>
 * This decouples error reporting from the actual compiler logic (parser, etc.).
 * One engine is created per compilation unit; it is not shared between threads.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code    The error code.
     * @param message The error message.
     * @param span    The source region of the error.
     */
    public void reportError(CompilerErrorCode code, String message, SourceSpan span) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, span));
    }

    /**
     * Reports a warning.
     *
     * @param code    The error code of the downgraded rule.
     * @param message The warning message.
     * @param span    The source region of the warning.
     */
    public void reportWarning(CompilerErrorCode code, String message, SourceSpan span) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, code, message, span));
    }

    /**
     * Reports an error and aborts the running phase.
     *
     * @param code    The error code.
     * @param message The error message.
     * @param span    The source region of the error.
     * @return Never returns normally; declared so callers can write {@code throw diagnostics.abort(...)}.
     * @throws PhaseAbortedException always.
     */
    public PhaseAbortedException abort(CompilerErrorCode code, String message, SourceSpan span) {
        reportError(code, message, span);
        throw new PhaseAbortedException(message);
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return All diagnostics of type {@link Diagnostic.Type#WARNING}.
     */
    public List<Diagnostic> getWarnings() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.WARNING).toList();
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
