package org.stencil.compiler.diagnostics;

import org.stencil.compiler.api.CompilerErrorCode;
import org.stencil.compiler.api.SourceSpan;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs during the compilation process.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The error code identifying the rule that was violated.
 * @param message The diagnostic message.
 * @param span The source region the diagnostic refers to.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message,
        SourceSpan span
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        if (span == null) {
            return String.format("[%s] %s: %s", type, code, message);
        }
        return String.format("[%s] %s:%d:%d: %s", type, span.fileName(), span.line(), span.column(), message);
    }
}
