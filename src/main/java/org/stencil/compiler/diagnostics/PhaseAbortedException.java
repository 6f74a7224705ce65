package org.stencil.compiler.diagnostics;

/**
 * Thrown inside a compiler phase when an error has been reported to the
 * {@link DiagnosticsEngine} and the phase cannot continue. The compiler catches it
 * at the phase boundary and turns the collected diagnostics into a
 * {@link org.stencil.compiler.api.CompilationException}.
 */
public class PhaseAbortedException extends RuntimeException {

    /**
     * @param message The message of the error that aborted the phase.
     */
    public PhaseAbortedException(String message) {
        super(message, null, false, false);
    }
}
