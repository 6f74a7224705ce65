package org.stencil.compiler.api;

import org.stencil.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * The immutable result of compiling one template.
 *
 * @param sourceId The identity of the compiled template.
 * @param output The compact directive+text output.
 * @param debugMap The marker mappings, empty unless compiled in debug mode.
 * @param options The option set the unit was compiled with.
 * @param warnings Non-fatal diagnostics reported during compilation.
 */
public record CompiledArtifact(
        String sourceId,
        String output,
        List<DebugMapEntry> debugMap,
        CompilationOptions options,
        List<Diagnostic> warnings
) {
    public CompiledArtifact {
        debugMap = List.copyOf(debugMap);
        warnings = List.copyOf(warnings);
    }
}
