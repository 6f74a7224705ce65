package org.stencil.compiler.api;

/**
 * Defines the public, clean interface for the Stencil template compiler.
 * Implementations must be safe for concurrent use by independent threads.
 */
public interface ICompiler {

    /**
     * Compiles the given template source.
     *
     * @param source The template text.
     * @param sourceId A name for the template, used in diagnostics and debug maps.
     * @param options The option set the unit starts with; inline overrides may change it further.
     * @return A {@link CompiledArtifact} containing the output and all associated metadata.
     * @throws CompilationException if errors occur during the compilation process.
     */
    CompiledArtifact compile(String source, String sourceId, CompilationOptions options) throws CompilationException;
}
