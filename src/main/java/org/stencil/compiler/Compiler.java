package org.stencil.compiler;

import org.stencil.compiler.api.CompilationException;
import org.stencil.compiler.api.CompilationOptions;
import org.stencil.compiler.api.CompiledArtifact;
import org.stencil.compiler.api.ICompiler;
import org.stencil.compiler.backend.emit.CodeGenerator;
import org.stencil.compiler.backend.optimize.AssetPublisher;
import org.stencil.compiler.backend.optimize.IOptimizationPass;
import org.stencil.compiler.backend.optimize.PassContext;
import org.stencil.compiler.backend.optimize.PassRegistry;
import org.stencil.compiler.diagnostics.CompilerLogger;
import org.stencil.compiler.diagnostics.DiagnosticsEngine;
import org.stencil.compiler.diagnostics.PhaseAbortedException;
import org.stencil.compiler.frontend.directive.DirectiveRegistry;
import org.stencil.compiler.frontend.directive.DirectiveSettings;
import org.stencil.compiler.frontend.lexer.Lexer;
import org.stencil.compiler.frontend.lexer.Token;
import org.stencil.compiler.frontend.parser.Parser;
import org.stencil.compiler.frontend.parser.ast.DocumentNode;
import org.stencil.compiler.frontend.structure.StructuralNormalizer;
import org.stencil.compiler.options.OptionTimeline;

import java.util.List;
import java.util.Optional;

/**
 * The main compiler implementation. This class orchestrates the entire compilation
 * pipeline from template source to a compiled artifact.
 * <p>
 * It holds only immutable collaborators and creates the diagnostics of each compilation in
 * {@link #compile}, so independent threads may share one instance.
 */
public class Compiler implements ICompiler {

    private final DirectiveRegistry registry;
    private final PassRegistry passes;
    private final AssetPublisher publisher;

    /**
     * Creates a compiler with the built-in directives, the default passes and no asset publisher.
     */
    public Compiler() {
        this(DirectiveRegistry.initialize(DirectiveSettings.defaults()), PassRegistry.initializeWithDefaults(), null);
    }

    /**
     * @param registry The directive registry.
     * @param passes The optimization passes in application order.
     * @param publisher The publisher for packed external assets, or {@code null} if none is configured.
     */
    public Compiler(DirectiveRegistry registry, PassRegistry passes, AssetPublisher publisher) {
        this.registry = registry;
        this.passes = passes;
        this.publisher = publisher;
    }

    @Override
    public CompiledArtifact compile(String source, String sourceId, CompilationOptions options) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        try {
            // Phase 1: Lexical Analysis
            List<Token> tokens = new Lexer(source, diagnostics, sourceId, registry).scanTokens();
            failOnErrors(diagnostics);

            // Phase 2: Parsing (builds the directive tree)
            DocumentNode document = new Parser(tokens, diagnostics, registry).parse();
            failOnErrors(diagnostics);

            // Phase 3: Option timeline from inline overrides
            OptionTimeline timeline = OptionTimeline.build(document, options);

            // Phase 4: Structural normalization (element tree, balance checks)
            document = new StructuralNormalizer(registry, timeline, diagnostics).normalize(document);
            failOnErrors(diagnostics);

            // Phase 5: Optimization passes
            PassContext context = new PassContext(registry, timeline, diagnostics, Optional.ofNullable(publisher), sourceId);
            for (IOptimizationPass pass : passes.passes()) {
                document = pass.apply(document, context);
                failOnErrors(diagnostics);
            }

            // Phase 6: Code generation
            CompiledArtifact artifact = new CodeGenerator().generate(document, sourceId, timeline, options,
                    diagnostics.getWarnings());
            CompilerLogger.debug("Compiler: " + sourceId + " " + options + " -> " + artifact.output().length() + " chars");
            return artifact;
        } catch (PhaseAbortedException e) {
            throw new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics());
        }
    }

    private static void failOnErrors(DiagnosticsEngine diagnostics) throws CompilationException {
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics());
        }
    }
}
