package org.stencil.compiler.backend.optimize;

import org.stencil.compiler.frontend.parser.ast.DocumentNode;

/**
 * Rewriter pass applied to the normalized tree before code generation.
 */
public interface IOptimizationPass {

    /**
     * Applies this pass to the given tree.
     *
     * @param document The normalized tree.
     * @param context  Registry, options and diagnostics of the unit being compiled.
     * @return The rewritten tree.
     */
    DocumentNode apply(DocumentNode document, PassContext context);
}
