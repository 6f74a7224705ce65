package org.stencil.compiler.frontend.parser.ast;

import org.stencil.compiler.api.SourceSpan;

/**
 * An opaque {@code {{ expr }}}; never evaluated.
 *
 * @param expression The trimmed expression text.
 * @param span The source region.
 */
public record ExpressionNode(String expression, SourceSpan span) implements Node {
}
