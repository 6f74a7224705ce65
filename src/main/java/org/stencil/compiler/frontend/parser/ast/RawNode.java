package org.stencil.compiler.frontend.parser.ast;

import org.stencil.compiler.api.SourceSpan;

/**
 * The content of a {@code {% !raw %}} block. Opaque to every pass.
 *
 * @param content The verbatim content between the markers.
 * @param span The source region including the markers.
 */
public record RawNode(String content, SourceSpan span) implements Node {
}
