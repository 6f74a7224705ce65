package org.stencil.compiler.frontend.parser.ast;

import org.stencil.compiler.api.SourceSpan;

/**
 * Literal text. Before normalization it holds raw markup; afterwards only the parts that are
 * not tags, attributes or comments.
 *
 * @param text The literal text.
 * @param span The source region.
 */
public record TextNode(String text, SourceSpan span) implements Node {

    /**
     * @return {@code true} if the text consists of whitespace only.
     */
    public boolean isBlank() {
        return text.isBlank();
    }
}
