package org.stencil.compiler.frontend.parser.ast;

import org.stencil.compiler.api.SourceSpan;

/**
 * The end tag of an element opened in another node sequence.
 *
 * @param tagName The tag name.
 * @param text The end tag as written, or {@code null} if implied.
 * @param pair The pair shared with the matching {@link StartTagNode}s.
 * @param span The source region.
 */
public record EndTagNode(String tagName, String text, TagPair pair, SourceSpan span) implements Node {

    /**
     * @return The lower-case tag name.
     */
    public String name() {
        return HtmlElements.normalize(tagName);
    }
}
