package org.stencil.compiler.frontend.parser.ast;

import org.stencil.compiler.api.SourceSpan;

import java.util.List;

/**
 * The start tag of an element closed in another node sequence, e.g. inside a sibling branch.
 *
 * @param tagName The tag name as written.
 * @param attributes The attribute items, as in {@link ElementNode}.
 * @param pair The pair shared with the matching {@link EndTagNode}.
 * @param span The source region.
 */
public record StartTagNode(String tagName, List<Node> attributes, TagPair pair, SourceSpan span) implements Node {

    public StartTagNode {
        attributes = List.copyOf(attributes);
    }

    /**
     * @return The lower-case tag name.
     */
    public String name() {
        return HtmlElements.normalize(tagName);
    }

    /**
     * @param newAttributes The replacement attribute items.
     * @return A copy with the given attribute items.
     */
    public StartTagNode withAttributes(List<Node> newAttributes) {
        return new StartTagNode(tagName, newAttributes, pair, span);
    }
}
