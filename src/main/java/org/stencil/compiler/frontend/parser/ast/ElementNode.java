package org.stencil.compiler.frontend.parser.ast;

import org.stencil.compiler.api.SourceSpan;

import java.util.List;

/**
 * An HTML element whose start and end tag live in the same node sequence.
 *
 * @param tagName The tag name as written.
 * @param attributes The attribute items: attributes, whitespace, expressions, comments and
 *                   directives whose branches hold attribute items.
 * @param selfClosing {@code true} if the start tag ends with {@code />}.
 * @param isVoid {@code true} if the element cannot have content.
 * @param children The content.
 * @param endTag The end tag text as written, or {@code null} if it was implied or absent.
 * @param span The source region of the start tag.
 */
public record ElementNode(
        String tagName,
        List<Node> attributes,
        boolean selfClosing,
        boolean isVoid,
        List<Node> children,
        String endTag,
        SourceSpan span
) implements Node {

    public ElementNode {
        attributes = List.copyOf(attributes);
        children = List.copyOf(children);
    }

    /**
     * @return The lower-case tag name.
     */
    public String name() {
        return HtmlElements.normalize(tagName);
    }

    /**
     * @return {@code true} if the element has an end tag in the output.
     */
    public boolean hasEndTag() {
        return !isVoid && !selfClosing;
    }

    /**
     * @param newChildren The replacement content.
     * @return A copy with the given content.
     */
    public ElementNode withChildren(List<Node> newChildren) {
        return new ElementNode(tagName, attributes, selfClosing, isVoid, newChildren, endTag, span);
    }

    /**
     * @param newAttributes The replacement attribute items.
     * @return A copy with the given attribute items.
     */
    public ElementNode withAttributes(List<Node> newAttributes) {
        return new ElementNode(tagName, newAttributes, selfClosing, isVoid, children, endTag, span);
    }

    /**
     * @param newEndTag The replacement end tag text.
     * @return A copy with the given end tag.
     */
    public ElementNode withEndTag(String newEndTag) {
        return new ElementNode(tagName, attributes, selfClosing, isVoid, children, newEndTag, span);
    }

    @Override
    public List<Node> getChildren() {
        return children;
    }
}
