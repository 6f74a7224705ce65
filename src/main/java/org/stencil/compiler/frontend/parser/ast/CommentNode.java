package org.stencil.compiler.frontend.parser.ast;

import org.stencil.compiler.api.SourceSpan;

import java.util.List;

/**
 * A template comment {@code {# #}} or an HTML comment {@code <!-- -->}.
 *
 * @param kind The comment kind.
 * @param parts For HTML comments the content between the delimiters, which may contain
 *              template nodes; for template comments a single text node.
 * @param span The source region.
 */
public record CommentNode(Kind kind, List<Node> parts, SourceSpan span) implements Node {

    /**
     * The kind of comment.
     */
    public enum Kind {
        /** {@code {# #}}; never part of the output. */
        TEMPLATE,
        /** {@code <!-- -->}. */
        HTML
    }

    public CommentNode {
        parts = List.copyOf(parts);
    }

    /**
     * @return {@code true} for Internet Explorer conditional comments, which must be kept.
     */
    public boolean isConditional() {
        return kind == Kind.HTML && !parts.isEmpty()
                && parts.get(0) instanceof TextNode t
                && (t.text().startsWith("[if") || t.text().startsWith("<![endif]"));
    }

    @Override
    public List<Node> getChildren() {
        return parts;
    }
}
