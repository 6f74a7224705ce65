package org.stencil.compiler.frontend.parser.ast;

import org.stencil.compiler.api.SourceSpan;

import java.util.List;

/**
 * The root of a template tree.
 *
 * @param fileName The template name.
 * @param children The top-level nodes.
 * @param span The region of the whole source.
 */
public record DocumentNode(String fileName, List<Node> children, SourceSpan span) implements Node {

    public DocumentNode {
        children = List.copyOf(children);
    }

    /**
     * @param newChildren The replacement top-level nodes.
     * @return A copy with the given children.
     */
    public DocumentNode withChildren(List<Node> newChildren) {
        return new DocumentNode(fileName, newChildren, span);
    }

    @Override
    public List<Node> getChildren() {
        return children;
    }
}
