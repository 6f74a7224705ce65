package org.stencil.compiler.frontend.parser.ast;

import org.stencil.compiler.api.SourceSpan;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes of the template tree.
 */
public sealed interface Node permits TextNode, ExpressionNode, CommentNode, RawNode, OptionNode,
        DirectiveNode, ElementNode, AttributeNode, StartTagNode, EndTagNode, DocumentNode {

    /**
     * @return The source region this node was built from.
     */
    SourceSpan span();

    /**
     * Returns a list of the direct child nodes, so that generic walks can traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<Node> getChildren() {
        return Collections.emptyList();
    }
}
