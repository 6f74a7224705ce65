package org.stencil.compiler.backend.optimize;

import org.stencil.compiler.frontend.parser.ast.Node;
import org.stencil.compiler.frontend.parser.ast.TextNode;

import java.util.List;

/**
 * Helpers for rebuilding node sequences inside passes.
 */
public final class NodeLists {

    private NodeLists() {
    }

    /**
     * Appends a node, merging it into a preceding text node when both are text.
     *
     * @param out  The sequence being built.
     * @param node The node to append.
     */
    public static void append(List<Node> out, Node node) {
        if (node instanceof TextNode text) {
            if (text.text().isEmpty()) {
                return;
            }
            if (!out.isEmpty() && out.get(out.size() - 1) instanceof TextNode last) {
                out.set(out.size() - 1, new TextNode(last.text() + text.text(), last.span().union(text.span())));
                return;
            }
        }
        out.add(node);
    }

    /**
     * @param nodes A node sequence.
     * @return The concatenated text if every node is text, otherwise {@code null}.
     */
    public static String literal(List<Node> nodes) {
        StringBuilder sb = new StringBuilder();
        for (Node node : nodes) {
            if (!(node instanceof TextNode t)) return null;
            sb.append(t.text());
        }
        return sb.toString();
    }
}
