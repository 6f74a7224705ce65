package org.stencil.compiler.backend.optimize.script;

import org.stencil.compiler.api.SourceSpan;
import org.stencil.compiler.backend.optimize.NodeLists;
import org.stencil.compiler.frontend.parser.ast.Node;
import org.stencil.compiler.frontend.parser.ast.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The content of a script or style element as one string. Every template node becomes a single
 * placeholder character, so a scanner can treat it as an opaque atom and the minified result can
 * be mapped back to text and template nodes.
 */
final class FlatText {

    static final char PLACEHOLDER = '\uE000';

    private final String text;
    private final Node[] origins;

    private FlatText(String text, Node[] origins) {
        this.text = text;
        this.origins = origins;
    }

    /**
     * @param parts Text and template nodes.
     * @return The flattened content, or empty if the text already contains the placeholder.
     */
    static Optional<FlatText> of(List<Node> parts) {
        StringBuilder sb = new StringBuilder();
        List<Node> origins = new ArrayList<>();
        for (Node part : parts) {
            if (part instanceof TextNode t) {
                if (t.text().indexOf(PLACEHOLDER) >= 0) {
                    return Optional.empty();
                }
                sb.append(t.text());
                for (int i = 0; i < t.text().length(); i++) {
                    origins.add(t);
                }
            } else {
                sb.append(PLACEHOLDER);
                origins.add(part);
            }
        }
        return Optional.of(new FlatText(sb.toString(), origins.toArray(new Node[0])));
    }

    String text() {
        return text;
    }

    int length() {
        return text.length();
    }

    char charAt(int index) {
        return text.charAt(index);
    }

    boolean isOpaque(int index) {
        return text.charAt(index) == PLACEHOLDER;
    }

    SourceSpan spanAt(int index) {
        return origins[index].span();
    }

    Writer writer() {
        return new Writer();
    }

    /**
     * Rebuilds a node sequence from copied ranges and new text.
     */
    final class Writer {

        private final List<Node> out = new ArrayList<>();
        private final StringBuilder pending = new StringBuilder();
        private SourceSpan pendingSpan;

        /**
         * Copies a range of the flattened content, restoring template nodes.
         */
        void copy(int from, int to) {
            for (int i = from; i < to; i++) {
                if (isOpaque(i)) {
                    flush();
                    out.add(origins[i]);
                } else {
                    append(String.valueOf(text.charAt(i)), origins[i].span());
                }
            }
        }

        /**
         * Writes text that has no exact counterpart in the source.
         */
        void write(String value, SourceSpan span) {
            append(value, span);
        }

        private void append(String value, SourceSpan span) {
            if (pendingSpan != null && !pendingSpan.equals(span)) {
                flush();
            }
            pending.append(value);
            pendingSpan = span;
        }

        private void flush() {
            if (pending.length() > 0) {
                NodeLists.append(out, new TextNode(pending.toString(), pendingSpan));
                pending.setLength(0);
            }
            pendingSpan = null;
        }

        List<Node> finish() {
            flush();
            return out;
        }
    }
}
