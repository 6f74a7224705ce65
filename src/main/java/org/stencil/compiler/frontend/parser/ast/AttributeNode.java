package org.stencil.compiler.frontend.parser.ast;

import org.stencil.compiler.api.SourceSpan;

import java.util.List;

/**
 * A single attribute inside a start tag.
 *
 * @param name The attribute name as written.
 * @param separator The text between name and value, e.g. {@code =} or {@code " = "}; empty without value.
 * @param quote The quote character as a string, or empty for unquoted values.
 * @param value The value parts (text, expressions, directives), or {@code null} for boolean attributes.
 * @param span The source region.
 */
public record AttributeNode(String name, String separator, String quote, List<Node> value, SourceSpan span)
        implements Node {

    public AttributeNode {
        value = value == null ? null : List.copyOf(value);
    }

    /**
     * @return {@code true} if the attribute has a value.
     */
    public boolean hasValue() {
        return value != null;
    }

    /**
     * @return The value if it is plain text, otherwise {@code null}.
     */
    public String literalValue() {
        if (value == null) return null;
        StringBuilder sb = new StringBuilder();
        for (Node part : value) {
            if (!(part instanceof TextNode t)) return null;
            sb.append(t.text());
        }
        return sb.toString();
    }

    /**
     * @param newValue The replacement value parts.
     * @return A copy with the given value.
     */
    public AttributeNode withValue(List<Node> newValue) {
        return new AttributeNode(name, separator, quote, newValue, span);
    }

    @Override
    public List<Node> getChildren() {
        return value == null ? List.of() : value;
    }
}
