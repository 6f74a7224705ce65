package org.stencil.compiler.backend.optimize.features;

import org.stencil.compiler.api.OptionFlag;
import org.stencil.compiler.backend.optimize.IOptimizationPass;
import org.stencil.compiler.backend.optimize.NodeLists;
import org.stencil.compiler.backend.optimize.PassContext;
import org.stencil.compiler.frontend.parser.ast.AttributeNode;
import org.stencil.compiler.frontend.parser.ast.Branch;
import org.stencil.compiler.frontend.parser.ast.CommentNode;
import org.stencil.compiler.frontend.parser.ast.DirectiveNode;
import org.stencil.compiler.frontend.parser.ast.DocumentNode;
import org.stencil.compiler.frontend.parser.ast.ElementNode;
import org.stencil.compiler.frontend.parser.ast.EndTagNode;
import org.stencil.compiler.frontend.parser.ast.HtmlElements;
import org.stencil.compiler.frontend.parser.ast.Node;
import org.stencil.compiler.frontend.parser.ast.StartTagNode;
import org.stencil.compiler.frontend.parser.ast.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Collapses insignificant whitespace in content and inside tags and removes HTML comments
 * that are not conditional comments.
 * <p>
 * Whitespace runs become a single space. Next to a block-level tag, and at the edges of a
 * block-level element, the space is dropped entirely. The content of {@code pre},
 * {@code textarea}, {@code script} and {@code style} is left alone, also when the element is
 * split across directive branches. Text is only touched where HTML structure is tracked.
 */
public final class WhitespaceCompressionPass implements IOptimizationPass {

    private static final Pattern WHITESPACE = Pattern.compile("[ \\t\\n\\r\\f]+");
    private static final Pattern LEADING = Pattern.compile("^[ \\t\\n\\r\\f]+");
    private static final Pattern TRAILING = Pattern.compile("[ \\t\\n\\r\\f]+$");

    @Override
    public DocumentNode apply(DocumentNode document, PassContext context) {
        if (!context.enabledAnywhere(OptionFlag.WHITESPACE_COMPRESSION)) {
            return document;
        }
        return document.withChildren(new Run(context).sequence(document.children(), false, false));
    }

    private static String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ");
    }

    private static final class Run {

        private final PassContext context;
        /** Number of open whitespace-preserving elements whose start and end tags are split. */
        private int preserveDepth;

        Run(PassContext context) {
            this.context = context;
        }

        List<Node> sequence(List<Node> nodes, boolean blockStart, boolean blockEnd) {
            List<Node> merged = new ArrayList<>();
            for (Node node : nodes) {
                if (!removable(node)) {
                    NodeLists.append(merged, node);
                }
            }
            List<Node> out = new ArrayList<>();
            for (int i = 0; i < merged.size(); i++) {
                Node node = merged.get(i);
                Node result = node;
                if (node instanceof TextNode text) {
                    boolean leading = i == 0 ? blockStart : isBlockBoundary(merged.get(i - 1));
                    boolean trailing = i == merged.size() - 1 ? blockEnd : isBlockBoundary(merged.get(i + 1));
                    result = text(text, leading, trailing);
                } else if (node instanceof ElementNode element) {
                    result = element(element);
                } else if (node instanceof StartTagNode start) {
                    result = start.withAttributes(attributes(start.attributes(), false, true));
                    if (HtmlElements.preservesWhitespace(start.name())) {
                        preserveDepth++;
                    }
                } else if (node instanceof EndTagNode end) {
                    if (HtmlElements.preservesWhitespace(end.name()) && preserveDepth > 0) {
                        preserveDepth--;
                    }
                } else if (node instanceof DirectiveNode directive && directive.block()) {
                    result = directive(directive);
                }
                if (result != null) {
                    NodeLists.append(out, result);
                }
            }
            return out;
        }

        private DirectiveNode directive(DirectiveNode directive) {
            int entryDepth = preserveDepth;
            Integer exitDepth = null;
            List<Branch> branches = new ArrayList<>();
            for (Branch branch : directive.branches()) {
                preserveDepth = entryDepth;
                branches.add(branch.withChildren(sequence(branch.children(), false, false)));
                if (exitDepth == null) {
                    exitDepth = preserveDepth;
                }
            }
            // Every render path leaves the same elements open, so the first one decides.
            preserveDepth = exitDepth == null ? entryDepth : exitDepth;
            return directive.withBranches(branches);
        }

        private ElementNode element(ElementNode element) {
            ElementNode result = element.withAttributes(attributes(element.attributes(), element.selfClosing(), true));
            if (HtmlElements.preservesWhitespace(element.name())) {
                return result;
            }
            boolean block = HtmlElements.isBlockLevel(element.name());
            return result.withChildren(sequence(element.children(), block, block));
        }

        private TextNode text(TextNode text, boolean stripLeading, boolean stripTrailing) {
            if (preserveDepth > 0 || !active(text)) {
                return text;
            }
            String value = collapse(text.text());
            if (stripLeading) {
                value = LEADING.matcher(value).replaceFirst("");
            }
            if (stripTrailing) {
                value = TRAILING.matcher(value).replaceFirst("");
            }
            return value.isEmpty() ? null : new TextNode(value, text.span());
        }

        // region Tags

        /**
         * Normalizes the attribute items of a start tag. {@code top} is false inside the
         * branches of an attribute-level directive, where the neighbours are unknown.
         */
        private List<Node> attributes(List<Node> items, boolean selfClosing, boolean top) {
            List<Node> out = new ArrayList<>();
            for (Node item : items) {
                if (item instanceof TextNode text && text.isBlank() && active(text)) {
                    NodeLists.append(out, new TextNode(" ", text.span()));
                } else if (item instanceof AttributeNode attribute) {
                    out.add(attribute(attribute));
                } else if (item instanceof DirectiveNode directive && directive.block()) {
                    out.add(directive.mapBranches(children -> attributes(children, false, false)));
                } else {
                    out.add(item);
                }
            }
            if (top && !out.isEmpty() && out.get(out.size() - 1) instanceof TextNode last
                    && last.isBlank() && active(last)) {
                Node before = out.size() > 1 ? out.get(out.size() - 2) : null;
                // <a href=x /> must keep the space or the slash joins the value.
                boolean unquotedBeforeSlash = selfClosing && before instanceof AttributeNode a
                        && a.hasValue() && a.quote().isEmpty();
                if (!unquotedBeforeSlash) {
                    out.remove(out.size() - 1);
                }
            }
            return out;
        }

        private AttributeNode attribute(AttributeNode attribute) {
            if (!attribute.hasValue() || !active(attribute)) {
                return attribute;
            }
            List<Node> value = attribute.value();
            if (attribute.name().equalsIgnoreCase("class")) {
                value = classValue(value);
            }
            return new AttributeNode(attribute.name(), "=", attribute.quote(), value, attribute.span());
        }

        private List<Node> classValue(List<Node> parts) {
            List<Node> out = new ArrayList<>();
            for (int i = 0; i < parts.size(); i++) {
                if (parts.get(i) instanceof TextNode text) {
                    String value = collapse(text.text());
                    if (i == 0) value = LEADING.matcher(value).replaceFirst("");
                    if (i == parts.size() - 1) value = TRAILING.matcher(value).replaceFirst("");
                    NodeLists.append(out, new TextNode(value, text.span()));
                } else {
                    out.add(parts.get(i));
                }
            }
            return out;
        }

        // endregion

        private boolean removable(Node node) {
            return node instanceof CommentNode comment
                    && comment.kind() == CommentNode.Kind.HTML
                    && !comment.isConditional()
                    && preserveDepth == 0
                    && context.enabled(OptionFlag.WHITESPACE_COMPRESSION, comment);
        }

        private boolean active(Node node) {
            return context.enabled(OptionFlag.WHITESPACE_COMPRESSION, node) && context.enabled(OptionFlag.HTML, node);
        }

        private static boolean isBlockBoundary(Node node) {
            if (node instanceof ElementNode element) return HtmlElements.isBlockLevel(element.name());
            if (node instanceof StartTagNode start) return HtmlElements.isBlockLevel(start.name());
            if (node instanceof EndTagNode end) return HtmlElements.isBlockLevel(end.name());
            return false;
        }
    }
}
