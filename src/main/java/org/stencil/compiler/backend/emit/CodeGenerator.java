package org.stencil.compiler.backend.emit;

import org.stencil.compiler.api.CompilationOptions;
import org.stencil.compiler.api.CompiledArtifact;
import org.stencil.compiler.api.DebugMapEntry;
import org.stencil.compiler.api.OptionFlag;
import org.stencil.compiler.diagnostics.Diagnostic;
import org.stencil.compiler.frontend.parser.ast.AttributeNode;
import org.stencil.compiler.frontend.parser.ast.Branch;
import org.stencil.compiler.frontend.parser.ast.CommentNode;
import org.stencil.compiler.frontend.parser.ast.DirectiveNode;
import org.stencil.compiler.frontend.parser.ast.DocumentNode;
import org.stencil.compiler.frontend.parser.ast.ElementNode;
import org.stencil.compiler.frontend.parser.ast.EndTagNode;
import org.stencil.compiler.frontend.parser.ast.ExpressionNode;
import org.stencil.compiler.frontend.parser.ast.HtmlElements;
import org.stencil.compiler.frontend.parser.ast.Node;
import org.stencil.compiler.frontend.parser.ast.RawNode;
import org.stencil.compiler.frontend.parser.ast.StartTagNode;
import org.stencil.compiler.frontend.parser.ast.TextNode;
import org.stencil.compiler.options.OptionTimeline;

import java.util.ArrayList;
import java.util.List;

/**
 * The CodeGenerator is the final stage of the compiler. It serializes the optimized tree
 * depth-first into the compact template text the runtime engine renders.
 * <p>
 * Directives and expressions are written in normalized form, {@code {% name args %}} and
 * {@code {{ expr }}}. Option overrides and template comments produce nothing; raw blocks
 * produce their content without markers. The tree is not validated again.
 * <p>
 * Debug markers are HTML comments, so a node is only marked where HTML parsing is enabled and
 * both its start and its end lie between tags in the generated text.
 */
public class CodeGenerator {

    private static final String MARKER_OPEN = "<!--dbg:%d-->";
    private static final String MARKER_CLOSE = "<!--/dbg:%d-->";

    /**
     * Generates the output of a unit.
     *
     * @param document The optimized tree.
     * @param sourceId The identity of the unit.
     * @param options The options the unit was compiled with; {@code debug} enables markers.
     * @param warnings The warnings to carry in the artifact.
     * @return The compiled artifact.
     */
    public CompiledArtifact generate(DocumentNode document, String sourceId, CompilationOptions options,
                                     List<Diagnostic> warnings) {
        return generate(document, sourceId, OptionTimeline.constant(options), options, warnings);
    }

    /**
     * Generates the output of a unit whose options change through inline overrides.
     *
     * @param document The optimized tree.
     * @param sourceId The identity of the unit.
     * @param timeline The options in effect across the unit.
     * @param options The options the unit was compiled with; {@code debug} enables markers.
     * @param warnings The warnings to carry in the artifact.
     * @return The compiled artifact.
     */
    public CompiledArtifact generate(DocumentNode document, String sourceId, OptionTimeline timeline,
                                     CompilationOptions options, List<Diagnostic> warnings) {
        Writer writer = new Writer(options.debug() ? timeline : null);
        writer.sequence(document.children(), true);
        return new CompiledArtifact(sourceId, writer.out.toString(), writer.debugMap, options, warnings);
    }

    /**
     * @param node A node.
     * @return The node serialized without debug markers.
     */
    public static String render(Node node) {
        Writer writer = new Writer(null);
        writer.node(node, false);
        return writer.out.toString();
    }

    private static final class Writer {

        private final StringBuilder out = new StringBuilder();
        private final List<DebugMapEntry> debugMap = new ArrayList<>();
        private final OptionTimeline timeline;
        private final MarkupState markup = new MarkupState();
        private int nextId = 1;

        /**
         * @param timeline The options across the unit when writing debug markers, otherwise {@code null}.
         */
        Writer(OptionTimeline timeline) {
            this.timeline = timeline;
        }

        void sequence(List<Node> nodes, boolean content) {
            for (Node node : nodes) {
                if (content && timeline != null && marked(node)) {
                    int id = nextId++;
                    out.append(String.format(MARKER_OPEN, id));
                    int start = out.length();
                    node(node, true);
                    debugMap.add(new DebugMapEntry(id, start, out.length(), node.span()));
                    out.append(String.format(MARKER_CLOSE, id));
                } else {
                    node(node, content);
                }
            }
        }

        void node(Node node, boolean content) {
            if (node instanceof TextNode text) {
                out.append(text.text());
            } else if (node instanceof ExpressionNode expression) {
                out.append("{{ ").append(expression.expression()).append(" }}");
            } else if (node instanceof DirectiveNode directive) {
                directive(directive, content);
            } else if (node instanceof ElementNode element) {
                element(element, content);
            } else if (node instanceof StartTagNode start) {
                out.append('<').append(start.tagName());
                sequence(start.attributes(), false);
                out.append('>');
            } else if (node instanceof EndTagNode end) {
                out.append(end.text() != null ? end.text() : "</" + end.tagName() + ">");
            } else if (node instanceof AttributeNode attribute) {
                out.append(attribute.name());
                if (attribute.hasValue()) {
                    out.append(attribute.separator()).append(attribute.quote());
                    sequence(attribute.value(), false);
                    out.append(attribute.quote());
                }
            } else if (node instanceof CommentNode comment) {
                if (comment.kind() == CommentNode.Kind.HTML) {
                    out.append("<!--");
                    sequence(comment.parts(), false);
                    out.append("-->");
                }
            } else if (node instanceof RawNode raw) {
                out.append(raw.content());
            } else if (node instanceof DocumentNode document) {
                sequence(document.children(), content);
            }
        }

        private void directive(DirectiveNode directive, boolean content) {
            tag(directive.name(), directive.arguments());
            if (!directive.block()) {
                return;
            }
            List<Branch> branches = directive.branches();
            for (int i = 0; i < branches.size(); i++) {
                Branch branch = branches.get(i);
                if (i > 0) {
                    tag(branch.keyword(), branch.arguments());
                }
                sequence(branch.children(), content);
            }
            tag("end" + directive.name(), directive.closeArguments());
        }

        private void element(ElementNode element, boolean content) {
            out.append('<').append(element.tagName());
            sequence(element.attributes(), false);
            out.append(element.selfClosing() ? "/>" : ">");
            if (!element.hasEndTag()) {
                return;
            }
            sequence(element.children(), content && !HtmlElements.isRawText(element.name()));
            out.append(element.endTag() != null ? element.endTag() : "</" + element.tagName() + ">");
        }

        private void tag(String name, List<String> arguments) {
            out.append("{% ").append(name);
            for (String argument : arguments) {
                out.append(' ').append(argument);
            }
            out.append(" %}");
        }

        private boolean marked(Node node) {
            if (!markable(node) || !htmlAt(node) || !markup.inContent(out)) {
                return false;
            }
            return MarkupState.balanced(render(node));
        }

        private boolean htmlAt(Node node) {
            CompilationOptions options = node.span() != null ? timeline.at(node) : timeline.initial();
            return options.has(OptionFlag.HTML);
        }

        private static boolean markable(Node node) {
            if (node instanceof TextNode text) {
                // Nothing may precede a doctype.
                return !text.isBlank() && !text.text().stripLeading().startsWith("<!")
                        && !text.text().stripLeading().startsWith("<?");
            }
            return node instanceof ElementNode || node instanceof StartTagNode || node instanceof EndTagNode
                    || node instanceof DirectiveNode || node instanceof ExpressionNode || node instanceof RawNode;
        }
    }
}
