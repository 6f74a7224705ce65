package org.stencil.compiler.backend.optimize.features;

import org.stencil.compiler.api.CompilerErrorCode;
import org.stencil.compiler.api.OptionFlag;
import org.stencil.compiler.backend.optimize.IOptimizationPass;
import org.stencil.compiler.backend.optimize.NodeLists;
import org.stencil.compiler.backend.optimize.PassContext;
import org.stencil.compiler.diagnostics.CompilerLogger;
import org.stencil.compiler.frontend.directive.DirectiveEntry;
import org.stencil.compiler.frontend.directive.Purity;
import org.stencil.compiler.frontend.parser.ArgumentSplitter;
import org.stencil.compiler.frontend.parser.ast.AttributeNode;
import org.stencil.compiler.frontend.parser.ast.CommentNode;
import org.stencil.compiler.frontend.parser.ast.DirectiveNode;
import org.stencil.compiler.frontend.parser.ast.DocumentNode;
import org.stencil.compiler.frontend.parser.ast.ElementNode;
import org.stencil.compiler.frontend.parser.ast.Node;
import org.stencil.compiler.frontend.parser.ast.StartTagNode;
import org.stencil.compiler.frontend.parser.ast.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Replaces pure inline directives with their output and drops template comments.
 * <p>
 * Only literal arguments are accepted: quoted strings, numbers and the bare keywords the
 * directive declares. Anything else would need the render context and is reported.
 */
public final class ConstantFoldingPass implements IOptimizationPass {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    @Override
    public DocumentNode apply(DocumentNode document, PassContext context) {
        if (!context.enabledAnywhere(OptionFlag.CONSTANT_FOLDING)) {
            return document;
        }
        Run run = new Run(context);
        DocumentNode result = document.withChildren(run.fold(document.children()));
        CompilerLogger.debug("ConstantFolding: " + document.fileName() + " folded " + run.folded + " directives");
        return result;
    }

    /**
     * State of one application; the pass itself is shared between compilations.
     */
    private static final class Run {

        private final PassContext context;
        private int folded;

        Run(PassContext context) {
            this.context = context;
        }

        List<Node> fold(List<Node> nodes) {
            List<Node> out = new ArrayList<>();
            for (Node node : nodes) {
                Node result = foldNode(node);
                if (result != null) {
                    NodeLists.append(out, result);
                }
            }
            return out;
        }

        private Node foldNode(Node node) {
            if (node instanceof DirectiveNode directive) {
                return directive.block() ? directive.mapBranches(this::fold) : inline(directive);
            }
            if (node instanceof CommentNode comment) {
                if (comment.kind() == CommentNode.Kind.TEMPLATE) {
                    return context.enabled(OptionFlag.CONSTANT_FOLDING, comment) ? null : comment;
                }
                return new CommentNode(comment.kind(), fold(comment.parts()), comment.span());
            }
            if (node instanceof ElementNode element) {
                return element.withAttributes(fold(element.attributes())).withChildren(fold(element.children()));
            }
            if (node instanceof StartTagNode start) {
                return start.withAttributes(fold(start.attributes()));
            }
            if (node instanceof AttributeNode attribute && attribute.hasValue()) {
                return attribute.withValue(fold(attribute.value()));
            }
            return node;
        }

        private Node inline(DirectiveNode directive) {
            if (!context.enabled(OptionFlag.CONSTANT_FOLDING, directive)) {
                return directive;
            }
            Optional<DirectiveEntry> entry = context.registry().lookup(directive.name());
            if (entry.isEmpty() || entry.get().purity() != Purity.PURE) {
                return directive;
            }
            // {% static "x" as name %} assigns a variable and renders nothing.
            if (directive.arguments().contains("as")) {
                return directive;
            }
            List<String> values = new ArrayList<>();
            for (String argument : directive.arguments()) {
                if (ArgumentSplitter.isQuoted(argument)) {
                    values.add(ArgumentSplitter.unquote(argument));
                } else if (NUMBER.matcher(argument).matches() || entry.get().keywords().contains(argument)) {
                    values.add(argument);
                } else {
                    context.diagnostics().reportError(CompilerErrorCode.NON_LITERAL_ARGUMENT,
                            "Argument '" + argument + "' of {% " + directive.name()
                                    + " %} is not a literal and cannot be folded.", directive.span());
                    return directive;
                }
            }
            try {
                String output = entry.get().evaluator().evaluate(values);
                folded++;
                return new TextNode(output, directive.span());
            } catch (Exception e) {
                context.diagnostics().reportError(CompilerErrorCode.EVALUATION_FAILED,
                        "Evaluating {% " + directive.name() + " %} failed: " + e.getMessage(), directive.span());
                return directive;
            }
        }
    }
}
