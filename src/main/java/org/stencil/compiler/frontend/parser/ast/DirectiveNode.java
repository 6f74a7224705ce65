package org.stencil.compiler.frontend.parser.ast;

import org.stencil.compiler.api.SourceSpan;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A directive. Inline directives have no branches; block directives model their mutually
 * exclusive render paths as sibling branches.
 *
 * @param name The directive name.
 * @param arguments The split arguments; quoted strings keep their quotes.
 * @param branches The branches of a block directive, empty for inline ones.
 * @param block {@code true} for a block directive.
 * @param closeArguments The arguments of the close directive, e.g. the name in {@code endblock name}.
 * @param span The source region of the opening directive.
 */
public record DirectiveNode(
        String name,
        List<String> arguments,
        List<Branch> branches,
        boolean block,
        List<String> closeArguments,
        SourceSpan span
) implements Node {

    public DirectiveNode {
        arguments = List.copyOf(arguments);
        branches = List.copyOf(branches);
        closeArguments = List.copyOf(closeArguments);
    }

    /**
     * Creates an inline directive.
     * @param name The directive name.
     * @param arguments The arguments.
     * @param span The source region.
     * @return The node.
     */
    public static DirectiveNode inline(String name, List<String> arguments, SourceSpan span) {
        return new DirectiveNode(name, arguments, List.of(), false, List.of(), span);
    }

    /**
     * @param newBranches The replacement branches.
     * @return A copy with the given branches.
     */
    public DirectiveNode withBranches(List<Branch> newBranches) {
        return new DirectiveNode(name, arguments, newBranches, block, closeArguments, span);
    }

    /**
     * @param rewrite Applied to the children of every branch.
     * @return A copy with rewritten branch children.
     */
    public DirectiveNode mapBranches(UnaryOperator<List<Node>> rewrite) {
        return withBranches(branches.stream().map(b -> b.withChildren(rewrite.apply(b.children()))).toList());
    }

    @Override
    public List<Node> getChildren() {
        return branches.stream().flatMap(b -> b.children().stream()).toList();
    }
}
