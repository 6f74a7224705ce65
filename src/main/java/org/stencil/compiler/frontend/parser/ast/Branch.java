package org.stencil.compiler.frontend.parser.ast;

import org.stencil.compiler.api.SourceSpan;

import java.util.List;

/**
 * One render path of a block directive. The first branch carries the directive's own name and
 * arguments; later branches start with a branch keyword like {@code elif} or {@code else}.
 *
 * @param keyword The directive name for the first branch, otherwise the branch keyword.
 * @param arguments The split arguments.
 * @param children The nodes of this render path.
 * @param span The source region of the opening directive or keyword.
 */
public record Branch(String keyword, List<String> arguments, List<Node> children, SourceSpan span) {

    public Branch {
        arguments = List.copyOf(arguments);
        children = List.copyOf(children);
    }

    /**
     * @param newChildren The replacement children.
     * @return A copy with the given children.
     */
    public Branch withChildren(List<Node> newChildren) {
        return new Branch(keyword, arguments, newChildren, span);
    }
}
