package org.stencil.compiler.frontend.directive;

/**
 * A keyword that splits a block directive into branches, like {@code elif} or {@code else}.
 *
 * @param keyword The keyword name.
 * @param terminal {@code true} if no other keyword may follow it (e.g. {@code else}).
 * @param minArgs The minimum number of arguments.
 * @param maxArgs The maximum number of arguments.
 */
public record BranchKeyword(String keyword, boolean terminal, int minArgs, int maxArgs) {

    /**
     * @param keyword The keyword name.
     * @return A terminal keyword without arguments.
     */
    public static BranchKeyword terminal(String keyword) {
        return new BranchKeyword(keyword, true, 0, 0);
    }

    /**
     * @param keyword The keyword name.
     * @param minArgs The minimum number of arguments.
     * @return A non-terminal keyword taking at least {@code minArgs} arguments.
     */
    public static BranchKeyword repeatable(String keyword, int minArgs) {
        return new BranchKeyword(keyword, false, minArgs, DirectiveEntry.UNBOUNDED);
    }
}
