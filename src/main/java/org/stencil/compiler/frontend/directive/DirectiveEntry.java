package org.stencil.compiler.frontend.directive;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A single entry of the {@link DirectiveRegistry}.
 *
 * @param name The directive name as written in {@code {% name %}}.
 * @param purity Whether the directive can be folded.
 * @param blockKind The block behaviour, or {@code null} for inline directives.
 * @param branches The branch keywords accepted inside the block, in no particular order.
 * @param minArgs The minimum number of arguments.
 * @param maxArgs The maximum number of arguments, {@link #UNBOUNDED} for no limit.
 * @param keywords Bare words accepted as literal arguments when folding.
 * @param evaluator The evaluator of a pure directive, {@code null} otherwise.
 */
public record DirectiveEntry(
        String name,
        Purity purity,
        BlockKind blockKind,
        List<BranchKeyword> branches,
        int minArgs,
        int maxArgs,
        Set<String> keywords,
        DirectiveEvaluator evaluator
) {
    /** Marker for directives without an upper argument bound. */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public DirectiveEntry {
        branches = List.copyOf(branches);
        keywords = Set.copyOf(keywords);
        if (purity == Purity.PURE && evaluator == null) {
            throw new IllegalArgumentException("Pure directive '" + name + "' needs an evaluator");
        }
        if (purity == Purity.PURE && blockKind != null) {
            throw new IllegalArgumentException("Block directive '" + name + "' cannot be pure");
        }
    }

    /**
     * Creates a context-dependent inline directive.
     * @param name The directive name.
     * @param minArgs The minimum number of arguments.
     * @param maxArgs The maximum number of arguments.
     * @return The entry.
     */
    public static DirectiveEntry runtime(String name, int minArgs, int maxArgs) {
        return new DirectiveEntry(name, Purity.CONTEXT_DEPENDENT, null, List.of(), minArgs, maxArgs, Set.of(), null);
    }

    /**
     * Creates a pure inline directive.
     * @param name The directive name.
     * @param minArgs The minimum number of arguments.
     * @param maxArgs The maximum number of arguments.
     * @param evaluator The evaluator.
     * @return The entry.
     */
    public static DirectiveEntry pure(String name, int minArgs, int maxArgs, DirectiveEvaluator evaluator) {
        return new DirectiveEntry(name, Purity.PURE, null, List.of(), minArgs, maxArgs, Set.of(), evaluator);
    }

    /**
     * Creates a context-dependent block directive.
     * @param name The directive name.
     * @param kind The block kind.
     * @param minArgs The minimum number of arguments.
     * @param maxArgs The maximum number of arguments.
     * @param branches The accepted branch keywords.
     * @return The entry.
     */
    public static DirectiveEntry block(String name, BlockKind kind, int minArgs, int maxArgs, BranchKeyword... branches) {
        return new DirectiveEntry(name, Purity.CONTEXT_DEPENDENT, kind, List.of(branches), minArgs, maxArgs, Set.of(), null);
    }

    /**
     * @return {@code true} if this directive opens a block closed by {@code end<name>}.
     */
    public boolean isBlock() {
        return blockKind != null;
    }

    /**
     * @param keyword A directive name found inside this block.
     * @return The matching branch keyword, if this block accepts it.
     */
    public Optional<BranchKeyword> branch(String keyword) {
        return branches.stream().filter(b -> b.keyword().equals(keyword)).findFirst();
    }
}
