package org.stencil.compiler.options;

import org.stencil.compiler.api.CompilationOptions;
import org.stencil.compiler.frontend.parser.ast.Node;
import org.stencil.compiler.frontend.parser.ast.OptionNode;

import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * The option set in effect at each source offset of a unit. An inline override applies from
 * the end of its directive onwards and never to anything before it.
 */
public final class OptionTimeline {

    private final NavigableMap<Integer, CompilationOptions> changes;

    private OptionTimeline(NavigableMap<Integer, CompilationOptions> changes) {
        this.changes = changes;
    }

    /**
     * @param options The options of a unit without inline overrides.
     * @return A timeline where {@code options} hold everywhere.
     */
    public static OptionTimeline constant(CompilationOptions options) {
        NavigableMap<Integer, CompilationOptions> changes = new TreeMap<>();
        changes.put(Integer.MIN_VALUE, options);
        return new OptionTimeline(changes);
    }

    /**
     * Builds the timeline from the {@link OptionNode}s of a parsed tree, in source order.
     *
     * @param root The parsed tree.
     * @param base The options in effect at the start of the unit.
     * @return The timeline.
     * @throws IllegalArgumentException if an override names an unknown flag.
     */
    public static OptionTimeline build(Node root, CompilationOptions base) {
        NavigableMap<Integer, OptionNode> overrides = new TreeMap<>();
        collect(root, overrides);
        NavigableMap<Integer, CompilationOptions> changes = new TreeMap<>();
        CompilationOptions options = base;
        changes.put(Integer.MIN_VALUE, options);
        for (Map.Entry<Integer, OptionNode> override : overrides.entrySet()) {
            options = options.apply(override.getValue().flags());
            changes.put(override.getKey(), options);
        }
        return new OptionTimeline(changes);
    }

    private static void collect(Node node, NavigableMap<Integer, OptionNode> overrides) {
        if (node instanceof OptionNode option) {
            overrides.put(option.span().end(), option);
        } else {
            node.getChildren().forEach(child -> collect(child, overrides));
        }
    }

    /**
     * @param offset A source offset.
     * @return The options in effect at that offset.
     */
    public CompilationOptions at(int offset) {
        return changes.floorEntry(offset).getValue();
    }

    /**
     * @param node A node of the unit.
     * @return The options in effect where the node starts.
     */
    public CompilationOptions at(Node node) {
        return at(node.span().start());
    }

    /**
     * @return The options in effect at the start of the unit.
     */
    public CompilationOptions initial() {
        return changes.firstEntry().getValue();
    }

    /**
     * @param test The condition on an option set.
     * @return {@code true} if some option set of the unit satisfies the condition.
     */
    public boolean anywhere(Predicate<CompilationOptions> test) {
        return changes.values().stream().anyMatch(test);
    }

    /**
     * @return {@code true} if the unit contains inline overrides.
     */
    public boolean hasOverrides() {
        return changes.size() > 1;
    }
}
