package org.stencil.compiler.frontend.parser.ast;

import org.stencil.compiler.api.SourceSpan;

import java.util.List;

/**
 * An inline option override {@code {% ! flag... %}}. Applies to everything after it.
 *
 * @param flags The flag names as written, possibly with {@code no-} prefix.
 * @param span The source region.
 */
public record OptionNode(List<String> flags, SourceSpan span) implements Node {
    public OptionNode {
        flags = List.copyOf(flags);
    }
}
