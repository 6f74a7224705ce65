package org.stencil.compiler.backend.optimize;

import org.stencil.compiler.api.OptionFlag;
import org.stencil.compiler.diagnostics.DiagnosticsEngine;
import org.stencil.compiler.frontend.directive.DirectiveRegistry;
import org.stencil.compiler.frontend.parser.ast.Node;
import org.stencil.compiler.options.OptionTimeline;

import java.util.Optional;

/**
 * Everything a pass may consult while rewriting one unit.
 *
 * @param registry The directive registry.
 * @param timeline The options in effect at each source offset.
 * @param diagnostics The engine for reporting errors and warnings.
 * @param publisher The bundle publisher, if the host supplied one.
 * @param fileName The name of the unit.
 */
public record PassContext(
        DirectiveRegistry registry,
        OptionTimeline timeline,
        DiagnosticsEngine diagnostics,
        Optional<AssetPublisher> publisher,
        String fileName
) {
    /**
     * @param flag The flag to test.
     * @param node The node whose start offset decides.
     * @return {@code true} if the flag is on where the node starts.
     */
    public boolean enabled(OptionFlag flag, Node node) {
        return timeline.at(node).has(flag);
    }

    /**
     * @param flag The flag to test.
     * @return {@code true} if the flag is on anywhere in the unit.
     */
    public boolean enabledAnywhere(OptionFlag flag) {
        return timeline.anywhere(options -> options.has(flag));
    }
}
