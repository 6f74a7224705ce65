package org.stencil.compiler.frontend.structure;

import org.stencil.compiler.diagnostics.CompilerLogger;
import org.stencil.compiler.diagnostics.DiagnosticsEngine;
import org.stencil.compiler.frontend.directive.DirectiveRegistry;
import org.stencil.compiler.frontend.parser.ast.DocumentNode;
import org.stencil.compiler.frontend.parser.ast.Node;
import org.stencil.compiler.options.OptionTimeline;

import java.util.List;

/**
 * Builds the element tree from the directive tree in a single depth-first walk.
 * <p>
 * The walk keeps a tag stack that is cloned for every branch of a block directive. When the
 * directive ends, all render paths must leave the same tag names open. Elements opened and
 * closed in the same sequence become {@link org.stencil.compiler.frontend.parser.ast.ElementNode}s;
 * elements whose open and close are separated by a directive boundary become
 * {@link org.stencil.compiler.frontend.parser.ast.StartTagNode} and
 * {@link org.stencil.compiler.frontend.parser.ast.EndTagNode} leaves sharing one pair.
 */
public class StructuralNormalizer {

    private final DirectiveRegistry registry;
    private final OptionTimeline timeline;
    private final DiagnosticsEngine diagnostics;

    /**
     * @param registry Supplies the block kind of each directive.
     * @param timeline The options in effect at each source offset.
     * @param diagnostics The engine for reporting errors.
     */
    public StructuralNormalizer(DirectiveRegistry registry, OptionTimeline timeline, DiagnosticsEngine diagnostics) {
        this.registry = registry;
        this.timeline = timeline;
        this.diagnostics = diagnostics;
    }

    /**
     * Normalizes a parsed document.
     *
     * @param document The document produced by the parser.
     * @return The normalized document.
     * @throws org.stencil.compiler.diagnostics.PhaseAbortedException after reporting a structural error.
     */
    public DocumentNode normalize(DocumentNode document) {
        NormalizerContext context = new NormalizerContext(registry, timeline, diagnostics);
        SequenceBuilder root = SequenceBuilder.content(context, List.of());
        root.process(document.children());
        List<Node> children = root.finishDocument(document.span());
        CompilerLogger.debug("Normalizer: " + document.fileName() + " -> " + children.size() + " top-level nodes");
        return document.withChildren(children);
    }
}
