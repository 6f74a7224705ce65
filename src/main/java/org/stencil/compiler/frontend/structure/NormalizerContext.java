package org.stencil.compiler.frontend.structure;

import org.stencil.compiler.api.CompilerErrorCode;
import org.stencil.compiler.api.OptionFlag;
import org.stencil.compiler.api.SourceSpan;
import org.stencil.compiler.diagnostics.DiagnosticsEngine;
import org.stencil.compiler.diagnostics.PhaseAbortedException;
import org.stencil.compiler.frontend.directive.DirectiveRegistry;
import org.stencil.compiler.frontend.parser.ast.TagPair;
import org.stencil.compiler.options.OptionTimeline;

/**
 * State shared by all sequence builders of one normalization run.
 */
final class NormalizerContext {

    private final DirectiveRegistry registry;
    private final OptionTimeline timeline;
    private final DiagnosticsEngine diagnostics;
    private int nextPairId = 1;

    NormalizerContext(DirectiveRegistry registry, OptionTimeline timeline, DiagnosticsEngine diagnostics) {
        this.registry = registry;
        this.timeline = timeline;
        this.diagnostics = diagnostics;
    }

    DirectiveRegistry registry() {
        return registry;
    }

    boolean htmlEnabled(int offset) {
        return timeline.at(offset).has(OptionFlag.HTML);
    }

    boolean parseAllTags(int offset) {
        return timeline.at(offset).has(OptionFlag.PARSE_ALL_HTML_TAGS);
    }

    TagPair newPair() {
        return new TagPair(nextPairId++);
    }

    PhaseAbortedException abort(CompilerErrorCode code, String message, SourceSpan span) {
        return diagnostics.abort(code, message, span);
    }
}
