package org.stencil.compiler.frontend.directive.features;

import org.stencil.compiler.frontend.directive.BlockKind;
import org.stencil.compiler.frontend.directive.BranchKeyword;
import org.stencil.compiler.frontend.directive.DirectiveEntry;
import org.stencil.compiler.frontend.directive.DirectiveRegistry;
import org.stencil.compiler.frontend.directive.DirectiveSettings;

import static org.stencil.compiler.frontend.directive.DirectiveEntry.UNBOUNDED;

/**
 * The directive set every registry starts with.
 */
public final class BuiltinDirectives {

    private BuiltinDirectives() {
    }

    /**
     * Registers all built-in directives.
     * @param builder The registry builder.
     * @param settings Supplies the static URL prefix.
     */
    public static void registerAll(DirectiveRegistry.Builder builder, DirectiveSettings settings) {
        BranchKeyword otherwise = BranchKeyword.terminal("else");

        // Blocks
        builder.register(DirectiveEntry.block("if", BlockKind.CONDITIONAL, 1, UNBOUNDED,
                BranchKeyword.repeatable("elif", 1), otherwise));
        builder.register(DirectiveEntry.block("ifequal", BlockKind.CONDITIONAL, 2, 2, otherwise));
        builder.register(DirectiveEntry.block("ifnotequal", BlockKind.CONDITIONAL, 2, 2, otherwise));
        builder.register(DirectiveEntry.block("ifchanged", BlockKind.CONDITIONAL, 0, UNBOUNDED, otherwise));
        builder.register(DirectiveEntry.block("for", BlockKind.LOOP, 3, UNBOUNDED, BranchKeyword.terminal("empty")));
        builder.register(DirectiveEntry.block("block", BlockKind.BLOCK, 1, 1));
        builder.register(DirectiveEntry.block("with", BlockKind.ALTERNATIVES, 1, UNBOUNDED));
        builder.register(DirectiveEntry.block("autoescape", BlockKind.ALTERNATIVES, 1, 1));
        builder.register(DirectiveEntry.block("filter", BlockKind.ALTERNATIVES, 1, UNBOUNDED));
        builder.register(DirectiveEntry.block("spaceless", BlockKind.ALTERNATIVES, 0, 0));
        builder.register(DirectiveEntry.block("comment", BlockKind.ALTERNATIVES, 0, 1));
        builder.register(DirectiveEntry.block("blocktrans", BlockKind.ALTERNATIVES, 0, UNBOUNDED,
                new BranchKeyword("plural", true, 0, 0)));

        // Context-dependent inline directives
        builder.register(DirectiveEntry.runtime("extends", 1, 1));
        builder.register(DirectiveEntry.runtime("include", 1, UNBOUNDED));
        builder.register(DirectiveEntry.runtime("load", 1, UNBOUNDED));
        builder.register(DirectiveEntry.runtime("url", 1, UNBOUNDED));
        builder.register(DirectiveEntry.runtime("csrf_token", 0, 0));
        builder.register(DirectiveEntry.runtime("cycle", 1, UNBOUNDED));
        builder.register(DirectiveEntry.runtime("now", 1, UNBOUNDED));
        builder.register(DirectiveEntry.runtime("firstof", 1, UNBOUNDED));
        builder.register(DirectiveEntry.runtime("trans", 1, UNBOUNDED));
        builder.register(DirectiveEntry.runtime("templatetag", 1, 1));
        builder.register(DirectiveEntry.runtime("widthratio", 3, 5));
        builder.register(DirectiveEntry.runtime("regroup", 5, 5));
        builder.register(DirectiveEntry.runtime("debug", 0, 0));

        // Pure inline directives
        StaticEvaluator staticEvaluator = new StaticEvaluator(settings.staticUrl());
        builder.register(DirectiveEntry.pure("static", 1, 3, staticEvaluator));
        builder.register(DirectiveEntry.pure("get_static_prefix", 0, 0, staticEvaluator::prefix));
        builder.register(LoremEvaluator.entry());
    }
}
