package org.stencil.compiler.frontend.directive;

import java.util.List;

/**
 * Host-specific inputs to the built-in directive set.
 *
 * @param staticUrl The prefix that {@code static} and {@code get_static_prefix} fold to.
 * @param runtimeDirectives Additional context-dependent inline directive names.
 * @param runtimeBlocks Additional context-dependent block directive names (alternatives kind).
 */
public record DirectiveSettings(String staticUrl, List<String> runtimeDirectives, List<String> runtimeBlocks) {

    public DirectiveSettings {
        runtimeDirectives = List.copyOf(runtimeDirectives);
        runtimeBlocks = List.copyOf(runtimeBlocks);
    }

    /**
     * @return Settings with static URL {@code /static/} and no extra directives.
     */
    public static DirectiveSettings defaults() {
        return new DirectiveSettings("/static/", List.of(), List.of());
    }
}
