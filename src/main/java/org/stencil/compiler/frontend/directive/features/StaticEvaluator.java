package org.stencil.compiler.frontend.directive.features;

import org.stencil.compiler.frontend.directive.DirectiveEvaluator;

import java.util.List;

/**
 * Folds {@code {% static "path" %}} to the configured static URL followed by the path.
 * The {@code {% static "path" as name %}} form binds a variable and stays for runtime.
 */
public class StaticEvaluator implements DirectiveEvaluator {

    private final String staticUrl;

    /**
     * @param staticUrl The static URL prefix. A trailing slash is added when missing.
     */
    public StaticEvaluator(String staticUrl) {
        this.staticUrl = staticUrl.endsWith("/") ? staticUrl : staticUrl + "/";
    }

    @Override
    public String evaluate(List<String> arguments) {
        if (arguments.size() != 1) {
            throw new IllegalArgumentException("static takes one path, got " + arguments);
        }
        String path = arguments.get(0);
        if (path.isEmpty()) {
            throw new IllegalArgumentException("static path must not be empty");
        }
        return staticUrl + (path.startsWith("/") ? path.substring(1) : path);
    }

    /**
     * Evaluator of {@code get_static_prefix}.
     * @param arguments Ignored; the directive takes none.
     * @return The static URL prefix.
     */
    public String prefix(List<String> arguments) {
        return staticUrl;
    }
}
