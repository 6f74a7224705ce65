package org.stencil.compiler.frontend.directive;

import java.util.List;

/**
 * Computes the literal output of a pure directive from its literal arguments.
 * Implementations must not depend on per-request state; this is asserted by whoever
 * registers them and not verified.
 */
@FunctionalInterface
public interface DirectiveEvaluator {

    /**
     * @param arguments The argument values, with quotes already removed from string literals.
     * @return The text replacing the directive.
     * @throws Exception if the arguments are not acceptable.
     */
    String evaluate(List<String> arguments) throws Exception;
}
