package org.stencil.compiler.frontend.directive;

/**
 * Declares whether a directive may be evaluated at compile time.
 */
public enum Purity {
    /** Output depends only on the literal arguments; eligible for constant folding. */
    PURE,
    /** Output depends on per-request data; always emitted unchanged. */
    CONTEXT_DEPENDENT
}
