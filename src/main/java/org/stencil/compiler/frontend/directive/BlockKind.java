package org.stencil.compiler.frontend.directive;

/**
 * How the render paths of a block directive relate to each other. The structural normalizer
 * uses this to decide which tag stacks have to agree at the directive's exit.
 */
public enum BlockKind {
    /**
     * Renders at most one branch. Without a terminal branch (e.g. {@code else}) the
     * directive may render nothing, so the empty path takes part in reconciliation.
     */
    CONDITIONAL,
    /** Renders exactly one branch; the empty path does not exist. */
    ALTERNATIVES,
    /** Renders its body zero or more times; the body must leave the tag stack as entered. */
    LOOP,
    /** An overridable region whose body must leave the tag stack as entered. */
    BLOCK
}
