package org.stencil.compiler.backend.optimize;

/**
 * The kind of an external asset bundle.
 */
public enum AssetKind {
    JAVASCRIPT,
    CSS
}
