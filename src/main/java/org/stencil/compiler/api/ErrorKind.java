package org.stencil.compiler.api;

/**
 * The failure taxonomy of a compilation unit. Every {@link CompilerErrorCode} belongs
 * to exactly one kind.
 */
public enum ErrorKind {
    /** Invalid or unterminated token in the source text. */
    LEX,
    /** Directive grammar violation (unmatched blocks, malformed arguments, unknown names). */
    PARSE,
    /** HTML open/close tags cannot be reconciled, also across directive branches. */
    STRUCTURAL,
    /** A pure directive could not be evaluated at compile time. */
    FOLD,
    /** An HTML rule violation reported by the validation pass. */
    VALIDATION
}
