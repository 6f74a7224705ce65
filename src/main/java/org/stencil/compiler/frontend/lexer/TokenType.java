package org.stencil.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** Literal text between template constructs, usually HTML. */
    TEXT,

    // Directives.
    /** {@code {% name args %}} where {@code name} is a registered block directive. */
    DIRECTIVE_OPEN,
    /** {@code {% endname %}} closing a registered block directive. */
    DIRECTIVE_CLOSE,
    /** Any other directive, including branch keywords and option overrides. */
    DIRECTIVE_INLINE,

    // Opaque constructs.
    /** {@code {{ expr }}}. */
    EXPRESSION,
    /** {@code {# text #}}. */
    COMMENT,

    // Raw passthrough.
    /** The {@code {% !raw %}} marker. */
    RAW_BEGIN,
    /** The verbatim content of a raw block. */
    RAW_TEXT,
    /** The {@code {% !endraw %}} marker. */
    RAW_END,

    /** Represents the end of the source file. */
    END_OF_FILE
}
