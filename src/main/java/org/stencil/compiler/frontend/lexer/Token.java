package org.stencil.compiler.frontend.lexer;

import org.stencil.compiler.api.SourceSpan;

/**
 * Represents a single token extracted from the source by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source.
 * @param name The directive name for directive tokens, otherwise {@code null}.
 *             Close tokens carry the name of the block they close (without {@code end}).
 * @param args The trimmed argument string of directives, the expression of
 *             {@link TokenType#EXPRESSION} and the text of {@link TokenType#COMMENT}.
 * @param span The source region covered by {@code text}.
 */
public record Token(
        TokenType type,
        String text,
        String name,
        String args,
        SourceSpan span
) {
}
