package org.stencil.compiler.backend.optimize.script;

/**
 * A significant token of script content. Whitespace and comments are not tokens; they are
 * recorded as flags on the token that follows them.
 *
 * @param type The token type.
 * @param text The token text; a renamed identifier differs from the source range.
 * @param start The start index in the flattened content.
 * @param end The end index in the flattened content.
 * @param spaceBefore {@code true} if whitespace or a comment precedes the token.
 * @param newlineBefore {@code true} if that whitespace contains a line break.
 */
record JsToken(Type type, String text, int start, int end, boolean spaceBefore, boolean newlineBefore) {

    enum Type {
        /** Identifier, keyword or number. */
        WORD,
        STRING,
        TEMPLATE,
        REGEX,
        PUNCTUATOR,
        /** A template node. */
        OPAQUE
    }

    boolean is(String value) {
        return (type == Type.PUNCTUATOR || type == Type.WORD) && text.equals(value);
    }

    JsToken renamed(String newName) {
        return new JsToken(type, newName, start, end, spaceBefore, newlineBefore);
    }
}
