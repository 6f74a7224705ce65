package org.stencil.compiler.backend.optimize.script;

/**
 * Thrown when script content cannot be tokenized, e.g. for an unterminated string literal, or
 * when compiled script content fails validation.
 */
public class JsSyntaxException extends Exception {

    /**
     * @param message Describes the malformed construct.
     */
    public JsSyntaxException(String message) {
        super(message);
    }
}
