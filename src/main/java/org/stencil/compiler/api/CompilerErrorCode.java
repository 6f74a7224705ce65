package org.stencil.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the error messages.
 */
public enum CompilerErrorCode {
    // region Lexer Errors
    /** A {@code {% !raw %}} block was never closed with {@code {% !endraw %}}. */
    UNTERMINATED_RAW_BLOCK(ErrorKind.LEX),
    /** A {@code {%}, {@code {{} or {@code {#} delimiter was never closed. */
    UNTERMINATED_TAG(ErrorKind.LEX),
    /** A directive tag without a name, e.g. {@code {% %}}. */
    INVALID_TOKEN(ErrorKind.LEX),
    // endregion

    // region Parser Errors
    /** A block directive was not closed before the end of the template. */
    BLOCK_NOT_CLOSED(ErrorKind.PARSE),
    /** A close directive does not match the innermost open block. */
    MISMATCHED_CLOSE(ErrorKind.PARSE),
    /** A close directive appeared without any open block. */
    UNEXPECTED_CLOSE(ErrorKind.PARSE),
    /** A branch keyword (e.g. else) appeared outside of a block that accepts it. */
    UNEXPECTED_BRANCH(ErrorKind.PARSE),
    /** A directive name is not registered. */
    UNKNOWN_DIRECTIVE(ErrorKind.PARSE),
    /** The argument list of a directive is malformed or has the wrong arity. */
    MALFORMED_ARGUMENTS(ErrorKind.PARSE),
    /** An inline option override names an unknown flag. */
    UNKNOWN_OPTION(ErrorKind.PARSE),
    // endregion

    // region Structural Errors
    /** An end tag has no matching start tag. */
    UNMATCHED_END_TAG(ErrorKind.STRUCTURAL),
    /** A start tag was never closed. */
    UNCLOSED_ELEMENT(ErrorKind.STRUCTURAL),
    /** Render paths of a directive leave different tags open. */
    DIVERGENT_BRANCHES(ErrorKind.STRUCTURAL),
    /** A loop or block body opens or closes tags it does not balance. */
    UNBALANCED_BODY(ErrorKind.STRUCTURAL),
    /** A tag, attribute or comment is malformed or cut by a template node. */
    MALFORMED_TAG(ErrorKind.STRUCTURAL),
    // endregion

    // region Folding Errors
    /** A pure directive evaluator failed. */
    EVALUATION_FAILED(ErrorKind.FOLD),
    /** A pure directive received an argument that is not a literal. */
    NON_LITERAL_ARGUMENT(ErrorKind.FOLD),
    // endregion

    // region Validation Errors
    /** An attribute appears more than once on the same element. */
    DUPLICATE_ATTRIBUTE(ErrorKind.VALIDATION),
    /** An attribute name or unquoted value contains illegal characters. */
    INVALID_ATTRIBUTE(ErrorKind.VALIDATION),
    /** An element lacks an attribute required by the configured ruleset. */
    MISSING_REQUIRED_ATTRIBUTE(ErrorKind.VALIDATION),
    /** Embedded script content could not be processed. */
    INVALID_SCRIPT(ErrorKind.VALIDATION);
    // endregion

    private final ErrorKind kind;

    CompilerErrorCode(ErrorKind kind) {
        this.kind = kind;
    }

    /**
     * @return The failure category this code belongs to.
     */
    public ErrorKind kind() {
        return kind;
    }
}
