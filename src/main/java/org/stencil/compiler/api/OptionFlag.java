package org.stencil.compiler.api;

import java.util.Arrays;
import java.util.Optional;

/**
 * The named optimization flags a compilation unit can enable. Each flag has a configuration
 * name; prefixing it with {@code no-} removes the flag.
 */
public enum OptionFlag {
    /** Collapse insignificant whitespace and drop HTML comments. */
    WHITESPACE_COMPRESSION("whitespace-compression"),
    /** Track HTML structure. Without it text is passed through untouched. */
    HTML("html"),
    /** Merge inline scripts into one element. */
    MERGE_INTERNAL_JAVASCRIPT("merge-internal-javascript"),
    /** Merge inline styles into one element. */
    MERGE_INTERNAL_CSS("merge-internal-css"),
    /** Replace runs of local external scripts with one published bundle. */
    PACK_EXTERNAL_JAVASCRIPT("pack-external-javascript"),
    /** Replace runs of local stylesheets with one published bundle. */
    PACK_EXTERNAL_CSS("pack-external-css"),
    /** Minify inline styles. */
    COMPILE_CSS("compile-css"),
    /** Minify inline scripts and rename function-local variables. */
    COMPILE_JAVASCRIPT("compile-javascript"),
    /** Disable implicit closing of optional end tags. */
    PARSE_ALL_HTML_TAGS("parse-all-html-tags"),
    /** Run the HTML attribute checks. */
    VALIDATE_HTML("validate-html"),
    /** Drop {@code class=""} attributes. */
    HTML_REMOVE_EMPTY_CLASS_ATTRIBUTES("html-remove-empty-class-attributes"),
    /** Require alt and title attributes where HTML recommends them. */
    HTML_CHECK_ALT_AND_TITLE_ATTRIBUTES("html-check-alt-and-title-attributes"),
    /** Evaluate pure directives at compile time. */
    CONSTANT_FOLDING("constant-folding"),
    /** Report validation violations as warnings instead of errors. */
    HTML_VALIDATION_WARNINGS("html-validation-warnings");

    private final String configName;

    OptionFlag(String configName) {
        this.configName = configName;
    }

    /**
     * @return The name used in configuration files and inline overrides.
     */
    public String configName() {
        return configName;
    }

    /**
     * Looks up a flag by its configuration name (without {@code no-} prefix).
     * @param name The configuration name.
     * @return The flag, or empty if the name is unknown.
     */
    public static Optional<OptionFlag> fromConfigName(String name) {
        return Arrays.stream(values()).filter(f -> f.configName.equals(name)).findFirst();
    }
}
