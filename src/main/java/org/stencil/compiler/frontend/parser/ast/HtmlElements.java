package org.stencil.compiler.frontend.parser.ast;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Static HTML knowledge shared by the normalizer and the passes.
 */
public final class HtmlElements {

    private static final Set<String> VOID = Set.of(
            "area", "base", "br", "col", "embed", "hr", "img", "input", "keygen", "link",
            "meta", "param", "source", "track", "wbr", "basefont", "frame", "isindex");

    private static final Set<String> RAW_TEXT = Set.of("script", "style", "textarea", "title");

    private static final Set<String> PRESERVE_WHITESPACE = Set.of("pre", "textarea", "script", "style");

    private static final Set<String> BLOCK_LEVEL = Set.of(
            "html", "head", "body", "title", "address", "article", "aside", "blockquote", "center",
            "dd", "details", "dialog", "dir", "div", "dl", "dt", "fieldset", "figcaption", "figure",
            "footer", "form", "frameset", "h1", "h2", "h3", "h4", "h5", "h6", "header", "hgroup", "hr",
            "li", "main", "menu", "nav", "noscript", "ol", "optgroup", "option", "p", "pre", "section",
            "summary", "table", "tbody", "td", "tfoot", "th", "thead", "tr", "ul", "br", "select",
            "caption", "colgroup", "col", "iframe", "legend", "map", "object", "base");

    /** Start tags that close a still-open {@code p}. */
    private static final Set<String> CLOSES_P = Set.of(
            "address", "article", "aside", "blockquote", "details", "div", "dl", "fieldset",
            "figcaption", "figure", "footer", "form", "h1", "h2", "h3", "h4", "h5", "h6", "header",
            "hgroup", "hr", "main", "menu", "nav", "ol", "p", "pre", "section", "table", "ul");

    /** For each element with an optional end tag, the start tags that imply its end. */
    private static final Map<String, Set<String>> IMPLIED_END = Map.of(
            "li", Set.of("li"),
            "dt", Set.of("dt", "dd"),
            "dd", Set.of("dt", "dd"),
            "option", Set.of("option", "optgroup"),
            "tr", Set.of("tr", "tbody", "tfoot", "thead"),
            "td", Set.of("td", "th", "tr", "tbody", "tfoot"),
            "th", Set.of("td", "th", "tr", "tbody", "tfoot"),
            "thead", Set.of("tbody", "tfoot"),
            "tbody", Set.of("tbody", "tfoot"));

    /** Elements whose end tag may be omitted. */
    private static final Set<String> OPTIONAL_END = Set.of(
            "li", "dt", "dd", "p", "option", "optgroup", "tr", "td", "th", "thead", "tbody", "tfoot",
            "colgroup", "caption", "rt", "rp", "html", "head", "body");

    private HtmlElements() {
    }

    /**
     * @param tagName A tag name as written.
     * @return The lower-case name.
     */
    public static String normalize(String tagName) {
        return tagName.toLowerCase(Locale.ROOT);
    }

    /**
     * @param name A lower-case tag name.
     * @return {@code true} if the element never has content or an end tag.
     */
    public static boolean isVoid(String name) {
        return VOID.contains(name);
    }

    /**
     * @param name A lower-case tag name.
     * @return {@code true} if the content is text up to the matching end tag.
     */
    public static boolean isRawText(String name) {
        return RAW_TEXT.contains(name);
    }

    /**
     * @param name A lower-case tag name.
     * @return {@code true} if whitespace inside the element is significant.
     */
    public static boolean preservesWhitespace(String name) {
        return PRESERVE_WHITESPACE.contains(name);
    }

    /**
     * @param name A lower-case tag name.
     * @return {@code true} if whitespace around the element is insignificant.
     */
    public static boolean isBlockLevel(String name) {
        return BLOCK_LEVEL.contains(name);
    }

    /**
     * @param open The lower-case name of the innermost open element.
     * @param next The lower-case name of a start tag being opened.
     * @return {@code true} if the start tag implies the end of {@code open}.
     */
    public static boolean impliesEndOf(String open, String next) {
        if (open.equals("p")) {
            return CLOSES_P.contains(next);
        }
        Set<String> implied = IMPLIED_END.get(open);
        return implied != null && implied.contains(next);
    }

    /**
     * @param name A lower-case tag name.
     * @return {@code true} if the end tag may be omitted and is implied by the enclosing end tag.
     */
    public static boolean hasOptionalEndTag(String name) {
        return OPTIONAL_END.contains(name);
    }
}
