package org.stencil.compiler.backend.optimize.script;

import org.stencil.compiler.diagnostics.CompilerLogger;
import org.stencil.compiler.frontend.parser.ast.Node;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Removes comments and insignificant whitespace from style content that may contain template
 * nodes. Malformed content is returned unchanged; browsers recover from it and so do we.
 */
public final class CssCompressor {

    /** Characters around which whitespace is never needed. */
    private static final String TIGHT = "{};,>";

    /** At-rules whose blocks hold rules rather than declarations. */
    private static final Set<String> RULE_CONTAINERS = Set.of("@media", "@supports", "@document", "@layer", "@container");

    private CssCompressor() {
    }

    /**
     * @param parts The text and template nodes of a style element.
     * @return The compressed nodes.
     */
    public static List<Node> compress(List<Node> parts) {
        Optional<FlatText> flat = FlatText.of(parts);
        if (flat.isEmpty()) {
            return parts;
        }
        FlatText source = flat.get();
        FlatText.Writer writer = source.writer();
        int pos = 0;
        int last = -1;
        int pendingSemicolon = -1;
        boolean space = false;
        int headerStart = -1;
        Deque<Boolean> declarationBlocks = new ArrayDeque<>();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '/' && pos + 1 < source.length() && source.charAt(pos + 1) == '*') {
                int close = source.text().indexOf("*/", pos + 2);
                if (close < 0 || source.text().substring(pos, close).indexOf(FlatText.PLACEHOLDER) >= 0) {
                    CompilerLogger.debug("CssCompressor: unsupported comment, content left unchanged");
                    return parts;
                }
                space = true;
                pos = close + 2;
                continue;
            }
            if (Character.isWhitespace(c)) {
                space = true;
                pos++;
                continue;
            }
            int end = pos + 1;
            if (c == '"' || c == '\'') {
                end = stringEnd(source, pos);
                if (end < 0) {
                    return parts;
                }
            }
            // A semicolon is written once the next token shows it is not the last before '}'.
            if (pendingSemicolon >= 0) {
                if (c != '}') {
                    writer.copy(pendingSemicolon, pendingSemicolon + 1);
                }
                pendingSemicolon = -1;
            }
            if (headerStart < 0) {
                headerStart = pos;
            }
            if (last >= 0) {
                boolean declarations = !declarationBlocks.isEmpty() && declarationBlocks.peek();
                String separator = separator(source, last, pos, space, declarations);
                if (!separator.isEmpty()) {
                    writer.write(separator, source.spanAt(last));
                }
            }
            if (c == ';') {
                pendingSemicolon = pos;
            } else {
                writer.copy(pos, end);
            }
            if (c == '{') {
                declarationBlocks.push(!isRuleContainer(source.text().substring(headerStart, pos)));
            } else if (c == '}' && !declarationBlocks.isEmpty()) {
                declarationBlocks.pop();
            }
            if (c == '{' || c == '}' || c == ';') {
                headerStart = -1;
            }
            last = end - 1;
            space = false;
            pos = end;
        }
        if (pendingSemicolon >= 0) {
            writer.copy(pendingSemicolon, pendingSemicolon + 1);
        }
        return writer.finish();
    }

    private static boolean isRuleContainer(String header) {
        String trimmed = header.trim();
        int end = 0;
        while (end < trimmed.length() && !Character.isWhitespace(trimmed.charAt(end)) && trimmed.charAt(end) != '(') {
            end++;
        }
        return RULE_CONTAINERS.contains(trimmed.substring(0, end).toLowerCase(Locale.ROOT));
    }

    private static String separator(FlatText source, int previous, int next, boolean space, boolean declarations) {
        char a = source.charAt(previous);
        char b = source.charAt(next);
        if (a == '{' && (source.isOpaque(next) || b == '{' || b == '%' || b == '#')) {
            return " ";
        }
        if (!space) {
            return "";
        }
        if (source.isOpaque(previous) || source.isOpaque(next)) {
            return " ";
        }
        // Inside a selector " :" means a descendant and must stay.
        if (declarations && b == ':') {
            return "";
        }
        if (TIGHT.indexOf(a) >= 0 || TIGHT.indexOf(b) >= 0 || a == ':') {
            return "";
        }
        return " ";
    }

    private static int stringEnd(FlatText source, int start) {
        char quote = source.charAt(start);
        int i = start + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) return i + 1;
            if (c == '\n') return -1;
            i++;
        }
        return -1;
    }
}
