package org.stencil.compiler.backend.optimize.script;

import org.stencil.compiler.diagnostics.CompilerLogger;
import org.stencil.compiler.frontend.parser.ast.Node;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Removes comments and insignificant whitespace from script content that may contain template
 * nodes.
 * <p>
 * A whitespace run between two tokens is dropped, reduced to one space where the tokens would
 * otherwise fuse, or reduced to a line break where automatic semicolon insertion could depend
 * on it. Where no whitespace existed none is added, except to keep a brace in the output from
 * opening a template tag.
 */
public final class JsMinifier {

    private static final Set<String> ENDS_STATEMENT = Set.of(")", "]", "}", "++", "--");
    private static final Set<String> STARTS_STATEMENT = Set.of("(", "[", "{", "+", "-", "++", "--", "!", "~");

    private JsMinifier() {
    }

    /**
     * Minifies script content.
     *
     * @param parts   The text and template nodes of a script element.
     * @param compile {@code true} to also validate the content and shorten function-local variable names.
     * @return The minified nodes; the input unchanged if it uses constructs this minifier leaves alone.
     * @throws JsSyntaxException if a literal or comment is not terminated, or if compiled content
     *                           fails validation.
     */
    public static List<Node> minify(List<Node> parts, boolean compile) throws JsSyntaxException {
        Optional<FlatText> flat = FlatText.of(parts);
        if (flat.isEmpty()) {
            return parts;
        }
        Optional<List<JsToken>> tokens = new JsTokenizer(flat.get()).tokenize();
        if (tokens.isEmpty()) {
            CompilerLogger.debug("JsMinifier: template node inside a comment, content left unchanged");
            return parts;
        }
        List<JsToken> result = tokens.get();
        if (compile) {
            JsValidator.validate(result);
            result = JsLocalRenamer.rename(result).orElseGet(() -> {
                CompilerLogger.debug("JsMinifier: local renaming skipped for unsupported constructs");
                return tokens.get();
            });
        }
        return write(flat.get(), result);
    }

    private static List<Node> write(FlatText flat, List<JsToken> tokens) {
        FlatText.Writer writer = flat.writer();
        JsToken previous = null;
        for (JsToken token : tokens) {
            if (previous != null) {
                String separator = separator(previous, token);
                if (!separator.isEmpty()) {
                    writer.write(separator, flat.spanAt(previous.end() - 1));
                }
            }
            if (token.text().equals(flat.text().substring(token.start(), token.end()))) {
                writer.copy(token.start(), token.end());
            } else {
                writer.write(token.text(), flat.spanAt(token.start()));
            }
            previous = token;
        }
        return writer.finish();
    }

    static String separator(JsToken a, JsToken b) {
        if (!b.spaceBefore()) {
            return guarded(a, b) ? " " : "";
        }
        if (b.newlineBefore() && endsStatement(a) && startsStatement(b)) {
            return "\n";
        }
        if (wordAtEnd(a) && wordAtStart(b)) return " ";
        if (a.type() == JsToken.Type.WORD && Character.isDigit(a.text().charAt(0)) && b.is(".")) return " ";
        if (a.text().endsWith("+") && b.text().startsWith("+")) return " ";
        if (a.text().endsWith("-") && b.text().startsWith("-")) return " ";
        if (a.text().endsWith("/") && (b.text().startsWith("/") || b.text().startsWith("*"))) return " ";
        // Keep the output from spelling "<!--", "-->" or "</" inside a script element.
        if (a.text().endsWith("<") && (b.text().startsWith("!") || b.text().startsWith("/"))) return " ";
        if (a.text().endsWith("--") && b.text().startsWith(">")) return " ";
        return guarded(a, b) ? " " : "";
    }

    /**
     * @return {@code true} if joining the tokens would open a template tag.
     */
    private static boolean guarded(JsToken a, JsToken b) {
        if (a.type() == JsToken.Type.OPAQUE || !a.text().endsWith("{")) {
            return false;
        }
        return b.type() == JsToken.Type.OPAQUE
                || b.text().startsWith("{") || b.text().startsWith("%") || b.text().startsWith("#");
    }

    private static boolean endsStatement(JsToken token) {
        return switch (token.type()) {
            case PUNCTUATOR -> ENDS_STATEMENT.contains(token.text());
            default -> true;
        };
    }

    private static boolean startsStatement(JsToken token) {
        return switch (token.type()) {
            case PUNCTUATOR -> STARTS_STATEMENT.contains(token.text());
            default -> true;
        };
    }

    private static boolean wordAtEnd(JsToken token) {
        return token.type() == JsToken.Type.WORD || token.type() == JsToken.Type.OPAQUE
                || token.type() == JsToken.Type.REGEX;
    }

    private static boolean wordAtStart(JsToken token) {
        return token.type() == JsToken.Type.WORD || token.type() == JsToken.Type.OPAQUE;
    }
}
