package org.stencil.compiler.backend.optimize.script;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Splits flattened script content into significant tokens.
 * <p>
 * Template nodes are opaque atoms; inside string, template and regular expression literals they
 * are part of the literal. A template node inside a comment makes the content unsupported,
 * because dropping the comment would drop the node.
 */
final class JsTokenizer {

    static final Set<String> KEYWORDS = Set.of(
            "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete",
            "do", "else", "export", "extends", "finally", "for", "function", "if", "import", "in",
            "instanceof", "new", "return", "super", "switch", "this", "throw", "try", "typeof", "var",
            "void", "while", "with", "yield", "let", "static", "enum", "await", "implements", "package",
            "protected", "interface", "private", "public", "null", "true", "false");

    /** Keywords after which a slash starts a regular expression. */
    private static final Set<String> REGEX_AFTER_WORD = Set.of(
            "return", "typeof", "instanceof", "in", "of", "new", "delete", "void", "throw", "case",
            "do", "else", "yield", "await");

    private static final String[] PUNCTUATORS = {
            ">>>=", "...", "===", "!==", "**=", "<<=", ">>=", ">>>", "&&=", "||=", "??=",
            "=>", "==", "!=", "<=", ">=", "&&", "||", "??", "?.", "++", "--", "+=", "-=", "*=", "/=",
            "%=", "&=", "|=", "^=", "<<", ">>", "**"
    };

    private final FlatText source;
    private final List<JsToken> tokens = new ArrayList<>();
    private int pos;
    private boolean space;
    private boolean newline;

    JsTokenizer(FlatText source) {
        this.source = source;
    }

    /**
     * @return The tokens, or empty if the content uses a construct the minifier leaves alone.
     * @throws JsSyntaxException if a literal or comment is not terminated.
     */
    Optional<List<JsToken>> tokenize() throws JsSyntaxException {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (source.isOpaque(pos)) {
                add(JsToken.Type.OPAQUE, pos, pos + 1);
            } else if (isWhitespace(c)) {
                space = true;
                newline |= isLineTerminator(c);
                pos++;
            } else if (c == '/' && peek(1) == '/') {
                int end = pos;
                while (end < source.length() && !isLineTerminator(source.charAt(end))) end++;
                if (!comment(end)) return Optional.empty();
            } else if (c == '/' && peek(1) == '*') {
                int close = source.text().indexOf("*/", pos + 2);
                if (close < 0) throw new JsSyntaxException("Unterminated comment");
                if (!comment(close + 2)) return Optional.empty();
            } else if (c == '"' || c == '\'') {
                add(JsToken.Type.STRING, pos, stringEnd(c));
            } else if (c == '`') {
                add(JsToken.Type.TEMPLATE, pos, stringEnd('`'));
            } else if (c == '/' && regexAllowed()) {
                add(JsToken.Type.REGEX, pos, regexEnd());
            } else if (isWordChar(c)) {
                int end = pos;
                while (end < source.length() && isWordChar(source.charAt(end)) && !source.isOpaque(end)) end++;
                add(JsToken.Type.WORD, pos, end);
            } else {
                add(JsToken.Type.PUNCTUATOR, pos, pos + punctuatorLength());
            }
        }
        return Optional.of(tokens);
    }

    private boolean comment(int end) {
        for (int i = pos; i < end; i++) {
            if (source.isOpaque(i)) return false;
            newline |= isLineTerminator(source.charAt(i));
        }
        space = true;
        pos = end;
        return true;
    }

    private void add(JsToken.Type type, int start, int end) {
        tokens.add(new JsToken(type, source.text().substring(start, end), start, end, space, newline));
        space = false;
        newline = false;
        pos = end;
    }

    private int stringEnd(char quote) throws JsSyntaxException {
        int i = pos + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) return i + 1;
            if (quote != '`' && (c == '\n' || c == '\r')) break;
            i++;
        }
        throw new JsSyntaxException("Unterminated string literal starting with " + quote);
    }

    private int regexEnd() throws JsSyntaxException {
        int i = pos + 1;
        boolean inClass = false;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (isLineTerminator(c)) break;
            if (c == '[') inClass = true;
            else if (c == ']') inClass = false;
            else if (c == '/' && !inClass) {
                i++;
                while (i < source.length() && Character.isLetter(source.charAt(i))) i++;
                return i;
            }
            i++;
        }
        throw new JsSyntaxException("Unterminated regular expression");
    }

    private boolean regexAllowed() {
        if (tokens.isEmpty()) return true;
        JsToken previous = tokens.get(tokens.size() - 1);
        return switch (previous.type()) {
            case WORD -> REGEX_AFTER_WORD.contains(previous.text());
            case PUNCTUATOR -> !previous.is(")") && !previous.is("]");
            default -> false;
        };
    }

    private int punctuatorLength() {
        for (String p : PUNCTUATORS) {
            if (source.text().startsWith(p, pos)) return p.length();
        }
        return 1;
    }

    private char peek(int offset) {
        int i = pos + offset;
        return i < source.length() ? source.charAt(i) : '\0';
    }

    static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '\\'
                || (c > 127 && !isWhitespace(c) && c != FlatText.PLACEHOLDER);
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\u000B' || c == '\f' || c == '\u00A0' || c == '\uFEFF'
                || isLineTerminator(c) || Character.getType(c) == Character.SPACE_SEPARATOR;
    }

    private static boolean isLineTerminator(char c) {
        return c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029';
    }
}
