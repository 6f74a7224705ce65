package org.stencil.compiler.frontend.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a directive argument string on whitespace outside quotes. Quotes may start anywhere
 * inside an argument, as in {@code _("a b")} or {@code key="a b"}, and keep their quote
 * characters in the result.
 */
public final class ArgumentSplitter {

    private ArgumentSplitter() {
    }

    /**
     * @param raw The trimmed argument string.
     * @return The arguments.
     * @throws IllegalArgumentException if a quote is not terminated.
     */
    public static List<String> split(String raw) {
        List<String> result = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == '\\' && i + 1 < raw.length()) {
                    current.append(raw.charAt(++i));
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
                current.append(c);
            } else if (Character.isWhitespace(c)) {
                if (current.length() > 0) {
                    result.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (quote != 0) {
            throw new IllegalArgumentException("Unterminated " + quote + " quote in '" + raw + "'");
        }
        if (current.length() > 0) {
            result.add(current.toString());
        }
        return result;
    }

    /**
     * @param argument A single argument.
     * @return {@code true} if the whole argument is one quoted string.
     */
    public static boolean isQuoted(String argument) {
        if (argument.length() < 2) return false;
        char first = argument.charAt(0);
        if ((first != '"' && first != '\'') || argument.charAt(argument.length() - 1) != first) return false;
        for (int i = 1; i < argument.length() - 1; i++) {
            char c = argument.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == first) {
                return false;
            }
        }
        return true;
    }

    /**
     * @param argument A quoted argument, see {@link #isQuoted(String)}.
     * @return The content between the quotes with escapes resolved.
     */
    public static String unquote(String argument) {
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i < argument.length() - 1; i++) {
            char c = argument.charAt(i);
            if (c == '\\' && i + 1 < argument.length() - 1) {
                sb.append(argument.charAt(++i));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
