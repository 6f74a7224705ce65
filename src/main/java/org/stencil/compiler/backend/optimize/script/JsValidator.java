package org.stencil.compiler.backend.optimize.script;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Rejects script content that only works through lenient parsing: a trailing comma before a
 * closing brace, statements that rely on automatic semicolon insertion, and {@code gettext}
 * calls whose message is not made of string literals.
 * <p>
 * The check is a heuristic over bracket groups, not a parser. Brackets are grouped first; each
 * brace group and the top level are then checked as a statement list, while parenthesized and
 * bracketed groups count as single operands.
 */
final class JsValidator {

    /** Keywords that start a statement which does not end with a semicolon. */
    private static final Set<String> BLOCK_STATEMENTS = Set.of("for", "if", "switch", "function", "try", "catch", "while");

    private JsValidator() {
    }

    /**
     * A token, or a bracket group with its content.
     */
    private static final class Item {
        final JsToken token;
        final List<Item> children;

        Item(JsToken token, List<Item> children) {
            this.token = token;
            this.children = children;
        }

        boolean isGroup(String open) {
            return children != null && token.is(open);
        }

        boolean isPunctuator() {
            return children == null && token.type() == JsToken.Type.PUNCTUATOR;
        }

        boolean isKeyword(String keyword) {
            return children == null && token.type() == JsToken.Type.WORD && token.text().equals(keyword);
        }

        boolean isVariable() {
            return children == null && token.type() == JsToken.Type.WORD && !JsTokenizer.KEYWORDS.contains(token.text());
        }
    }

    /**
     * @param tokens The tokens of one script.
     * @throws JsSyntaxException for the first violation found.
     */
    static void validate(List<JsToken> tokens) throws JsSyntaxException {
        List<Item> top = group(tokens);
        checkStatements(top);
        checkGroups(top);
    }

    private static List<Item> group(List<JsToken> tokens) throws JsSyntaxException {
        Deque<List<Item>> open = new ArrayDeque<>();
        Deque<JsToken> openers = new ArrayDeque<>();
        List<Item> current = new ArrayList<>();
        for (JsToken token : tokens) {
            if (token.is("(") || token.is("[") || token.is("{")) {
                open.push(current);
                openers.push(token);
                current = new ArrayList<>();
            } else if (token.is(")") || token.is("]") || token.is("}")) {
                if (openers.isEmpty() || !matches(openers.peek(), token)) {
                    throw new JsSyntaxException("Unbalanced '" + token.text() + "'");
                }
                List<Item> children = current;
                current = open.pop();
                current.add(new Item(openers.pop(), children));
            } else {
                current.add(new Item(token, null));
            }
        }
        if (!openers.isEmpty()) {
            throw new JsSyntaxException("Unclosed '" + openers.peek().text() + "'");
        }
        return current;
    }

    private static boolean matches(JsToken opener, JsToken closer) {
        return opener.is("(") && closer.is(")") || opener.is("[") && closer.is("]") || opener.is("{") && closer.is("}");
    }

    private static void checkGroups(List<Item> items) throws JsSyntaxException {
        for (int i = 0; i < items.size(); i++) {
            Item item = items.get(i);
            if (item.isVariable() && item.token.text().equals("gettext") && i + 1 < items.size()
                    && items.get(i + 1).isGroup("(")) {
                checkGettext(items.get(i + 1));
            }
            if (item.children == null) {
                continue;
            }
            if (item.isGroup("{")) {
                if (!item.children.isEmpty() && item.children.get(item.children.size() - 1).token.is(",")) {
                    throw new JsSyntaxException("Trailing comma at the end of an object or block");
                }
                checkStatements(item.children);
            }
            checkGroups(item.children);
        }
    }

    private static void checkGettext(Item call) throws JsSyntaxException {
        if (call.children.stream().anyMatch(c -> c.token.type() == JsToken.Type.OPAQUE)) {
            return;
        }
        for (Item argument : call.children) {
            boolean literal = argument.children == null && argument.token.type() == JsToken.Type.STRING;
            if (!literal && !argument.token.is("+")) {
                throw new JsSyntaxException("Unexpected token '" + argument.token.text() + "' inside gettext(...)");
            }
        }
    }

    private static void checkStatements(List<Item> items) throws JsSyntaxException {
        boolean required = false;
        int i = 0;
        while (i < items.size()) {
            Item item = items.get(i);
            if (item.children == null && item.token.type() == JsToken.Type.WORD
                    && BLOCK_STATEMENTS.contains(item.token.text())) {
                if (required) {
                    throw missing(item);
                }
                required = false;
                if (item.isKeyword("function")) {
                    // A function expression assigned to a name is a statement of its own.
                    required = i > 0 && items.get(i - 1).token.is("=");
                    i++;
                    if (i < items.size() && items.get(i).isVariable()) {
                        i++;
                    }
                } else {
                    i++;
                }
                if (i < items.size() && items.get(i).isGroup("(")) {
                    i++;
                }
                if (i < items.size() && items.get(i).isGroup("{")) {
                    i++;
                }
                continue;
            }
            if (item.isKeyword("var")) {
                if (i > 0 && !terminates(items.get(i - 1))) {
                    throw missing(item);
                }
            } else if (item.isPunctuator()) {
                required = false;
            } else if (item.isGroup("(") || item.isGroup("[")) {
                required = true;
            } else if (item.isGroup("{")) {
                required = false;
            } else if (item.isKeyword("return")) {
                if (required) {
                    throw missing(item);
                }
                required = false;
            } else if (item.isVariable()) {
                if (required) {
                    throw missing(item);
                }
                required = true;
            }
            i++;
        }
    }

    private static boolean terminates(Item previous) {
        return previous.token.is(";") || previous.token.is(":") || previous.isGroup("{") || previous.isGroup("(")
                || previous.token.type() == JsToken.Type.OPAQUE;
    }

    private static JsSyntaxException missing(Item item) {
        return new JsSyntaxException("Missing semicolon before '" + item.token.text() + "'");
    }
}
