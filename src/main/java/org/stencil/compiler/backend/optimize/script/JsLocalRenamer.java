package org.stencil.compiler.backend.optimize.script;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Shortens the names of variables declared inside functions.
 * <p>
 * Each function body is a scope holding its parameters, the first name of each {@code var}
 * statement and the names of nested function declarations. Top-level names are global and keep
 * their names, as does every name that is not resolved to a scope; new names never collide
 * with them. Content using constructs whose scoping this analysis does not model is left
 * unchanged.
 */
final class JsLocalRenamer {

    private static final Set<String> UNSUPPORTED_WORDS = Set.of("eval", "with", "let", "const", "class", "import");
    private static final Set<String> UNSUPPORTED_PUNCTUATORS = Set.of("=>", "...");

    private final List<JsToken> tokens;
    private final Map<Integer, Scope> references = new LinkedHashMap<>();
    private final Set<String> reserved = new HashSet<>(JsTokenizer.KEYWORDS);

    private JsLocalRenamer(List<JsToken> tokens) {
        this.tokens = tokens;
    }

    /**
     * @param tokens The tokens of a script.
     * @return The tokens with local names replaced, or empty if the script is not supported.
     */
    static Optional<List<JsToken>> rename(List<JsToken> tokens) {
        return new JsLocalRenamer(tokens).run();
    }

    private Optional<List<JsToken>> run() {
        for (JsToken token : tokens) {
            if (token.type() == JsToken.Type.OPAQUE || token.type() == JsToken.Type.TEMPLATE
                    || (token.type() == JsToken.Type.WORD && UNSUPPORTED_WORDS.contains(token.text()))
                    || (token.type() == JsToken.Type.PUNCTUATOR && UNSUPPORTED_PUNCTUATORS.contains(token.text()))) {
                return Optional.empty();
            }
        }
        Scope root = new Scope(null);
        if (!analyze(root)) {
            return Optional.empty();
        }

        Map<Integer, Scope.Symbol> resolved = new HashMap<>();
        for (Map.Entry<Integer, Scope> reference : references.entrySet()) {
            String name = tokens.get(reference.getKey()).text();
            Scope.Symbol symbol = reference.getValue().resolve(name);
            if (symbol == null) {
                reserved.add(name);
            } else {
                resolved.put(reference.getKey(), symbol);
            }
        }
        for (Scope child : root.children) {
            assign(child, new HashSet<>());
        }

        List<JsToken> result = new ArrayList<>(tokens);
        resolved.forEach((index, symbol) -> result.set(index, tokens.get(index).renamed(symbol.newName)));
        return Optional.of(result);
    }

    // region Analysis

    private boolean analyze(Scope root) {
        Deque<String> brackets = new ArrayDeque<>();
        Deque<Integer> bodyDepths = new ArrayDeque<>();
        Scope scope = root;
        int i = 0;
        while (i < tokens.size()) {
            JsToken token = tokens.get(i);
            if (token.is("function")) {
                int next = i + 1;
                if (isIdentifier(next)) {
                    if (scope != root) scope.declare(text(next));
                    references.put(next, scope);
                    next++;
                }
                Scope function = new Scope(scope);
                next = parameters(next, function);
                if (next < 0 || next >= tokens.size() || !tokens.get(next).is("{")) {
                    return false;
                }
                scope = function;
                brackets.push("{");
                bodyDepths.push(brackets.size());
                i = next + 1;
                continue;
            }
            if (token.type() == JsToken.Type.PUNCTUATOR) {
                String p = token.text();
                if (p.equals("(") || p.equals("[") || p.equals("{")) {
                    brackets.push(p);
                } else if (p.equals(")") || p.equals("]") || p.equals("}")) {
                    if (brackets.isEmpty()) return false;
                    if (!bodyDepths.isEmpty() && bodyDepths.peek() == brackets.size()) {
                        bodyDepths.pop();
                        scope = scope.parent;
                    }
                    brackets.pop();
                }
            } else if (token.is("var")) {
                if (!isIdentifier(i + 1)) return false;
                if (scope != root) scope.declare(text(i + 1));
            } else if (token.is("catch")) {
                if (i + 2 < tokens.size() && tokens.get(i + 1).is("(") && isIdentifier(i + 2)) {
                    reserved.add(text(i + 2));
                }
            } else if ((token.is("break") || token.is("continue")) && isIdentifier(i + 1)
                    && !tokens.get(i + 1).newlineBefore()) {
                return false;
            } else if (isIdentifier(i)) {
                if (!reference(i, brackets)) return false;
                if (!isPropertyName(i)) {
                    references.put(i, scope);
                }
            }
            i++;
        }
        return brackets.isEmpty();
    }

    /**
     * Declares the parameter list starting at {@code index}.
     * @return The index after the closing parenthesis, or -1 for a list that is not plain names.
     */
    private int parameters(int index, Scope function) {
        if (index >= tokens.size() || !tokens.get(index).is("(")) return -1;
        int i = index + 1;
        if (i < tokens.size() && tokens.get(i).is(")")) return i + 1;
        while (i < tokens.size()) {
            if (!isIdentifier(i)) return -1;
            function.declare(text(i));
            references.put(i, function);
            i++;
            if (i < tokens.size() && tokens.get(i).is(")")) return i + 1;
            if (i >= tokens.size() || !tokens.get(i).is(",")) return -1;
            i++;
        }
        return -1;
    }

    /**
     * Rejects shorthand object members, whose name is key and value at once.
     */
    private boolean reference(int i, Deque<String> brackets) {
        if (!"{".equals(brackets.peek())) return true;
        boolean memberStart = i > 0 && (tokens.get(i - 1).is("{") || tokens.get(i - 1).is(","));
        if (!memberStart) return true;
        if (i + 1 >= tokens.size()) return true;
        JsToken next = tokens.get(i + 1);
        if (next.is(",") || next.is("}")) return false;
        // get name() {} and set name(v) {}
        return !((text(i).equals("get") || text(i).equals("set")) && isIdentifier(i + 1));
    }

    private boolean isPropertyName(int i) {
        if (i > 0 && (tokens.get(i - 1).is(".") || tokens.get(i - 1).is("?."))) return true;
        boolean memberStart = i > 0 && (tokens.get(i - 1).is("{") || tokens.get(i - 1).is(","));
        return memberStart && i + 1 < tokens.size() && tokens.get(i + 1).is(":");
    }

    private boolean isIdentifier(int i) {
        if (i >= tokens.size()) return false;
        JsToken token = tokens.get(i);
        return token.type() == JsToken.Type.WORD
                && !JsTokenizer.KEYWORDS.contains(token.text())
                && !Character.isDigit(token.text().charAt(0))
                && token.text().indexOf('\\') < 0;
    }

    private String text(int i) {
        return tokens.get(i).text();
    }

    // endregion

    // region Naming

    private void assign(Scope scope, Set<String> taken) {
        Set<String> inner = new HashSet<>(taken);
        int counter = 0;
        for (Scope.Symbol symbol : scope.symbols.values()) {
            String name;
            do {
                name = generateName(counter++);
            } while (reserved.contains(name) || inner.contains(name));
            symbol.newName = name;
            inner.add(name);
        }
        for (Scope child : scope.children) {
            assign(child, inner);
        }
    }

    /**
     * @return The n-th short name: a..z, then aa, ab and so on.
     */
    static String generateName(int n) {
        StringBuilder sb = new StringBuilder();
        int value = n;
        do {
            sb.insert(0, (char) ('a' + value % 26));
            value = value / 26 - 1;
        } while (value >= 0);
        return sb.toString();
    }

    // endregion

    private static final class Scope {

        final Scope parent;
        final List<Scope> children = new ArrayList<>();
        final Map<String, Symbol> symbols = new LinkedHashMap<>();

        Scope(Scope parent) {
            this.parent = parent;
            if (parent != null) {
                parent.children.add(this);
            }
        }

        void declare(String name) {
            symbols.computeIfAbsent(name, n -> new Symbol());
        }

        /**
         * Resolves a name through the enclosing function scopes. The top-level scope holds no
         * symbols, so globals resolve to {@code null}.
         */
        Symbol resolve(String name) {
            for (Scope s = this; s != null; s = s.parent) {
                Symbol symbol = s.symbols.get(name);
                if (symbol != null) return symbol;
            }
            return null;
        }

        static final class Symbol {
            String newName;
        }
    }
}
