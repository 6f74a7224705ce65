package org.stencil.compiler.frontend.lexer;

import org.stencil.compiler.api.CompilerErrorCode;
import org.stencil.compiler.api.SourceSpan;
import org.stencil.compiler.diagnostics.DiagnosticsEngine;
import org.stencil.compiler.frontend.directive.DirectiveRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The Lexer is responsible for converting a template source into a sequence of tokens.
 * It switches between a literal mode for text and a directive mode for {@code {% %}},
 * {@code {{ }}} and {@code {# #}}. The texts of all tokens concatenated reproduce the source.
 */
public class Lexer {

    /** Name of the directive that introduces an inline option override. */
    public static final String OPTION_OVERRIDE = "!";

    private static final String RAW_BEGIN = "!raw";
    private static final String RAW_END = "!endraw";
    private static final Pattern RAW_END_MARKER = Pattern.compile("\\{%\\s*!endraw\\s*%}");

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final DirectiveRegistry registry;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The template source.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the template, for error reporting.
     * @param registry Decides which directive names open and close blocks.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName, DirectiveRegistry registry) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
        this.registry = registry;
    }

    /**
     * Performs the tokenization of the entire source.
     * @return A list of the recognized tokens, terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        start = current;
        startLine = line;
        startColumn = column;
        addToken(TokenType.END_OF_FILE, null, null);
        return tokens;
    }

    private void scanToken() {
        if (peek() == '{' && (peekNext() == '%' || peekNext() == '{' || peekNext() == '#') && !isBraceBeforeDirective()) {
            char kind = peekNext();
            advance();
            advance();
            switch (kind) {
                case '%' -> directive();
                case '{' -> delimited("}}", TokenType.EXPRESSION);
                default -> delimited("#}", TokenType.COMMENT);
            }
        } else {
            text();
        }
    }

    /**
     * A literal brace directly followed by a directive, as in {@code function(){{% if a %}}.
     * The first brace is text, the directive starts at the second one.
     */
    private boolean isBraceBeforeDirective() {
        return peekNext() == '{' && current + 2 < source.length() && source.charAt(current + 2) == '%';
    }

    private void text() {
        advance();
        while (!isAtEnd()) {
            if (peek() == '{' && (peekNext() == '%' || peekNext() == '#')) break;
            if (peek() == '{' && peekNext() == '{' && !isBraceBeforeDirective()) break;
            advance();
        }
        addToken(TokenType.TEXT, null, null);
    }

    private void delimited(String terminator, TokenType type) {
        int end = source.indexOf(terminator, current);
        if (end < 0) {
            unterminated(terminator);
            return;
        }
        advanceTo(end + terminator.length());
        addToken(type, null, source.substring(start + 2, end).trim());
    }

    private void directive() {
        int end = source.indexOf("%}", current);
        if (end < 0) {
            unterminated("%}");
            return;
        }
        String content = source.substring(current, end).trim();
        advanceTo(end + 2);

        if (content.isEmpty()) {
            diagnostics.reportError(CompilerErrorCode.INVALID_TOKEN, "Empty directive.", currentSpan());
            addToken(TokenType.TEXT, null, null);
            return;
        }
        if (content.equals(RAW_BEGIN)) {
            rawBlock();
            return;
        }
        if (content.equals(RAW_END)) {
            diagnostics.reportError(CompilerErrorCode.INVALID_TOKEN,
                    "Raw end marker without a matching " + RAW_BEGIN + ".", currentSpan());
            addToken(TokenType.TEXT, null, null);
            return;
        }
        if (content.startsWith(OPTION_OVERRIDE)) {
            addToken(TokenType.DIRECTIVE_INLINE, OPTION_OVERRIDE, content.substring(1).trim());
            return;
        }

        int split = 0;
        while (split < content.length() && !Character.isWhitespace(content.charAt(split))) split++;
        String name = content.substring(0, split);
        String args = content.substring(split).trim();

        if (name.startsWith("end") && registry.isBlock(name.substring(3))) {
            addToken(TokenType.DIRECTIVE_CLOSE, name.substring(3), args);
        } else if (registry.isBlock(name)) {
            addToken(TokenType.DIRECTIVE_OPEN, name, args);
        } else {
            addToken(TokenType.DIRECTIVE_INLINE, name, args);
        }
    }

    private void rawBlock() {
        SourceSpan openSpan = currentSpan();
        Matcher matcher = RAW_END_MARKER.matcher(source);
        if (!matcher.find(current)) {
            diagnostics.reportError(CompilerErrorCode.UNTERMINATED_RAW_BLOCK,
                    "Unterminated raw block; expected {% " + RAW_END + " %}.", openSpan);
            addToken(TokenType.TEXT, null, null);
            start = current;
            startLine = line;
            startColumn = column;
            advanceTo(source.length());
            if (current > start) addToken(TokenType.TEXT, null, null);
            return;
        }
        addToken(TokenType.RAW_BEGIN, RAW_BEGIN, "");

        if (matcher.start() > current) {
            start = current;
            startLine = line;
            startColumn = column;
            advanceTo(matcher.start());
            addToken(TokenType.RAW_TEXT, null, null);
        }

        start = current;
        startLine = line;
        startColumn = column;
        advanceTo(matcher.end());
        addToken(TokenType.RAW_END, RAW_END, "");
    }

    private void unterminated(String terminator) {
        diagnostics.reportError(CompilerErrorCode.UNTERMINATED_TAG,
                "Unterminated tag; expected '" + terminator + "'.", currentSpan());
        advanceTo(source.length());
        addToken(TokenType.TEXT, null, null);
    }

    private void addToken(TokenType type, String name, String args) {
        tokens.add(new Token(type, source.substring(start, current), name, args, currentSpan()));
    }

    private SourceSpan currentSpan() {
        return new SourceSpan(logicalFileName, start, current, startLine, startColumn);
    }

    private void advanceTo(int position) {
        while (current < position) advance();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }
}
