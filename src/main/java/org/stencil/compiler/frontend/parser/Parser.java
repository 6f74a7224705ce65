package org.stencil.compiler.frontend.parser;

import org.stencil.compiler.api.CompilerErrorCode;
import org.stencil.compiler.api.OptionFlag;
import org.stencil.compiler.api.SourceSpan;
import org.stencil.compiler.diagnostics.DiagnosticsEngine;
import org.stencil.compiler.frontend.directive.BranchKeyword;
import org.stencil.compiler.frontend.directive.DirectiveEntry;
import org.stencil.compiler.frontend.directive.DirectiveRegistry;
import org.stencil.compiler.frontend.lexer.Lexer;
import org.stencil.compiler.frontend.lexer.Token;
import org.stencil.compiler.frontend.lexer.TokenType;
import org.stencil.compiler.frontend.parser.ast.Branch;
import org.stencil.compiler.frontend.parser.ast.CommentNode;
import org.stencil.compiler.frontend.parser.ast.DirectiveNode;
import org.stencil.compiler.frontend.parser.ast.DocumentNode;
import org.stencil.compiler.frontend.parser.ast.ExpressionNode;
import org.stencil.compiler.frontend.parser.ast.Node;
import org.stencil.compiler.frontend.parser.ast.OptionNode;
import org.stencil.compiler.frontend.parser.ast.RawNode;
import org.stencil.compiler.frontend.parser.ast.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The directive grammar parser. It consumes the tokens of the {@link Lexer} and produces a
 * {@link DocumentNode} whose block directives hold their render paths as sibling branches.
 * Markup inside text is left untouched; it is the structural normalizer's job.
 */
public class Parser {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final DirectiveRegistry registry;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by {@link TokenType#END_OF_FILE}.
     * @param diagnostics The engine for reporting errors.
     * @param registry Supplies directive arity and branch keywords.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, DirectiveRegistry registry) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.registry = registry;
    }

    /**
     * Parses the entire token stream.
     * @return The document node. Check the diagnostics engine for errors afterwards.
     */
    public DocumentNode parse() {
        List<Node> children = sequence(null);
        Token eof = peek();
        SourceSpan span = new SourceSpan(eof.span().fileName(), 0, eof.span().end(), 1, 1);
        return new DocumentNode(eof.span().fileName(), children, span);
    }

    /**
     * Parses nodes until the end of input, a close directive or a branch keyword of the
     * enclosing block.
     */
    private List<Node> sequence(DirectiveEntry enclosing) {
        List<Node> nodes = new ArrayList<>();
        while (!isAtEnd()) {
            Token token = peek();
            switch (token.type()) {
                case TEXT -> nodes.add(new TextNode(advance().text(), token.span()));
                case EXPRESSION -> nodes.add(new ExpressionNode(advance().args(), token.span()));
                case COMMENT -> {
                    advance();
                    nodes.add(new CommentNode(CommentNode.Kind.TEMPLATE,
                            List.of(new TextNode(token.args(), token.span())), token.span()));
                }
                case RAW_BEGIN -> nodes.add(raw());
                case DIRECTIVE_OPEN -> nodes.add(block());
                case DIRECTIVE_CLOSE -> {
                    if (enclosing != null) {
                        return nodes;
                    }
                    advance();
                    diagnostics.reportError(CompilerErrorCode.UNEXPECTED_CLOSE,
                            "Unexpected {% end" + token.name() + " %} without an open block.", token.span());
                }
                case DIRECTIVE_INLINE -> {
                    if (enclosing != null && enclosing.branch(token.name()).isPresent()) {
                        return nodes;
                    }
                    Node node = inline();
                    if (node != null) nodes.add(node);
                }
                default -> {
                    advance();
                    diagnostics.reportError(CompilerErrorCode.INVALID_TOKEN,
                            "Unexpected token " + token.type() + ".", token.span());
                }
            }
        }
        return nodes;
    }

    private Node block() {
        Token open = advance();
        DirectiveEntry entry = registry.lookup(open.name()).orElseThrow(
                () -> new IllegalStateException("Lexer classified unknown directive as block: " + open.name()));
        List<String> arguments = arguments(open, entry.minArgs(), entry.maxArgs());
        List<Branch> branches = new ArrayList<>();

        String keyword = open.name();
        List<String> branchArguments = arguments;
        SourceSpan branchSpan = open.span();
        boolean terminalSeen = false;
        while (true) {
            List<Node> children = sequence(entry);
            branches.add(new Branch(keyword, branchArguments, children, branchSpan));

            Token next = peek();
            if (next.type() == TokenType.END_OF_FILE) {
                diagnostics.reportError(CompilerErrorCode.BLOCK_NOT_CLOSED,
                        "Block {% " + open.name() + " %} opened at " + open.span()
                                + " is never closed; expected {% end" + open.name() + " %}.", open.span());
                return new DirectiveNode(open.name(), arguments, branches, true, List.of(), open.span());
            }
            if (next.type() == TokenType.DIRECTIVE_CLOSE) {
                advance();
                if (!next.name().equals(open.name())) {
                    diagnostics.reportError(CompilerErrorCode.MISMATCHED_CLOSE,
                            "Found {% end" + next.name() + " %} but block {% " + open.name()
                                    + " %} opened at " + open.span() + " is still open.", next.span());
                }
                List<String> closeArguments = split(next);
                return new DirectiveNode(open.name(), arguments, branches, true, closeArguments, open.span());
            }

            advance();
            BranchKeyword branch = entry.branch(next.name()).orElseThrow();
            if (terminalSeen) {
                diagnostics.reportError(CompilerErrorCode.UNEXPECTED_BRANCH,
                        "{% " + next.name() + " %} cannot follow the final branch of {% " + open.name()
                                + " %} opened at " + open.span() + ".", next.span());
            }
            terminalSeen |= branch.terminal();
            keyword = next.name();
            branchArguments = arguments(next, branch.minArgs(), branch.maxArgs());
            branchSpan = next.span();
        }
    }

    private Node inline() {
        Token token = advance();
        if (Lexer.OPTION_OVERRIDE.equals(token.name())) {
            return option(token);
        }
        Optional<DirectiveEntry> entry = registry.lookup(token.name());
        if (entry.isEmpty()) {
            if (registry.isBranchKeyword(token.name())) {
                diagnostics.reportError(CompilerErrorCode.UNEXPECTED_BRANCH,
                        "{% " + token.name() + " %} outside of a block that accepts it.", token.span());
            } else {
                diagnostics.reportError(CompilerErrorCode.UNKNOWN_DIRECTIVE,
                        "Unknown directive '" + token.name() + "'.", token.span());
            }
            return null;
        }
        List<String> arguments = arguments(token, entry.get().minArgs(), entry.get().maxArgs());
        return DirectiveNode.inline(token.name(), arguments, token.span());
    }

    private Node option(Token token) {
        List<String> flags = split(token);
        if (flags.isEmpty()) {
            diagnostics.reportError(CompilerErrorCode.MALFORMED_ARGUMENTS,
                    "Option override without flags.", token.span());
        }
        for (String flag : flags) {
            String name = flag.startsWith("no-") ? flag.substring(3) : flag;
            if (OptionFlag.fromConfigName(name).isEmpty()) {
                diagnostics.reportError(CompilerErrorCode.UNKNOWN_OPTION,
                        "Unknown option flag '" + flag + "'.", token.span());
            }
        }
        return new OptionNode(flags, token.span());
    }

    private Node raw() {
        Token begin = advance();
        StringBuilder content = new StringBuilder();
        if (check(TokenType.RAW_TEXT)) {
            content.append(advance().text());
        }
        Token end = advance();
        return new RawNode(content.toString(), begin.span().union(end.span()));
    }

    private List<String> arguments(Token token, int min, int max) {
        List<String> arguments = split(token);
        if (arguments.size() < min || arguments.size() > max) {
            String expected = max == DirectiveEntry.UNBOUNDED ? "at least " + min
                    : min == max ? String.valueOf(min) : min + " to " + max;
            diagnostics.reportError(CompilerErrorCode.MALFORMED_ARGUMENTS,
                    "'" + token.name() + "' takes " + expected + " argument(s) but got " + arguments.size() + ".",
                    token.span());
        }
        return arguments;
    }

    private List<String> split(Token token) {
        try {
            return ArgumentSplitter.split(token.args());
        } catch (IllegalArgumentException e) {
            diagnostics.reportError(CompilerErrorCode.MALFORMED_ARGUMENTS, e.getMessage(), token.span());
            return List.of();
        }
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }
}
