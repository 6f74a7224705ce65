package org.stencil.compiler.backend.optimize.script;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stencil.compiler.api.SourceSpan;
import org.stencil.compiler.backend.emit.CodeGenerator;
import org.stencil.compiler.frontend.parser.ast.ExpressionNode;
import org.stencil.compiler.frontend.parser.ast.Node;
import org.stencil.compiler.frontend.parser.ast.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class JsMinifierTest {

    /**
     * Builds script content from alternating text and {@code {{ }}} parts: every odd-indexed
     * part is an expression.
     */
    private static List<Node> content(String... parts) {
        List<Node> nodes = new ArrayList<>();
        int offset = 0;
        for (int i = 0; i < parts.length; i++) {
            SourceSpan span = new SourceSpan("test.js", offset, offset + parts[i].length(), 1, offset + 1);
            nodes.add(i % 2 == 0 ? new TextNode(parts[i], span) : new ExpressionNode(parts[i], span));
            offset += parts[i].length();
        }
        return nodes;
    }

    private static String minify(boolean rename, String... parts) throws JsSyntaxException {
        return JsMinifier.minify(content(parts), rename).stream()
                .map(CodeGenerator::render)
                .collect(Collectors.joining());
    }

    @Test
    @Tag("unit")
    void testWhitespaceBetweenTokensIsDropped() throws Exception {
        assertThat(minify(false, "var x = 1;\nvar y = x + 2;")).isEqualTo("var x=1;var y=x+2;");
    }

    @Test
    @Tag("unit")
    void testLineBreakIsKeptWhereSemicolonInsertionDependsOnIt() throws Exception {
        assertThat(minify(false, "a = 1\nb = 2")).isEqualTo("a=1\nb=2");
    }

    @Test
    @Tag("unit")
    void testOperatorsThatWouldFuseKeepASpace() throws Exception {
        assertThat(minify(false, "a = b + +c;\nd = e - -f;")).isEqualTo("a=b+ +c;d=e- -f;");
    }

    @Test
    @Tag("unit")
    void testCommentsAreRemoved() throws Exception {
        assertThat(minify(false, "// setup\nvar a = 1; /* the answer */ var b = 42;"))
                .isEqualTo("var a=1;var b=42;");
    }

    @Test
    @Tag("unit")
    void testStringsAndRegexesAreCopied() throws Exception {
        assertThat(minify(false, "var s = 'a  b';\nvar r = /x  y/g;")).isEqualTo("var s='a  b';var r=/x  y/g;");
    }

    @Test
    @Tag("unit")
    void testTemplateNodesAreOpaque() throws Exception {
        // Act
        String output = minify(false, "var user = ", "user.id", ";\nvar n = ", "count", " + 1;");

        // Assert
        assertThat(output).isEqualTo("var user={{ user.id }};var n={{ count }}+1;");
    }

    @Test
    @Tag("unit")
    void testBraceBeforeTemplateNodeIsSeparated() throws Exception {
        assertThat(minify(false, "if (a) { ", "body", " }")).isEqualTo("if(a){ {{ body }}}");
    }

    @Test
    @Tag("unit")
    void testLocalsAreRenamed() throws Exception {
        String source = "function f(alpha, beta) { var gamma = alpha + beta; return gamma; }";

        assertThat(minify(true, source)).isEqualTo("function f(a,b){var c=a+b;return c;}");
    }

    @Test
    @Tag("unit")
    void testGlobalsKeepTheirNames() throws Exception {
        String source = "var total = 0;\nfunction add(value) { total = total + value; }";

        assertThat(minify(true, source)).isEqualTo("var total=0;function add(a){total=total+a;}");
    }

    @Test
    @Tag("unit")
    void testUnsupportedConstructsSkipRenaming() throws Exception {
        String source = "function f(alpha) { let beta = alpha; return beta; }";

        assertThat(minify(true, source)).isEqualTo("function f(alpha){let beta=alpha;return beta;}");
    }

    @Test
    @Tag("unit")
    void testUnterminatedStringIsRejected() {
        assertThatThrownBy(() -> minify(false, "var s = \"open;"))
                .isInstanceOf(JsSyntaxException.class)
                .hasMessageContaining("Unterminated string");
    }

    @Test
    @Tag("unit")
    void testUnterminatedCommentIsRejected() {
        assertThatThrownBy(() -> minify(false, "var a; /* open"))
                .isInstanceOf(JsSyntaxException.class);
    }

    @Test
    @Tag("unit")
    void testCompiledScriptRejectsTrailingCommaInObject() {
        assertThatThrownBy(() -> minify(true, "var x = {a: 1,};"))
                .isInstanceOf(JsSyntaxException.class)
                .hasMessageContaining("Trailing comma");
    }

    @Test
    @Tag("unit")
    void testCompiledScriptRejectsMissingSemicolon() {
        assertThatThrownBy(() -> minify(true, "var a = 1\nvar b = 2"))
                .isInstanceOf(JsSyntaxException.class)
                .hasMessage("Missing semicolon before 'var'");
    }

    @Test
    @Tag("unit")
    void testAssignedFunctionNeedsSemicolon() {
        assertThatThrownBy(() -> minify(true, "var f = function() { return 1; }\nf();"))
                .isInstanceOf(JsSyntaxException.class)
                .hasMessage("Missing semicolon before 'f'");
    }

    @Test
    @Tag("unit")
    void testValidationOnlyAppliesWhenCompiling() throws Exception {
        assertThat(minify(false, "var a = 1\nvar b = 2")).isEqualTo("var a=1\nvar b=2");
    }

    @Test
    @Tag("unit")
    void testBlockStatementsNeedNoSemicolon() {
        String source = "if (a) { b(); } else { c(); }\n"
                + "for (var i = 0; i < n; i++) { d(i); }\n"
                + "var o = {x: [1, 2], y: function() { return 1; }};";

        assertThatCode(() -> minify(true, source)).doesNotThrowAnyException();
    }

    @Test
    @Tag("unit")
    void testGettextTakesStringLiteralsOnly() throws Exception {
        assertThat(minify(true, "var m = gettext('Hello ' + 'world');")).isEqualTo("var m=gettext('Hello '+'world');");
        assertThat(minify(true, "var m = gettext(", "msg", ");")).isEqualTo("var m=gettext({{ msg }});");
        assertThatThrownBy(() -> minify(true, "var m = gettext('Hello ' + name);"))
                .isInstanceOf(JsSyntaxException.class)
                .hasMessageContaining("inside gettext(...)");
    }
}
