package org.stencil.compiler.frontend.structure;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stencil.compiler.api.CompilationOptions;
import org.stencil.compiler.api.CompilerErrorCode;
import org.stencil.compiler.api.OptionFlag;
import org.stencil.compiler.diagnostics.Diagnostic;
import org.stencil.compiler.diagnostics.PhaseAbortedException;
import org.stencil.compiler.frontend.parser.ast.AttributeNode;
import org.stencil.compiler.frontend.parser.ast.CommentNode;
import org.stencil.compiler.frontend.parser.ast.DirectiveNode;
import org.stencil.compiler.frontend.parser.ast.DocumentNode;
import org.stencil.compiler.frontend.parser.ast.ElementNode;
import org.stencil.compiler.frontend.parser.ast.EndTagNode;
import org.stencil.compiler.frontend.parser.ast.ExpressionNode;
import org.stencil.compiler.frontend.parser.ast.Node;
import org.stencil.compiler.frontend.parser.ast.StartTagNode;
import org.stencil.compiler.frontend.parser.ast.TextNode;
import org.stencil.testutils.TemplatePipeline;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests how the structural normalizer reconciles markup across directive branches.
 */
public class StructuralNormalizerTest {

    private static final CompilationOptions HTML = CompilationOptions.of(OptionFlag.HTML);

    private TemplatePipeline pipeline;

    private DocumentNode normalize(String source, CompilationOptions options) {
        pipeline = new TemplatePipeline(options);
        return pipeline.normalize(source);
    }

    private void assertStructuralError(String source, CompilationOptions options, CompilerErrorCode code) {
        assertThatThrownBy(() -> normalize(source, options)).isInstanceOf(PhaseAbortedException.class);
        assertThat(pipeline.diagnostics().getDiagnostics()).extracting(Diagnostic::code).containsExactly(code);
    }

    @Test
    @Tag("unit")
    void testAttributeVariantsInBranchesStayOneElement() {
        DocumentNode document = normalize(
                "<a {% if x %} class=\"a\" {% else %} class=\"b\" {% endif %} href=\"#\">link</a>", HTML);

        assertThat(document.children()).hasSize(1);
        ElementNode a = (ElementNode) document.children().get(0);
        assertThat(a.name()).isEqualTo("a");
        assertThat(a.endTag()).isEqualTo("</a>");
        DirectiveNode variants = a.attributes().stream()
                .filter(DirectiveNode.class::isInstance).map(DirectiveNode.class::cast)
                .findFirst().orElseThrow();
        assertThat(variants.branches()).hasSize(2);
        assertThat(classValue(variants.branches().get(0).children())).isEqualTo("a");
        assertThat(classValue(variants.branches().get(1).children())).isEqualTo("b");
        assertThat(a.attributes()).anyMatch(n -> n instanceof AttributeNode attr && attr.name().equals("href"));
    }

    private static String classValue(List<Node> items) {
        return items.stream()
                .filter(AttributeNode.class::isInstance).map(AttributeNode.class::cast)
                .filter(attr -> attr.name().equals("class"))
                .findFirst().orElseThrow().literalValue();
    }

    @Test
    @Tag("unit")
    void testStartTagSplitAcrossBranchesSharesOnePair() {
        DocumentNode document = normalize(
                "{% if x %}<div class=\"a\">{% else %}<div class=\"b\">{% endif %}text</div>", HTML);

        assertThat(document.children()).hasSize(3);
        DirectiveNode directive = (DirectiveNode) document.children().get(0);
        StartTagNode first = (StartTagNode) directive.branches().get(0).children().get(0);
        StartTagNode second = (StartTagNode) directive.branches().get(1).children().get(0);
        assertThat(((TextNode) document.children().get(1)).text()).isEqualTo("text");
        EndTagNode end = (EndTagNode) document.children().get(2);

        assertThat(first.pair().id()).isEqualTo(second.pair().id()).isEqualTo(end.pair().id());
        assertThat(end.text()).isEqualTo("</div>");
    }

    @Test
    @Tag("unit")
    void testOptionalEndTagsAreClosedImplicitly() {
        DocumentNode document = normalize("<ul><li>a<li>b</ul>", HTML);

        ElementNode ul = (ElementNode) document.children().get(0);
        assertThat(ul.children()).hasSize(2).allMatch(ElementNode.class::isInstance);
        assertThat(((ElementNode) ul.children().get(0)).endTag()).isNull();
    }

    @Test
    @Tag("unit")
    void testLoopBodyMayLeaveOptionalEndTagOpen() {
        DocumentNode document = normalize("<ul>{% for i in items %}<li>{{ i }}{% endfor %}</ul>", HTML);

        ElementNode ul = (ElementNode) document.children().get(0);
        DirectiveNode loop = (DirectiveNode) ul.children().get(0);
        ElementNode li = (ElementNode) loop.branches().get(0).children().get(0);
        assertThat(li.name()).isEqualTo("li");
        assertThat(li.children()).singleElement().isInstanceOf(ExpressionNode.class);
    }

    @Test
    @Tag("unit")
    void testDivergentBranchesAreRejected() {
        assertStructuralError("{% if x %}<div>{% endif %}", HTML, CompilerErrorCode.DIVERGENT_BRANCHES);
    }

    @Test
    @Tag("unit")
    void testUnbalancedLoopBodyIsRejected() {
        assertStructuralError("{% for i in items %}<div>{% endfor %}</div>", HTML, CompilerErrorCode.UNBALANCED_BODY);
    }

    @Test
    @Tag("unit")
    void testUnmatchedEndTagIsRejected() {
        assertStructuralError("<p>text</div>", HTML, CompilerErrorCode.UNMATCHED_END_TAG);
    }

    @Test
    @Tag("unit")
    void testUnclosedElementIsRejected() {
        assertStructuralError("<div><span></div>", HTML, CompilerErrorCode.UNCLOSED_ELEMENT);
    }

    @Test
    @Tag("unit")
    void testParseAllTagsRequiresExplicitEndTags() {
        CompilationOptions strict = CompilationOptions.of(OptionFlag.HTML, OptionFlag.PARSE_ALL_HTML_TAGS);

        assertStructuralError("<ul><li>a</ul>", strict, CompilerErrorCode.UNCLOSED_ELEMENT);
    }

    @Test
    @Tag("unit")
    void testMarkupIsTextWithoutHtmlFlag() {
        DocumentNode document = normalize("<div><span></div>", CompilationOptions.none());

        assertThat(document.children()).singleElement().isInstanceOf(TextNode.class);
    }

    @Test
    @Tag("unit")
    void testDynamicTagNameStaysText() {
        DocumentNode document = normalize("<h{{ level }}>Title</h{{ level }}>", HTML);

        assertThat(document.children()).noneMatch(ElementNode.class::isInstance);
        assertThat(document.children()).filteredOn(ExpressionNode.class::isInstance).hasSize(2);
    }

    @Test
    @Tag("unit")
    void testHtmlCommentKeepsTemplateNodes() {
        DocumentNode document = normalize("<!-- a {{ x }} -->", HTML);

        CommentNode comment = (CommentNode) document.children().get(0);
        assertThat(comment.kind()).isEqualTo(CommentNode.Kind.HTML);
        assertThat(comment.parts()).hasSize(3);
        assertThat(comment.parts().get(1)).isInstanceOf(ExpressionNode.class);
    }

    @Test
    @Tag("unit")
    void testScriptContentIsNotParsedAsMarkup() {
        DocumentNode document = normalize("<script>if (a < b) { x = \"</div>\"; }</script>", HTML);

        ElementNode script = (ElementNode) document.children().get(0);
        assertThat(script.children()).singleElement().isInstanceOf(TextNode.class);
        assertThat(((TextNode) script.children().get(0)).text()).contains("</div>");
    }
}
