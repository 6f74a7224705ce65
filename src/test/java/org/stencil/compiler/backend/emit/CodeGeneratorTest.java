package org.stencil.compiler.backend.emit;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stencil.compiler.api.CompilationOptions;
import org.stencil.compiler.api.CompiledArtifact;
import org.stencil.compiler.api.CompilerErrorCode;
import org.stencil.compiler.api.DebugMapEntry;
import org.stencil.compiler.api.OptionFlag;
import org.stencil.compiler.api.SourceSpan;
import org.stencil.compiler.diagnostics.Diagnostic;
import org.stencil.compiler.frontend.parser.ast.DocumentNode;
import org.stencil.testutils.TemplatePipeline;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class CodeGeneratorTest {

    private static final CompilationOptions HTML = CompilationOptions.of(OptionFlag.HTML);

    private static CompiledArtifact generate(String source, CompilationOptions options) {
        TemplatePipeline pipeline = new TemplatePipeline(options);
        DocumentNode document = pipeline.normalize(source);
        return new CodeGenerator().generate(document, "page.html", pipeline.timeline(), options, List.of());
    }

    private static String withoutMarkers(String output) {
        return output.replaceAll("<!--/?dbg:\\d+-->", "");
    }

    @Test
    @Tag("unit")
    void testTemplateTagsAreWrittenInNormalForm() {
        CompiledArtifact artifact = generate("{%if  x%}{{name}}{%   endif %}", HTML);

        assertThat(artifact.output()).isEqualTo("{% if x %}{{ name }}{% endif %}");
        assertThat(artifact.debugMap()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testImplicitlyClosedElementsGetEndTags() {
        assertThat(generate("<ul><li>a<li>b</ul>", HTML).output()).isEqualTo("<ul><li>a</li><li>b</li></ul>");
    }

    @Test
    @Tag("unit")
    void testRawBlocksAndCommentsProduceNoMarkers() {
        String output = generate("{# note #}{% !raw %}{{ kept }}{% !endraw %}", HTML).output();

        assertThat(output).isEqualTo("{{ kept }}");
    }

    @Test
    @Tag("unit")
    void testDebugMarkersMapBackToSource() {
        // Arrange
        String source = "<!DOCTYPE html>\n<p>Hi</p>";

        // Act
        CompiledArtifact artifact = generate(source, HTML.withDebug(true));

        // Assert
        assertThat(artifact.output())
                .isEqualTo("<!DOCTYPE html>\n<!--dbg:1--><p><!--dbg:2-->Hi<!--/dbg:2--></p><!--/dbg:1-->");
        DebugMapEntry paragraph = artifact.debugMap().stream().filter(e -> e.id() == 1).findFirst().orElseThrow();
        assertThat(artifact.output().substring(paragraph.outputStart(), paragraph.outputEnd()))
                .isEqualTo("<p><!--dbg:2-->Hi<!--/dbg:2--></p>");
        SourceSpan span = paragraph.source();
        assertThat(span.start()).isEqualTo(16);
        assertThat(span.line()).isEqualTo(2);
        assertThat(span.column()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void testNoMarkersInsideScriptsOrAttributes() {
        CompiledArtifact artifact = generate("<script>var a;</script><a href=\"{{ u }}\">x</a>", HTML.withDebug(true));

        assertThat(artifact.output()).isEqualTo("<!--dbg:1--><script>var a;</script><!--/dbg:1-->"
                + "<!--dbg:2--><a href=\"{{ u }}\"><!--dbg:3-->x<!--/dbg:3--></a><!--/dbg:2-->");
        assertThat(artifact.debugMap()).hasSize(3);
    }

    @Test
    @Tag("unit")
    void testNoMarkersWithoutHtmlParsing() {
        // Arrange
        String source = "<a href=\"{{ url }}\">x</a>";

        // Act
        CompiledArtifact artifact = generate(source, CompilationOptions.none().withDebug(true));

        // Assert
        assertThat(artifact.output()).isEqualTo(source);
        assertThat(artifact.debugMap()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testNoMarkersAfterInlineOverrideDisablesHtml() {
        CompiledArtifact artifact = generate("<p>a</p>{% ! no-html %}<a href=\"{{ url }}\">x</a>", HTML.withDebug(true));

        assertThat(artifact.output()).isEqualTo("<!--dbg:1--><p><!--dbg:2-->a<!--/dbg:2--></p><!--/dbg:1-->"
                + "<a href=\"{{ url }}\">x</a>");
    }

    @Test
    @Tag("unit")
    void testNoMarkersInsideDynamicTagNames() {
        // Arrange
        String source = "<h{{ level }} class=\"x\">t</h{{ level }}>";

        // Act
        String output = generate(source, HTML.withDebug(true)).output();

        // Assert
        assertThat(withoutMarkers(output)).isEqualTo(source);
        assertThat(output).doesNotContainPattern("<h[^>]*<!--").doesNotContainPattern("</h[^>]*<!--");
        assertThat(output).startsWith("<h{{ level }} class=\"x\">").endsWith("</h{{ level }}>");
    }

    @Test
    @Tag("unit")
    void testLessThanInScriptDoesNotSuppressLaterMarkers() {
        CompiledArtifact artifact = generate("<script>if (a<b) x();</script><p>y</p>", HTML.withDebug(true));

        assertThat(artifact.output()).isEqualTo("<!--dbg:1--><script>if (a<b) x();</script><!--/dbg:1-->"
                + "<!--dbg:2--><p><!--dbg:3-->y<!--/dbg:3--></p><!--/dbg:2-->");
    }

    @Test
    @Tag("unit")
    void testArtifactCarriesOptionsAndWarnings() {
        DocumentNode document = new TemplatePipeline(HTML).normalize("<p>x</p>");
        Diagnostic warning = new Diagnostic(Diagnostic.Type.WARNING, CompilerErrorCode.DUPLICATE_ATTRIBUTE, "w",
                new SourceSpan("page.html", 0, 3, 1, 1));

        CompiledArtifact artifact = new CodeGenerator().generate(document, "page.html", HTML, List.of(warning));

        assertThat(artifact.sourceId()).isEqualTo("page.html");
        assertThat(artifact.options()).isEqualTo(HTML);
        assertThat(artifact.warnings()).containsExactly(warning);
    }
}
