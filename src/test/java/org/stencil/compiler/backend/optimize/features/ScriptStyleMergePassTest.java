package org.stencil.compiler.backend.optimize.features;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.stencil.compiler.api.CompilationOptions;
import org.stencil.compiler.api.CompilerErrorCode;
import org.stencil.compiler.api.OptionFlag;
import org.stencil.compiler.backend.optimize.AssetKind;
import org.stencil.compiler.backend.optimize.AssetPublisher;
import org.stencil.compiler.diagnostics.Diagnostic;
import org.stencil.junit.extensions.logging.ExpectLog;
import org.stencil.junit.extensions.logging.LogLevel;
import org.stencil.junit.extensions.logging.LogWatchExtension;
import org.stencil.testutils.TemplatePipeline;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(LogWatchExtension.class)
public class ScriptStyleMergePassTest {

    private final ScriptStyleMergePass pass = new ScriptStyleMergePass();

    private static TemplatePipeline pipeline(OptionFlag... flags) {
        OptionFlag[] withHtml = new OptionFlag[flags.length + 1];
        withHtml[0] = OptionFlag.HTML;
        System.arraycopy(flags, 0, withHtml, 1, flags.length);
        return new TemplatePipeline(CompilationOptions.of(withHtml));
    }

    @Test
    @Tag("unit")
    void testScriptsAreMergedIntoTheLastOne() {
        // Arrange
        String source = "<html><head><script>var a = 1;</script></head>"
                + "<body><p>x</p><script>var b = a + 1;</script></body></html>";

        // Act
        String output = pipeline(OptionFlag.MERGE_INTERNAL_JAVASCRIPT).apply(pass, source);

        // Assert
        assertThat(output).isEqualTo(
                "<html><head></head><body><p>x</p><script>var a=1;var b=a+1;</script></body></html>");
    }

    @Test
    @Tag("unit")
    void testStatementWithoutSemicolonIsSeparated() {
        String output = pipeline(OptionFlag.MERGE_INTERNAL_JAVASCRIPT)
                .apply(pass, "<script>var a = f()</script><script>(function () {})()</script>");

        assertThat(output).isEqualTo("<script>var a=f();(function(){})()</script>");
    }

    @Test
    @Tag("unit")
    void testConditionalScriptsAreNotMerged() {
        String output = pipeline(OptionFlag.MERGE_INTERNAL_JAVASCRIPT)
                .apply(pass, "<script>var a = 1;</script>{% if x %}<script>var b = 2;</script>{% endif %}");

        assertThat(output).isEqualTo("<script>var a=1;</script>{% if x %}<script>var b = 2;</script>{% endif %}");
    }

    @Test
    @Tag("unit")
    void testNoMergeAttributeOptsOut() {
        String output = pipeline(OptionFlag.MERGE_INTERNAL_JAVASCRIPT).apply(pass,
                "<script>var a = 1;</script><script data-no-merge>var b = 2;</script><script>var c = 3;</script>");

        assertThat(output).isEqualTo("<script data-no-merge>var b = 2;</script><script>var a=1;var c=3;</script>");
    }

    @Test
    @Tag("unit")
    void testStylesAreMergedIntoTheFirstOne() {
        String output = pipeline(OptionFlag.MERGE_INTERNAL_CSS).apply(pass,
                "<style>a { color: red; }</style><p>x</p><style>b { margin: 0; }</style>");

        assertThat(output).isEqualTo("<style>a{color:red}b{margin:0}</style><p>x</p>");
    }

    @Test
    @Tag("unit")
    void testSingleScriptIsCompiledWithRenaming() {
        String output = pipeline(OptionFlag.COMPILE_JAVASCRIPT).apply(pass,
                "<script>function f(alpha, beta) { var gamma = alpha + beta; return gamma; }</script>");

        assertThat(output).isEqualTo("<script>function f(a,b){var c=a+b;return c;}</script>");
    }

    @Test
    @Tag("unit")
    void testMalformedScriptIsReported() {
        // Arrange
        TemplatePipeline pipeline = pipeline(OptionFlag.COMPILE_JAVASCRIPT);
        String source = "<script>var s = \"open;</script>";

        // Act
        String output = pipeline.apply(pass, source);

        // Assert
        assertThat(output).isEqualTo(source);
        assertThat(pipeline.diagnostics().getDiagnostics())
                .extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.INVALID_SCRIPT);
    }

    @Test
    @Tag("unit")
    void testCompiledScriptWithTrailingCommaIsReported() {
        // Arrange
        TemplatePipeline pipeline = pipeline(OptionFlag.COMPILE_JAVASCRIPT);
        String source = "<script>var x = {a: 1,};</script>";

        // Act
        String output = pipeline.apply(pass, source);

        // Assert
        assertThat(output).isEqualTo(source);
        assertThat(pipeline.diagnostics().getDiagnostics())
                .extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.INVALID_SCRIPT);
    }

    @Test
    @Tag("unit")
    void testExternalScriptsArePacked() {
        // Arrange
        AssetPublisher publisher = mock(AssetPublisher.class);
        when(publisher.publish(anyList(), any())).thenReturn("/static/bundles/0a1b.js");
        TemplatePipeline pipeline = pipeline(OptionFlag.PACK_EXTERNAL_JAVASCRIPT).withPublisher(publisher);

        // Act
        String output = pipeline.apply(pass,
                "<script src=\"/static/a.js\"></script>\n<script src=\"/static/b.js\"></script><p>x</p>");

        // Assert
        assertThat(output).isEqualTo("<script src=\"/static/bundles/0a1b.js\"></script><p>x</p>");
        verify(publisher).publish(List.of("/static/a.js", "/static/b.js"), AssetKind.JAVASCRIPT);
    }

    @Test
    @Tag("unit")
    void testRemoteStylesheetsAreNotPacked() {
        AssetPublisher publisher = mock(AssetPublisher.class);
        String source = "<link rel=\"stylesheet\" href=\"https://cdn.example.org/a.css\">"
                + "<link rel=\"stylesheet\" href=\"/static/b.css\">";

        String output = pipeline(OptionFlag.PACK_EXTERNAL_CSS).withPublisher(publisher).apply(pass, source);

        assertThat(output).isEqualTo(source);
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*CompilerLogger", messagePattern = ".*no asset publisher.*")
    void testPackingWithoutPublisherLeavesFilesAlone() {
        String source = "<link rel=\"stylesheet\" href=\"/static/a.css\"><link rel=\"stylesheet\" href=\"/static/b.css\">";

        String output = pipeline(OptionFlag.PACK_EXTERNAL_CSS).apply(pass, source);

        assertThat(output).isEqualTo(source);
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*CompilerLogger", messagePattern = "Cannot publish bundle.*")
    void testFailedPublishLeavesFilesAlone() {
        // Arrange
        AssetPublisher publisher = mock(AssetPublisher.class);
        when(publisher.publish(anyList(), any())).thenThrow(new UncheckedIOException(new IOException("disk full")));
        String source = "<script src=\"/static/a.js\"></script><script src=\"/static/b.js\"></script>";

        // Act
        String output = pipeline(OptionFlag.PACK_EXTERNAL_JAVASCRIPT).withPublisher(publisher).apply(pass, source);

        // Assert
        assertThat(output).isEqualTo(source);
    }
}
