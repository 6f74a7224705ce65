package org.stencil.compiler.backend.optimize.features;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.stencil.compiler.api.CompilationOptions;
import org.stencil.compiler.api.CompilerErrorCode;
import org.stencil.compiler.api.OptionFlag;
import org.stencil.compiler.diagnostics.Diagnostic;
import org.stencil.junit.extensions.logging.ExpectLog;
import org.stencil.junit.extensions.logging.LogLevel;
import org.stencil.junit.extensions.logging.LogWatchExtension;
import org.stencil.testutils.TemplatePipeline;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(LogWatchExtension.class)
public class HtmlValidationPassTest {

    private final HtmlValidationPass pass = new HtmlValidationPass();
    private TemplatePipeline pipeline;

    private List<CompilerErrorCode> validate(String source, OptionFlag... extra) {
        OptionFlag[] flags = new OptionFlag[extra.length + 2];
        flags[0] = OptionFlag.HTML;
        flags[1] = OptionFlag.VALIDATE_HTML;
        System.arraycopy(extra, 0, flags, 2, extra.length);
        pipeline = new TemplatePipeline(CompilationOptions.of(flags));
        pipeline.apply(pass, source);
        return pipeline.diagnostics().getDiagnostics().stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR)
                .map(Diagnostic::code)
                .toList();
    }

    @Test
    @Tag("unit")
    void testValidMarkupPasses() {
        assertThat(validate("<div id=\"main\" class=\"a b\"><input type=checkbox checked></div>")).isEmpty();
    }

    @Test
    @Tag("unit")
    void testDuplicateAttributeIsReported() {
        assertThat(validate("<div id=\"a\" ID=\"b\"></div>")).containsExactly(CompilerErrorCode.DUPLICATE_ATTRIBUTE);
    }

    @Test
    @Tag("unit")
    void testSameAttributeInAlternativeBranchesIsAllowed() {
        assertThat(validate("<a {% if x %}class=\"a\"{% else %}class=\"b\"{% endif %}>x</a>")).isEmpty();
    }

    @Test
    @Tag("unit")
    void testAttributeInBranchAndOutsideIsReported() {
        assertThat(validate("<a class=\"c\" {% if x %}class=\"a\"{% endif %}>x</a>"))
                .containsExactly(CompilerErrorCode.DUPLICATE_ATTRIBUTE);
    }

    @Test
    @Tag("unit")
    void testIdWithWhitespaceIsReported() {
        assertThat(validate("<p id=\"a b\">x</p>")).containsExactly(CompilerErrorCode.INVALID_ATTRIBUTE);
    }

    @Test
    @Tag("unit")
    void testUnquotedValueWithForbiddenCharacterIsReported() {
        assertThat(validate("<p title=a=b>x</p>")).containsExactly(CompilerErrorCode.INVALID_ATTRIBUTE);
    }

    @Test
    @Tag("unit")
    void testMissingAltIsReportedOnlyWhenEnabled() {
        assertThat(validate("<img src=\"a.png\">")).isEmpty();
        assertThat(validate("<img src=\"a.png\">", OptionFlag.HTML_CHECK_ALT_AND_TITLE_ATTRIBUTES))
                .containsExactly(CompilerErrorCode.MISSING_REQUIRED_ATTRIBUTE);
        assertThat(validate("<abbr>HTML</abbr>", OptionFlag.HTML_CHECK_ALT_AND_TITLE_ATTRIBUTES))
                .containsExactly(CompilerErrorCode.MISSING_REQUIRED_ATTRIBUTE);
    }

    @Test
    @Tag("unit")
    void testAltInsideBranchCountsAsPresent() {
        String source = "<img src=\"a.png\" {% if x %}alt=\"{{ x }}\"{% else %}alt=\"\"{% endif %}>";

        assertThat(validate(source, OptionFlag.HTML_CHECK_ALT_AND_TITLE_ATTRIBUTES)).isEmpty();
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*CompilerLogger", messagePattern = ".*Duplicate attribute 'id'.*")
    void testViolationsBecomeWarnings() {
        // Act
        List<CompilerErrorCode> errors = validate("<div id=\"a\" id=\"b\"></div>", OptionFlag.HTML_VALIDATION_WARNINGS);

        // Assert
        assertThat(errors).isEmpty();
        assertThat(pipeline.diagnostics().getWarnings())
                .extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.DUPLICATE_ATTRIBUTE);
    }

    @Test
    @Tag("unit")
    void testEmptyClassAttributeIsRemoved() {
        TemplatePipeline removing = new TemplatePipeline(
                CompilationOptions.of(OptionFlag.HTML, OptionFlag.HTML_REMOVE_EMPTY_CLASS_ATTRIBUTES));

        String output = removing.apply(pass, "<p class=\"\" id=\"x\">a</p><p class=\"{{ c }}\">b</p>");

        assertThat(output).isEqualTo("<p id=\"x\">a</p><p class=\"{{ c }}\">b</p>");
    }
}
