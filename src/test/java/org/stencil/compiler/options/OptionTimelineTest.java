package org.stencil.compiler.options;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stencil.compiler.api.CompilationOptions;
import org.stencil.compiler.api.OptionFlag;
import org.stencil.compiler.diagnostics.DiagnosticsEngine;
import org.stencil.compiler.frontend.directive.DirectiveRegistry;
import org.stencil.compiler.frontend.directive.DirectiveSettings;
import org.stencil.compiler.frontend.lexer.Lexer;
import org.stencil.compiler.frontend.parser.Parser;
import org.stencil.compiler.frontend.parser.ast.DocumentNode;

import static org.assertj.core.api.Assertions.assertThat;

public class OptionTimelineTest {

    private static DocumentNode parse(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        DirectiveRegistry registry = DirectiveRegistry.initialize(DirectiveSettings.defaults());
        return new Parser(new Lexer(source, diagnostics, "t.html", registry).scanTokens(), diagnostics, registry).parse();
    }

    @Test
    @Tag("unit")
    void testOverrideAppliesFromItsEndOnwards() {
        // Arrange
        String source = "<p>a</p>{% ! no-html compile-css %}<p>b</p>";
        int overrideEnd = source.indexOf("%}") + 2;

        // Act
        OptionTimeline timeline = OptionTimeline.build(parse(source), CompilationOptions.of(OptionFlag.HTML));

        // Assert
        assertThat(timeline.at(0).has(OptionFlag.HTML)).isTrue();
        assertThat(timeline.at(overrideEnd - 1).has(OptionFlag.HTML)).isTrue();
        assertThat(timeline.at(overrideEnd).has(OptionFlag.HTML)).isFalse();
        assertThat(timeline.at(overrideEnd).has(OptionFlag.COMPILE_CSS)).isTrue();
        assertThat(timeline.hasOverrides()).isTrue();
    }

    @Test
    @Tag("unit")
    void testOverridesInsideBranchesApplyInSourceOrder() {
        String source = "{% if x %}{% ! compile-css %}{% else %}{% ! no-compile-css %}{% endif %}tail";

        OptionTimeline timeline = OptionTimeline.build(parse(source), CompilationOptions.none());

        assertThat(timeline.at(source.indexOf("tail")).has(OptionFlag.COMPILE_CSS)).isFalse();
        assertThat(timeline.anywhere(o -> o.has(OptionFlag.COMPILE_CSS))).isTrue();
    }

    @Test
    @Tag("unit")
    void testConstantTimeline() {
        CompilationOptions options = CompilationOptions.of(OptionFlag.HTML);

        OptionTimeline timeline = OptionTimeline.constant(options);

        assertThat(timeline.initial()).isEqualTo(options);
        assertThat(timeline.at(1000)).isEqualTo(options);
        assertThat(timeline.hasOverrides()).isFalse();
    }
}
