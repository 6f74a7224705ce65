package org.stencil.config;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stencil.assets.StaticBundlePublisher;
import org.stencil.compiler.frontend.directive.DirectiveSettings;

import static org.assertj.core.api.Assertions.assertThat;

public class StencilSettingsTest {

    private static StencilSettings settings(String hocon) {
        return new StencilSettings(ConfigFactory.parseString(hocon).withFallback(ConfigFactory.defaultReference()).resolve());
    }

    @Test
    @Tag("unit")
    void testDirectiveSettings() {
        DirectiveSettings directives = settings("""
                stencil.directives {
                  static-url = "https://cdn.example.org/"
                  runtime-inline = ["current_user"]
                  runtime-blocks = ["cache"]
                }
                """).directiveSettings();

        assertThat(directives.staticUrl()).isEqualTo("https://cdn.example.org/");
        assertThat(directives.runtimeDirectives()).containsExactly("current_user");
        assertThat(directives.runtimeBlocks()).containsExactly("cache");
    }

    @Test
    @Tag("unit")
    void testPublisherNeedsStaticRoot() {
        assertThat(settings("stencil.assets.static-root = \"\"").assetPublisher()).isEmpty();
        assertThat(settings("stencil.assets.static-root = \"build/static\"").assetPublisher())
                .get().isInstanceOf(StaticBundlePublisher.class);
    }

    @Test
    @Tag("unit")
    void testTemplateAndCompilerSettings() {
        StencilSettings settings = settings("stencil.compiler.verbosity = 3");

        assertThat(settings.templateExtensions()).contains(".html", ".txt");
        assertThat(settings.verbosity()).isEqualTo(3);
    }
}
