package org.stencil.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stencil.compiler.api.CompilationOptions;
import org.stencil.compiler.api.OptionFlag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class OptionsResolverTest {

    private static Config config(String hocon) {
        return ConfigFactory.parseString(hocon).withFallback(ConfigFactory.defaultReference()).resolve();
    }

    @Test
    @Tag("unit")
    void testDefaultsComeFromReferenceConfig() {
        OptionsResolver resolver = new OptionsResolver(config(""));

        assertThat(resolver.defaults().flags()).containsExactlyInAnyOrder(
                OptionFlag.HTML, OptionFlag.WHITESPACE_COMPRESSION, OptionFlag.CONSTANT_FOLDING,
                OptionFlag.MERGE_INTERNAL_JAVASCRIPT, OptionFlag.MERGE_INTERNAL_CSS, OptionFlag.VALIDATE_HTML);
        assertThat(resolver.defaults().debug()).isFalse();
    }

    @Test
    @Tag("unit")
    void testOverridesMatchApplicationAndTemplate() {
        // Arrange
        OptionsResolver resolver = new OptionsResolver(config("""
                stencil.options.overrides = [
                  { applications = ["admin"], options = ["no-validate-html", "compile-javascript"] }
                  { templates = ["**/legacy/*.html"], options = ["parse-all-html-tags"] }
                ]
                """));

        // Act
        CompilationOptions admin = resolver.resolve("admin/index.html", "admin");
        CompilationOptions legacy = resolver.resolve("shop/legacy/cart.html", "shop");
        CompilationOptions plain = resolver.resolve("shop/index.html", "shop");

        // Assert
        assertThat(admin.has(OptionFlag.VALIDATE_HTML)).isFalse();
        assertThat(admin.has(OptionFlag.COMPILE_JAVASCRIPT)).isTrue();
        assertThat(legacy.has(OptionFlag.PARSE_ALL_HTML_TAGS)).isTrue();
        assertThat(legacy.has(OptionFlag.VALIDATE_HTML)).isTrue();
        assertThat(plain).isEqualTo(resolver.defaults());
    }

    @Test
    @Tag("unit")
    void testLaterOverrideWins() {
        OptionsResolver resolver = new OptionsResolver(config("""
                stencil.options.overrides = [
                  { options = ["compile-css"] }
                  { applications = ["blog"], options = ["no-compile-css"] }
                ]
                """));

        assertThat(resolver.resolve("blog/post.html", "blog").has(OptionFlag.COMPILE_CSS)).isFalse();
        assertThat(resolver.resolve("shop/index.html", "shop").has(OptionFlag.COMPILE_CSS)).isTrue();
    }

    @Test
    @Tag("unit")
    void testDebugSwitch() {
        OptionsResolver resolver = new OptionsResolver(config("stencil.options.debug = true"));

        assertThat(resolver.resolve("index.html", "").debug()).isTrue();
    }

    @Test
    @Tag("unit")
    void testUnknownFlagFailsAtConstruction() {
        Config config = config("stencil.options.overrides = [ { options = [\"minify-everything\"] } ]");

        assertThatThrownBy(() -> new OptionsResolver(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minify-everything");
    }
}
