package org.stencil.config;

import com.typesafe.config.Config;
import org.stencil.assets.StaticBundlePublisher;
import org.stencil.compiler.backend.optimize.AssetPublisher;
import org.stencil.compiler.frontend.directive.DirectiveSettings;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Typed view of the {@code stencil.directives}, {@code stencil.assets}, {@code stencil.templates}
 * and {@code stencil.compiler} sections.
 */
public final class StencilSettings {

    private final Config config;

    /**
     * @param config The application configuration.
     */
    public StencilSettings(Config config) {
        this.config = config;
    }

    /**
     * @return The inputs of the built-in directive set.
     */
    public DirectiveSettings directiveSettings() {
        Config directives = config.getConfig("stencil.directives");
        return new DirectiveSettings(
                directives.getString("static-url"),
                directives.getStringList("runtime-inline"),
                directives.getStringList("runtime-blocks"));
    }

    /**
     * @return The publisher for packed bundles, empty if no static root is configured.
     */
    public Optional<AssetPublisher> assetPublisher() {
        String staticRoot = config.getString("stencil.assets.static-root");
        if (staticRoot.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new StaticBundlePublisher(
                Path.of(staticRoot),
                config.getString("stencil.directives.static-url"),
                config.getString("stencil.assets.bundle-dir")));
    }

    /**
     * @return The file extensions the batch compiler treats as templates.
     */
    public List<String> templateExtensions() {
        return config.getStringList("stencil.templates.extensions");
    }

    /**
     * @return The compiler log verbosity, 0 (errors) to 4 (trace).
     */
    public int verbosity() {
        return config.getInt("stencil.compiler.verbosity");
    }

    /**
     * @return The options section resolver.
     */
    public OptionsResolver optionsResolver() {
        return new OptionsResolver(config);
    }
}
