package org.stencil.config;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stencil.compiler.api.CompilationOptions;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves the option set a template starts with from the {@code stencil.options} section.
 * <p>
 * The default flags apply to every template. Each entry of {@code overrides} then applies, in
 * the order listed, to the templates it matches: its {@code applications} list names owning
 * applications and its {@code templates} list holds glob patterns over source identities; an
 * absent list matches everything. Inline overrides inside a template are applied later by the
 * compiler and win over everything here.
 */
public final class OptionsResolver {

    private static final Logger LOG = LoggerFactory.getLogger(OptionsResolver.class);

    private final CompilationOptions defaults;
    private final List<Rule> overrides;

    private record Rule(List<String> applications, List<PathMatcher> templates, List<String> options) {

        boolean matches(String sourceId, String application) {
            boolean applicationMatches = applications.isEmpty() || applications.contains(application);
            boolean templateMatches = templates.isEmpty()
                    || templates.stream().anyMatch(m -> m.matches(Path.of(sourceId)));
            return applicationMatches && templateMatches;
        }
    }

    /**
     * @param config The application configuration.
     * @throws IllegalArgumentException if a flag name is unknown.
     */
    public OptionsResolver(Config config) {
        Config section = config.getConfig("stencil.options");
        this.defaults = CompilationOptions.none()
                .apply(section.getStringList("default"))
                .withDebug(section.getBoolean("debug"));
        List<Rule> parsed = new ArrayList<>();
        for (Config entry : section.getConfigList("overrides")) {
            List<String> options = entry.getStringList("options");
            // Fail at start-up, not on the first matching template.
            CompilationOptions.none().apply(options);
            List<PathMatcher> templates = new ArrayList<>();
            if (entry.hasPath("templates")) {
                for (String glob : entry.getStringList("templates")) {
                    templates.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
                }
            }
            List<String> applications = entry.hasPath("applications") ? entry.getStringList("applications") : List.of();
            parsed.add(new Rule(applications, templates, options));
        }
        this.overrides = List.copyOf(parsed);
        LOG.debug("Default options {} with {} overrides", defaults, overrides.size());
    }

    /**
     * @return The options of a template no override matches.
     */
    public CompilationOptions defaults() {
        return defaults;
    }

    /**
     * @param sourceId The template identity.
     * @param application The owning application, empty for none.
     * @return The option set the template starts with.
     */
    public CompilationOptions resolve(String sourceId, String application) {
        CompilationOptions options = defaults;
        for (Rule override : overrides) {
            if (override.matches(sourceId, application)) {
                options = options.apply(override.options());
            }
        }
        return options;
    }
}
