package org.stencil.compiler.frontend.directive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stencil.compiler.frontend.directive.features.BuiltinDirectives;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A registry of directives. Built once through a {@link Builder} and read-only afterwards,
 * so one instance can be shared by all compiling threads.
 */
public final class DirectiveRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(DirectiveRegistry.class);

    private final Map<String, DirectiveEntry> entries;
    private final Set<String> branchKeywords;

    private DirectiveRegistry(Map<String, DirectiveEntry> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        this.branchKeywords = entries.values().stream()
                .flatMap(e -> e.branches().stream())
                .map(BranchKeyword::keyword)
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Gets the entry for a given directive name.
     * @param name The directive name.
     * @return An {@link Optional} containing the entry if it exists, otherwise empty.
     */
    public Optional<DirectiveEntry> lookup(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    /**
     * @param name A directive name.
     * @return {@code true} if the name is a registered block directive.
     */
    public boolean isBlock(String name) {
        DirectiveEntry entry = entries.get(name);
        return entry != null && entry.isBlock();
    }

    /**
     * @param name A directive name.
     * @return {@code true} if any block directive accepts the name as a branch keyword.
     */
    public boolean isBranchKeyword(String name) {
        return branchKeywords.contains(name);
    }

    /**
     * @return The number of registered directives.
     */
    public int size() {
        return entries.size();
    }

    /**
     * @return A new, empty builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Initializes the registry with all built-in directives, the configured runtime names and
     * every {@link DirectiveProvider} found on the class path.
     *
     * @param settings The host-specific directive settings.
     * @return A new, read-only registry.
     * @throws IllegalStateException if any name is registered twice.
     */
    public static DirectiveRegistry initialize(DirectiveSettings settings) {
        Builder builder = builder();
        BuiltinDirectives.registerAll(builder, settings);
        for (String name : settings.runtimeDirectives()) {
            builder.register(DirectiveEntry.runtime(name, 0, DirectiveEntry.UNBOUNDED));
        }
        for (String name : settings.runtimeBlocks()) {
            builder.register(DirectiveEntry.block(name, BlockKind.ALTERNATIVES, 0, DirectiveEntry.UNBOUNDED));
        }
        for (DirectiveProvider provider : ServiceLoader.load(DirectiveProvider.class)) {
            LOG.debug("Registering directives from provider {}", provider.getClass().getName());
            provider.register(builder);
        }
        DirectiveRegistry registry = builder.build();
        LOG.debug("Directive registry initialized with {} directives", registry.size());
        return registry;
    }

    /**
     * Collects entries before the registry is frozen.
     */
    public static final class Builder {
        private final Map<String, DirectiveEntry> entries = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a new directive.
         * @param entry The directive entry.
         * @return This builder.
         * @throws IllegalStateException if the name is already registered.
         */
        public Builder register(DirectiveEntry entry) {
            if (entries.containsKey(entry.name())) {
                throw new IllegalStateException("Directive '" + entry.name() + "' is already registered");
            }
            entries.put(entry.name(), entry);
            return this;
        }

        /**
         * Registers a pure inline directive.
         * @param name The directive name.
         * @param purity Must be {@link Purity#PURE} for an evaluator to be used.
         * @param evaluator The evaluator.
         * @return This builder.
         */
        public Builder register(String name, Purity purity, DirectiveEvaluator evaluator) {
            if (purity == Purity.PURE) {
                return register(DirectiveEntry.pure(name, 0, DirectiveEntry.UNBOUNDED, evaluator));
            }
            return register(DirectiveEntry.runtime(name, 0, DirectiveEntry.UNBOUNDED));
        }

        /**
         * @return The frozen registry.
         */
        public DirectiveRegistry build() {
            return new DirectiveRegistry(entries);
        }
    }
}
