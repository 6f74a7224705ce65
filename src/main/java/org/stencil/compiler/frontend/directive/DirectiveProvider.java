package org.stencil.compiler.frontend.directive;

/**
 * Service provider interface for directive libraries. Implementations are discovered with
 * {@link java.util.ServiceLoader} when the registry is initialized and must be listed in
 * {@code META-INF/services/org.stencil.compiler.frontend.directive.DirectiveProvider}.
 */
public interface DirectiveProvider {

    /**
     * Registers the provider's directives.
     * @param builder The registry builder. Registering a name twice fails the initialization.
     */
    void register(DirectiveRegistry.Builder builder);
}
