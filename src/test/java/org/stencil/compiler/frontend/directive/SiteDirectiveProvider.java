package org.stencil.compiler.frontend.directive;

/**
 * Registered in {@code META-INF/services} of the test class path.
 */
public class SiteDirectiveProvider implements DirectiveProvider {

    @Override
    public void register(DirectiveRegistry.Builder builder) {
        builder.register("site_name", Purity.PURE, arguments -> "Stencil");
        builder.register("current_user", Purity.CONTEXT_DEPENDENT, arguments -> "never evaluated");
    }
}
