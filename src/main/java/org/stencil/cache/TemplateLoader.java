package org.stencil.cache;

import java.io.IOException;

/**
 * Supplies template sources to the {@link CompilationCache}.
 */
@FunctionalInterface
public interface TemplateLoader {

    /**
     * @param sourceId The identity of the template.
     * @return The loaded source.
     * @throws IOException if the template cannot be read.
     */
    TemplateSource load(String sourceId) throws IOException;
}
