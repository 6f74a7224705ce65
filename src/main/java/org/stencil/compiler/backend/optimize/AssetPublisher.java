package org.stencil.compiler.backend.optimize;

import java.util.List;

/**
 * Publishes a bundle of local static files and returns the URL it is served under. Supplied
 * by the host application; the compiler never touches the files itself.
 */
@FunctionalInterface
public interface AssetPublisher {

    /**
     * @param urls The URLs of the files to bundle, in document order.
     * @param kind The content type of the bundle.
     * @return The URL of the published bundle.
     * @throws java.io.UncheckedIOException if the bundle cannot be written.
     */
    String publish(List<String> urls, AssetKind kind);
}
