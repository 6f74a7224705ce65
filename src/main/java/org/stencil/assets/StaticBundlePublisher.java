package org.stencil.assets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stencil.compiler.backend.optimize.AssetKind;
import org.stencil.compiler.backend.optimize.AssetPublisher;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Publishes bundles into a directory below the static file root.
 * <p>
 * A URL is mapped to a file by stripping the static URL prefix (or a leading slash) and
 * resolving the rest against the static root. The bundle is named after the hash of its
 * content, so publishing the same files twice yields the same URL and leaves the file as it is.
 */
public final class StaticBundlePublisher implements AssetPublisher {

    private static final Logger LOG = LoggerFactory.getLogger(StaticBundlePublisher.class);

    private final Path staticRoot;
    private final String staticUrl;
    private final String bundleDir;

    /**
     * @param staticRoot The directory the static URL prefix maps to.
     * @param staticUrl The static URL prefix, e.g. {@code /static/}.
     * @param bundleDir The subdirectory of {@code staticRoot} that receives bundles.
     */
    public StaticBundlePublisher(Path staticRoot, String staticUrl, String bundleDir) {
        this.staticRoot = staticRoot.toAbsolutePath().normalize();
        this.staticUrl = staticUrl.endsWith("/") ? staticUrl : staticUrl + "/";
        this.bundleDir = bundleDir;
    }

    @Override
    public String publish(List<String> urls, AssetKind kind) {
        StringBuilder content = new StringBuilder();
        try {
            for (String url : urls) {
                if (content.length() > 0) {
                    content.append(kind == AssetKind.JAVASCRIPT ? ";\n" : "\n");
                }
                content.append(Files.readString(fileOf(url), StandardCharsets.UTF_8));
            }
            String name = hash(content.toString()) + (kind == AssetKind.JAVASCRIPT ? ".js" : ".css");
            Path target = staticRoot.resolve(bundleDir).resolve(name);
            if (!Files.exists(target)) {
                Files.createDirectories(target.getParent());
                Files.writeString(target, content, StandardCharsets.UTF_8);
                LOG.info("Published bundle {} from {} files", target, urls.size());
            }
            return staticUrl + bundleDir + "/" + name;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * @param url A local asset URL.
     * @return The file below the static root it refers to.
     * @throws IOException if the URL points outside the static root.
     */
    Path fileOf(String url) throws IOException {
        String path = url;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        if (path.startsWith(staticUrl)) {
            path = path.substring(staticUrl.length());
        } else if (path.startsWith("/")) {
            path = path.substring(1);
        }
        Path file = staticRoot.resolve(path).normalize();
        if (!file.startsWith(staticRoot)) {
            throw new IOException("Asset '" + url + "' lies outside " + staticRoot);
        }
        return file;
    }

    private static String hash(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
