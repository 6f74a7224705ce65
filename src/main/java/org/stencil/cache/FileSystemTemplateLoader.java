package org.stencil.cache;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Loads templates from a directory. A source identity is the path relative to that directory,
 * with forward slashes; its first segment names the application.
 */
public final class FileSystemTemplateLoader implements TemplateLoader {

    private final Path root;

    /**
     * @param root The template directory.
     */
    public FileSystemTemplateLoader(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public TemplateSource load(String sourceId) throws IOException {
        Path file = resolve(sourceId);
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        return new TemplateSource(sourceId, applicationOf(sourceId), Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * @param sourceId A source identity.
     * @return The file it refers to.
     * @throws IOException if the identity points outside the template directory.
     */
    public Path resolve(String sourceId) throws IOException {
        Path file = root.resolve(sourceId).normalize();
        if (!file.startsWith(root)) {
            throw new IOException("Template '" + sourceId + "' lies outside " + root);
        }
        return file;
    }

    /**
     * @param file A file below the template directory.
     * @return Its source identity.
     */
    public String sourceIdOf(Path file) {
        return root.relativize(file.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    /**
     * @return The template directory.
     */
    public Path root() {
        return root;
    }

    /**
     * @param sourceId A source identity.
     * @return The first path segment, or the empty string for templates at the top level.
     */
    public static String applicationOf(String sourceId) {
        int slash = sourceId.indexOf('/');
        return slash < 0 ? "" : sourceId.substring(0, slash);
    }
}
