package org.stencil.compiler.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.stencil.compiler.api.CompiledArtifact;
import org.stencil.compiler.api.DebugMapEntry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the debug map of a compiled artifact as JSON, the format the browser-side
 * source-mapping extension reads.
 */
public final class DebugMapWriter {

    /** Suffix appended to the output file name. */
    public static final String SUFFIX = ".map.json";

    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    /**
     * One marker region.
     *
     * @param id The marker identifier.
     * @param outputStart The output offset after the opening marker.
     * @param outputEnd The output offset of the closing marker.
     * @param file The template the region was generated from.
     * @param line The 1-based source line.
     * @param column The 1-based source column.
     * @param sourceStart The source offset (inclusive).
     * @param sourceEnd The source offset (exclusive).
     */
    public record Region(int id, int outputStart, int outputEnd, String file, int line, int column,
                  int sourceStart, int sourceEnd) {

        static Region of(DebugMapEntry entry) {
            return new Region(entry.id(), entry.outputStart(), entry.outputEnd(),
                    entry.source().fileName(), entry.source().line(), entry.source().column(),
                    entry.source().start(), entry.source().end());
        }
    }

    /**
     * The whole map file.
     *
     * @param sourceId The compiled template.
     * @param options The option set it was compiled with.
     * @param regions The marker regions in id order.
     */
    public record DebugMap(String sourceId, String options, List<Region> regions) {
    }

    private DebugMapWriter() {}

    /**
     * @param output The file the compiled output was written to.
     * @return The path of its debug map.
     */
    public static Path mapFileOf(Path output) {
        return output.resolveSibling(output.getFileName() + SUFFIX);
    }

    /**
     * Serializes the debug map of an artifact.
     * @param artifact The artifact.
     * @return The JSON text.
     * @throws IOException if serialization fails.
     */
    public static String toJson(CompiledArtifact artifact) throws IOException {
        List<Region> regions = artifact.debugMap().stream().map(Region::of).toList();
        return WRITER.writeValueAsString(new DebugMap(artifact.sourceId(), artifact.options().toString(), regions));
    }

    /**
     * Writes the debug map next to the compiled output.
     * @param artifact The artifact.
     * @param output The file the compiled output was written to.
     * @return The written map file.
     * @throws IOException if the file cannot be written.
     */
    public static Path write(CompiledArtifact artifact, Path output) throws IOException {
        Path target = mapFileOf(output);
        Files.writeString(target, toJson(artifact));
        return target;
    }
}
