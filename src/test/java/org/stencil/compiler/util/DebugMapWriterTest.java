package org.stencil.compiler.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stencil.compiler.api.CompilationOptions;
import org.stencil.compiler.api.CompiledArtifact;
import org.stencil.compiler.api.DebugMapEntry;
import org.stencil.compiler.api.OptionFlag;
import org.stencil.compiler.api.SourceSpan;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class DebugMapWriterTest {

    @TempDir
    Path tempDir;

    private static CompiledArtifact artifact() {
        DebugMapEntry entry = new DebugMapEntry(1, 12, 21, new SourceSpan("pages/home.html", 16, 25, 2, 1));
        return new CompiledArtifact("pages/home.html", "<!--dbg:1--><p>Hi</p><!--/dbg:1-->", List.of(entry),
                CompilationOptions.of(OptionFlag.HTML).withDebug(true), List.of());
    }

    @Test
    @Tag("unit")
    void testMapFileSitsNextToOutput() {
        Path output = tempDir.resolve("pages").resolve("home.html");

        assertThat(DebugMapWriter.mapFileOf(output)).isEqualTo(tempDir.resolve("pages").resolve("home.html.map.json"));
    }

    @Test
    @Tag("unit")
    void testJsonContainsRegions() throws Exception {
        // Act
        JsonNode root = new ObjectMapper().readTree(DebugMapWriter.toJson(artifact()));

        // Assert
        assertThat(root.get("sourceId").asText()).isEqualTo("pages/home.html");
        assertThat(root.get("options").asText()).isEqualTo("[html;debug]");
        JsonNode region = root.get("regions").get(0);
        assertThat(region.get("id").asInt()).isEqualTo(1);
        assertThat(region.get("outputStart").asInt()).isEqualTo(12);
        assertThat(region.get("outputEnd").asInt()).isEqualTo(21);
        assertThat(region.get("file").asText()).isEqualTo("pages/home.html");
        assertThat(region.get("line").asInt()).isEqualTo(2);
        assertThat(region.get("sourceStart").asInt()).isEqualTo(16);
    }

    @Test
    @Tag("unit")
    void testWriteCreatesMapFile() throws Exception {
        Path output = tempDir.resolve("home.html");

        Path written = DebugMapWriter.write(artifact(), output);

        assertThat(written).exists();
        assertThat(Files.readString(written)).contains("\"regions\"");
    }
}
