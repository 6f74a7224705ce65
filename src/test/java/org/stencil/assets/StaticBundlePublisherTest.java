package org.stencil.assets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.stencil.compiler.backend.optimize.AssetKind;
import org.stencil.junit.extensions.logging.LogWatchExtension;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(LogWatchExtension.class)
public class StaticBundlePublisherTest {

    @TempDir
    Path staticRoot;

    private StaticBundlePublisher publisher;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(staticRoot.resolve("js"));
        Files.writeString(staticRoot.resolve("js").resolve("a.js"), "var a = 1");
        Files.writeString(staticRoot.resolve("js").resolve("b.js"), "var b = 2;");
        Files.writeString(staticRoot.resolve("site.css"), "body { margin: 0 }");
        Files.writeString(staticRoot.resolve("print.css"), "nav { display: none }");
        publisher = new StaticBundlePublisher(staticRoot, "/static", "bundles");
    }

    @Test
    @Tag("unit")
    void testScriptsAreJoinedIntoHashedBundle() throws Exception {
        // Act
        String url = publisher.publish(List.of("/static/js/a.js", "/static/js/b.js?v=3"), AssetKind.JAVASCRIPT);

        // Assert
        assertThat(url).matches("/static/bundles/[0-9a-f]{16}\\.js");
        Path bundle = staticRoot.resolve(url.substring("/static/".length()));
        assertThat(Files.readString(bundle)).isEqualTo("var a = 1;\nvar b = 2;");
    }

    @Test
    @Tag("unit")
    void testSameContentYieldsSameUrl() {
        String first = publisher.publish(List.of("/static/site.css", "/static/print.css"), AssetKind.CSS);
        String second = publisher.publish(List.of("/site.css", "/print.css"), AssetKind.CSS);

        assertThat(second).isEqualTo(first).endsWith(".css");
    }

    @Test
    @Tag("unit")
    void testMissingFileFails() {
        assertThatThrownBy(() -> publisher.publish(List.of("/static/js/a.js", "/static/js/gone.js"), AssetKind.JAVASCRIPT))
                .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    @Tag("unit")
    void testUrlOutsideStaticRootIsRejected() {
        assertThatThrownBy(() -> publisher.fileOf("/static/../../etc/passwd"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("outside");
    }
}
