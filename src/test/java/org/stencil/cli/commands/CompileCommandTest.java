package org.stencil.cli.commands;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.stencil.cli.CommandLineInterface;
import org.stencil.compiler.diagnostics.CompilerLogger;
import org.stencil.junit.extensions.logging.ExpectLog;
import org.stencil.junit.extensions.logging.LogLevel;
import org.stencil.junit.extensions.logging.LogWatchExtension;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(LogWatchExtension.class)
public class CompileCommandTest {

    @TempDir
    Path tempDir;

    private Path config;
    private Path templates;
    private Path output;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws Exception {
        config = tempDir.resolve("stencil.conf");
        Files.writeString(config, "stencil.compiler.verbosity = 1\n");
        templates = tempDir.resolve("templates");
        output = tempDir.resolve("out");
        Files.createDirectories(templates.resolve("shop"));
        Files.writeString(templates.resolve("shop").resolve("index.html"), "<p>Hello   {{ name }}</p>\n");
        Files.writeString(templates.resolve("README.md"), "not a template");
    }

    @AfterEach
    void resetCompilerLogger() {
        CompilerLogger.setLevel(CompilerLogger.INFO);
    }

    private int run(String... compileArgs) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine commandLine = CommandLineInterface.createCommandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        String[] args = new String[compileArgs.length + 2];
        args[0] = "-c";
        args[1] = config.toString();
        System.arraycopy(compileArgs, 0, args, 2, compileArgs.length);
        return commandLine.execute(args);
    }

    @Test
    @Tag("unit")
    void testTemplatesAreCompiledIntoOutputTree() throws Exception {
        // Act
        int exitCode = run("compile", templates.toString(), "-o", output.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(Files.readString(output.resolve("shop").resolve("index.html"))).isEqualTo("<p>Hello {{ name }}</p>");
        assertThat(output.resolve("README.md")).doesNotExist();
        assertThat(out.toString()).contains("Compiled 1 templates, skipped 0 up to date, 0 failed.");
    }

    @Test
    @Tag("unit")
    void testCompilerVerbosityIsTakenFromConfiguration() {
        // Arrange
        CompilerLogger.setLevel(CompilerLogger.TRACE);

        // Act
        int exitCode = run("compile", templates.toString(), "-o", output.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(CompilerLogger.getLevel()).isEqualTo(CompilerLogger.WARN);
    }

    @Test
    @Tag("unit")
    void testUpToDateOutputIsSkippedUnlessAll() {
        run("compile", templates.toString(), "-o", output.toString());

        run("compile", templates.toString(), "-o", output.toString());
        assertThat(out.toString()).contains("Compiled 0 templates, skipped 1 up to date");

        run("compile", templates.toString(), "-o", output.toString(), "--all");
        assertThat(out.toString()).contains("Compiled 1 templates, skipped 0 up to date");
    }

    @Test
    @Tag("unit")
    void testDebugWritesMarkersAndMap() throws Exception {
        int exitCode = run("compile", templates.toString(), "-o", output.toString(), "--debug");

        assertThat(exitCode).isZero();
        Path target = output.resolve("shop").resolve("index.html");
        assertThat(Files.readString(target)).startsWith("<!--dbg:1-->");
        assertThat(output.resolve("shop").resolve("index.html.map.json")).exists();
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*CompileCommand", messagePattern = "Compiling broken.html failed: .*")
    void testFailingTemplateSetsExitCode() throws Exception {
        // Arrange
        Files.writeString(templates.resolve("broken.html"), "<div><span></div>");

        // Act
        int exitCode = run("compile", templates.toString(), "-o", output.toString());

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(output.resolve("broken.html")).doesNotExist();
        assertThat(output.resolve("shop").resolve("index.html")).exists();
        assertThat(out.toString()).contains("Compiled 1 templates, skipped 0 up to date, 1 failed.");
    }

    @Test
    @Tag("unit")
    void testMissingTemplateDirectory() {
        int exitCode = run("compile", tempDir.resolve("nowhere").toString(), "-o", output.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Template directory not found");
    }
}
