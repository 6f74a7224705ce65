package org.stencil.cli.commands;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stencil.cache.CompilationCache;
import org.stencil.cache.FileSystemTemplateLoader;
import org.stencil.cli.CommandLineInterface;
import org.stencil.compiler.Compiler;
import org.stencil.compiler.api.CompilationException;
import org.stencil.compiler.api.CompilationOptions;
import org.stencil.compiler.api.CompiledArtifact;
import org.stencil.compiler.backend.optimize.PassRegistry;
import org.stencil.compiler.frontend.directive.DirectiveRegistry;
import org.stencil.compiler.diagnostics.CompilerLogger;
import org.stencil.compiler.util.DebugMapWriter;
import org.stencil.config.OptionsResolver;
import org.stencil.config.StencilSettings;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Command(name = "compile", description = "Compiles every template below a directory into an output directory.")
public class CompileCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CompileCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", description = "The template directory.")
    private File templateDir;

    @Option(names = {"-o", "--output"}, required = true, description = "The output directory.")
    private File outputDir;

    @Option(names = "--all", description = "Compile every template, including those whose output is up to date.")
    private boolean all;

    @Option(names = "--debug", description = "Emit debug markers and write a debug map next to each output.")
    private boolean debug;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        if (!templateDir.isDirectory()) {
            spec.commandLine().getErr().println("Template directory not found: " + templateDir.getAbsolutePath());
            return 2;
        }
        Config config = parent.getConfig();
        StencilSettings settings = new StencilSettings(config);
        CompilerLogger.setLevel(settings.verbosity());
        OptionsResolver resolver = settings.optionsResolver();

        Compiler compiler = new Compiler(
                DirectiveRegistry.initialize(settings.directiveSettings()),
                PassRegistry.initializeWithDefaults(),
                settings.assetPublisher().orElse(null));
        FileSystemTemplateLoader loader = new FileSystemTemplateLoader(templateDir.toPath());
        CompilationCache cache = new CompilationCache(compiler, loader);

        int compiled = 0;
        int skipped = 0;
        int failed = 0;
        for (Path file : findTemplates(loader.root(), settings.templateExtensions())) {
            String sourceId = loader.sourceIdOf(file);
            Path target = outputDir.toPath().resolve(sourceId);
            if (!all && isUpToDate(file, target)) {
                LOG.debug("Skipping {}, output is up to date", sourceId);
                skipped++;
                continue;
            }
            CompilationOptions options = resolver.resolve(sourceId, FileSystemTemplateLoader.applicationOf(sourceId));
            if (debug) {
                options = options.withDebug(true);
            }
            try {
                CompiledArtifact artifact = cache.compile(sourceId, options);
                write(artifact, target);
                artifact.warnings().forEach(w -> LOG.warn("{}", w));
                compiled++;
            } catch (CompilationException e) {
                LOG.error("Compiling {} failed: {}", sourceId, e.getMessage());
                failed++;
            }
        }
        out.printf("Compiled %d templates, skipped %d up to date, %d failed.%n", compiled, skipped, failed);
        return failed > 0 ? 1 : 0;
    }

    private static List<Path> findTemplates(Path root, List<String> extensions) throws IOException {
        try (Stream<Path> files = Files.walk(root)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(f -> {
                        String name = f.getFileName().toString().toLowerCase(Locale.ROOT);
                        return extensions.stream().anyMatch(name::endsWith);
                    })
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private boolean isUpToDate(Path source, Path target) throws IOException {
        if (!Files.exists(target)) {
            return false;
        }
        if (debug && !Files.exists(DebugMapWriter.mapFileOf(target))) {
            return false;
        }
        return Files.getLastModifiedTime(target).compareTo(Files.getLastModifiedTime(source)) >= 0;
    }

    private static void write(CompiledArtifact artifact, Path target) throws IOException {
        Files.createDirectories(target.toAbsolutePath().getParent());
        Files.writeString(target, artifact.output(), StandardCharsets.UTF_8);
        if (artifact.options().debug()) {
            DebugMapWriter.write(artifact, target);
        }
        LOG.info("Compiled {} -> {}", artifact.sourceId(), target);
    }
}
