package org.noteg.lang.cli.commands;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.noteg.lang.NotegLang;
import org.noteg.lang.cli.CommandLineInterface;
import org.noteg.lang.compiler.CompilerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Compiles a source file to JavaScript.
 * <p>
 * Options left out on the command line fall back to the {@code noteg.compiler} configuration.
 */
@Command(
    name = "compile",
    description = "Compile a NoteG source file to JavaScript"
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @Parameters(index = "0", paramLabel = "FILE", description = "NoteG source file")
    private Path file;

    @Option(
        names = {"-o", "--output"},
        description = "Write the script to this file instead of standard output"
    )
    private Path output;

    @Option(
        names = {"--profile"},
        description = "Emission profile named in the output header"
    )
    private String profile;

    @Option(
        names = {"--strict"},
        negatable = true,
        description = "Emit the \"use strict\" directive (default: from configuration)"
    )
    private Boolean strict;

    @Option(
        names = {"--minify"},
        description = "Request minified output (accepted, not yet applied)"
    )
    private boolean minify;

    @Option(
        names = {"--source-map"},
        description = "Request a source map (accepted, not yet emitted)"
    )
    private boolean sourceMap;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        final CompilerOptions options;
        try {
            options = resolveOptions();
        } catch (ConfigException | IllegalArgumentException e) {
            log.error("Failed to resolve compiler options: {}", e.getMessage());
            err.println("Error: invalid configuration: " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }

        final String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Cannot read {}: {}", file, e.getMessage());
            err.println("Error: cannot read " + file + ": " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }

        var result = NotegLang.compile(source, options);
        if (result.isLeft()) {
            err.println("Parse error: " + result.getLeft().message());
            err.flush();
            return CommandLineInterface.EXIT_LANGUAGE_ERROR;
        }

        if (output == null) {
            out.print(result.get());
            out.flush();
            return CommandLineInterface.EXIT_OK;
        }
        try {
            Files.writeString(output, result.get(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Cannot write {}: {}", output, e.getMessage());
            err.println("Error: cannot write " + output + ": " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }
        log.info("Compiled {} to {}", file, output);
        return CommandLineInterface.EXIT_OK;
    }

    private CompilerOptions resolveOptions() {
        var builder = parent.getCompilerOptions().toBuilder();
        if (profile != null) {
            builder.emissionProfile(profile);
        }
        if (strict != null) {
            builder.strict(strict);
        }
        if (minify) {
            builder.minify(true);
        }
        if (sourceMap) {
            builder.sourceMap(true);
        }
        return builder.build();
    }
}
