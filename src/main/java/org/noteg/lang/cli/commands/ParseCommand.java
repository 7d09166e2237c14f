package org.noteg.lang.cli.commands;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.noteg.lang.NotegLang;
import org.noteg.lang.ast.AstPrinter;
import org.noteg.lang.cli.CommandLineInterface;
import org.noteg.lang.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Prints the syntax tree of a source file, or its parse diagnostics.
 */
@Command(
    name = "parse",
    description = "Print the syntax tree of a NoteG source file"
)
public class ParseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);

    @Parameters(index = "0", paramLabel = "FILE", description = "NoteG source file")
    private Path file;

    @Option(
        names = {"--raw"},
        description = "Print the tree as written, before pipes are desugared"
    )
    private boolean raw;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        final String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Cannot read {}: {}", file, e.getMessage());
            err.println("Error: cannot read " + file + ": " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }

        var result = NotegLang.parseWithDiagnostics(source);
        if (result.hasErrors()) {
            err.print(result.formatDiagnostics(file.getFileName().toString()));
            err.flush();
            log.debug("Parsing {} produced {} errors", file, result.errorCount());
            return CommandLineInterface.EXIT_LANGUAGE_ERROR;
        }

        var program = raw ? Parser.parseSyntax(source).get() : result.program().get();
        var printed = AstPrinter.print(program);
        if (!printed.isEmpty()) {
            out.println(printed);
        }
        out.flush();
        return CommandLineInterface.EXIT_OK;
    }
}
