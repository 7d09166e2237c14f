package org.noteg.lang.cli.commands;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.noteg.lang.cli.CommandLineInterface;
import org.noteg.lang.error.LangError;
import org.noteg.lang.error.RuntimeError;
import org.noteg.lang.interpreter.Interpreter;
import org.noteg.lang.interpreter.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Evaluates a source file. Output of {@code print} goes to standard output, followed by the
 * display form of the program's value unless that value is null.
 */
@Command(
    name = "interpret",
    description = "Evaluate a NoteG source file and print its result"
)
public class InterpretCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InterpretCommand.class);

    @Parameters(index = "0", paramLabel = "FILE", description = "NoteG source file")
    private Path file;

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

        var result = Interpreter.create(out::println).interpret(source);
        out.flush();
        if (result.isLeft()) {
            err.println(describe(result.getLeft()));
            err.flush();
            return CommandLineInterface.EXIT_LANGUAGE_ERROR;
        }
        var value = result.get();
        if (value.kind() != Value.Kind.NULL) {
            out.println(value.display());
            out.flush();
        }
        return CommandLineInterface.EXIT_OK;
    }

    private static String describe(LangError error) {
        return error instanceof RuntimeError runtime
               ? "Runtime error: " + runtime
               : "Parse error: " + error.message();
    }
}
