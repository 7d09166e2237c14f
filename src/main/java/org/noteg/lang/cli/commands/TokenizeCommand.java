package org.noteg.lang.cli.commands;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.noteg.lang.NotegLang;
import org.noteg.lang.cli.CommandLineInterface;
import org.noteg.lang.lexer.Token;
import org.noteg.lang.lexer.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Prints the token stream of a source file, one token per line.
 * <p>
 * Error tokens are printed in place; the exit code is 1 when any were produced.
 */
@Command(
    name = "tokenize",
    description = "Print the tokens of a NoteG source file, one per line"
)
public class TokenizeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TokenizeCommand.class);

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

        var tokens = NotegLang.tokenize(source);
        var errors = 0;
        for (var token : tokens) {
            out.println(format(token));
            if (token.is(TokenKind.ERROR)) {
                errors++;
            }
        }
        out.flush();
        log.debug("Tokenized {} into {} tokens ({} errors)", file, tokens.size(), errors);
        return errors == 0 ? CommandLineInterface.EXIT_OK : CommandLineInterface.EXIT_LANGUAGE_ERROR;
    }

    static String format(Token token) {
        var text = token.is(TokenKind.ERROR) ? token.literal() : token.lexeme();
        return token.start() + " " + token.kind() + " '" + text.replace("\n", "\\n").replace("\t", "\\t") + "'";
    }
}
