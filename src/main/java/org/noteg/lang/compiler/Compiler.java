package org.noteg.lang.compiler;

import io.vavr.control.Either;
import org.noteg.lang.ast.Program;
import org.noteg.lang.error.ParseFailure;
import org.noteg.lang.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles NoteG source text to JavaScript.
 */
public final class Compiler {
    private static final Logger log = LoggerFactory.getLogger(Compiler.class);

    private final CompilerOptions options;

    private Compiler(CompilerOptions options) {
        this.options = options;
    }

    public static Compiler create() {
        return new Compiler(CompilerOptions.DEFAULT);
    }

    public static Compiler create(CompilerOptions options) {
        return new Compiler(options);
    }

    public CompilerOptions options() {
        return options;
    }

    /**
     * Parse, desugar and generate. Every parse error is reported in a single {@link ParseFailure}.
     */
    public Either<ParseFailure, String> compile(String source) {
        return Parser.parse(source)
                     .mapLeft(ParseFailure::new)
                     .peekLeft(failure -> log.debug("Compilation aborted with {} parse errors", failure.errors().size()))
                     .map(this::generate);
    }

    /**
     * Generate JavaScript for an already desugared program.
     */
    public String generate(Program program) {
        if (options.minify()) {
            log.debug("Minification is not supported yet; emitting unminified output");
        }
        if (options.sourceMap()) {
            log.debug("Source maps are not supported yet; none will be emitted");
        }
        var output = ScriptGenerator.create(options).generate(program);
        log.debug("Compiled {} statements for profile {} ({} chars)",
                  program.statements().size(),
                  options.emissionProfile(),
                  output.length());
        return output;
    }
}
