package org.noteg.lang;

import io.vavr.control.Either;
import org.noteg.lang.ast.Program;
import org.noteg.lang.compiler.Compiler;
import org.noteg.lang.compiler.CompilerOptions;
import org.noteg.lang.error.LangError;
import org.noteg.lang.error.ParseError;
import org.noteg.lang.error.ParseFailure;
import org.noteg.lang.interpreter.Interpreter;
import org.noteg.lang.interpreter.Value;
import org.noteg.lang.lexer.Lexer;
import org.noteg.lang.lexer.Token;
import org.noteg.lang.parser.ParseResultWithDiagnostics;
import org.noteg.lang.parser.Parser;

import java.util.List;

/**
 * Entry point for the NoteG toolchain.
 *
 * <p>Example usage:
 * <pre>{@code
 * var value = NotegLang.interpret("""
 *     let double = fn(x) -> x * 2
 *     len([1, 2, 3]) |> double
 *     """).get();
 *
 * var script = NotegLang.compile("let x = 1 + 2").get();
 * }</pre>
 */
public final class NotegLang {
    private NotegLang() {}

    /**
     * Scan source text. Never fails: malformed input shows up as error tokens.
     */
    public static List<Token> tokenize(String source) {
        return Lexer.tokenize(source);
    }

    /**
     * Parse and desugar source text, collecting every error recovery can reach.
     */
    public static Either<List<ParseError>, Program> parse(String source) {
        return Parser.parse(source);
    }

    /**
     * Parse with errors rendered as Rust-style diagnostics.
     */
    public static ParseResultWithDiagnostics parseWithDiagnostics(String source) {
        return Parser.parseWithDiagnostics(source);
    }

    /**
     * Evaluate source text; {@code print} writes to standard output.
     */
    public static Either<LangError, Value> interpret(String source) {
        return Interpreter.create().interpret(source);
    }

    /**
     * Compile source text to JavaScript with {@link CompilerOptions#DEFAULT}.
     */
    public static Either<ParseFailure, String> compile(String source) {
        return compile(source, CompilerOptions.DEFAULT);
    }

    public static Either<ParseFailure, String> compile(String source, CompilerOptions options) {
        return Compiler.create(options).compile(source);
    }
}
