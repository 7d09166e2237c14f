package org.noteg.lang.parser;

import io.vavr.control.Option;
import org.noteg.lang.ast.Program;
import org.noteg.lang.error.Diagnostic;

import java.util.List;

/**
 * Result of parsing with error recovery: the statements that parsed and the accumulated diagnostics.
 *
 * <p>On full success {@code program} is present and {@code diagnostics} is empty. With errors,
 * {@code program} holds the statements that parsed around them, or is empty if none did.
 *
 * @param program     parsed program, possibly partial
 * @param diagnostics one diagnostic per parse error, in source order
 * @param source      the original source text, used for formatting
 */
public record ParseResultWithDiagnostics(Option<Program> program, List<Diagnostic> diagnostics, String source) {

    public static ParseResultWithDiagnostics success(Program program, String source) {
        return new ParseResultWithDiagnostics(Option.some(program), List.of(), source);
    }

    public static ParseResultWithDiagnostics withErrors(Option<Program> program, List<Diagnostic> diagnostics, String source) {
        return new ParseResultWithDiagnostics(program, List.copyOf(diagnostics), source);
    }

    public boolean isSuccess() {
        return program.isDefined() && diagnostics.isEmpty();
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Format all diagnostics against the source.
     *
     * @param filename name shown in the location lines
     */
    public String formatDiagnostics(String filename) {
        var sb = new StringBuilder();
        for (var diagnostic : diagnostics) {
            sb.append(diagnostic.format(source, filename)).append("\n");
        }
        return sb.toString();
    }

    public String formatDiagnostics() {
        return formatDiagnostics("input");
    }

    public int errorCount() {
        return diagnostics.size();
    }
}
