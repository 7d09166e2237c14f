package org.noteg.lang.error;

import org.noteg.lang.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Source-anchored error report, rendered the way rustc prints errors.
 *
 * <p>Example output:
 * <pre>
 * error: Unexpected '=' at 1:5, expected identifier
 *   --> page.noteg:1:5
 *    |
 *  1 | let = 5
 *    |     ^ expected identifier
 *    |
 * </pre>
 *
 * @param message primary message
 * @param span    source span the report points at
 * @param labels  labeled spans underlined beneath the source line
 */
public record Diagnostic(String message, SourceSpan span, List<Label> labels) {

    public record Label(SourceSpan span, String message) {}

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(message, span, List.of());
    }

    /**
     * Diagnostic for a parse error, labeled with what the parser expected.
     */
    public static Diagnostic of(ParseError error, SourceSpan span) {
        var diagnostic = error(error.message(), span);
        if (error instanceof ParseError.UnexpectedToken unexpected) {
            return diagnostic.withLabel("expected " + unexpected.expected());
        }
        if (error instanceof ParseError.UnexpectedEnd end) {
            return diagnostic.withLabel("expected " + end.expected());
        }
        return diagnostic.withLabel(((ParseError.LexicalError) error).reason());
    }

    public Diagnostic withLabel(String labelMessage) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(new Label(span, labelMessage));
        return new Diagnostic(message, span, List.copyOf(newLabels));
    }

    /**
     * Render against the source text.
     *
     * @param source   the source text the span refers to
     * @param filename name shown in the location line, may be null
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append("error: ").append(message).append("\n");

        var loc = span.start();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc.line()).append(":").append(loc.column()).append("\n");

        int minLine = span.start().line();
        int maxLine = span.end().line();
        int gutterWidth = String.valueOf(maxLine).length();
        var gutter = " ".repeat(gutterWidth + 1);

        sb.append(gutter).append("|\n");
        for (int lineNum = minLine; lineNum <= maxLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) {
                continue;
            }
            var lineContent = lines[lineNum - 1];
            sb.append(String.format("%" + gutterWidth + "d", lineNum))
              .append(" | ")
              .append(lineContent)
              .append("\n");
            sb.append(" ".repeat(gutterWidth))
              .append(" | ")
              .append(underlines(lineNum, lineContent))
              .append("\n");
        }
        sb.append(gutter).append("|\n");
        return sb.toString();
    }

    private String underlines(int lineNum, String lineContent) {
        var lineLabels = labels.isEmpty() ? List.of(new Label(span, "")) : labels;
        var sb = new StringBuilder();
        int currentCol = 1;
        var sorted = lineLabels.stream()
                               .sorted(Comparator.comparingInt(label -> label.span().start().column()))
                               .toList();
        for (var label : sorted) {
            int startCol = label.span().start().line() == lineNum ? label.span().start().column() : 1;
            int endCol = label.span().end().line() == lineNum
                         ? label.span().end().column()
                         : lineContent.length() + 1;
            while (currentCol < startCol) {
                sb.append(' ');
                currentCol++;
            }
            int width = Math.max(1, endCol - startCol);
            sb.append("^".repeat(width));
            currentCol += width;
            if (!label.message().isEmpty()) {
                sb.append(' ').append(label.message());
            }
        }
        return sb.toString();
    }
}
