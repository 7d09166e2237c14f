package org.noteg.lang.ast;

import io.vavr.control.Option;
import org.noteg.lang.tree.SourceSpan;

import java.util.List;

/**
 * Expression nodes. The set is closed; consumers switch over {@link #kind()}.
 */
public sealed interface Expr {

    enum Kind {
        LITERAL,
        IDENTIFIER,
        BINARY,
        UNARY,
        CALL,
        LAMBDA,
        CONDITIONAL,
        MATCH,
        BLOCK,
        ARRAY,
        RECORD,
        FIELD,
        INDEX,
        PIPE,
        TEMPLATE
    }

    Kind kind();

    SourceSpan span();

    /**
     * Literal value: {@code null}, {@link Boolean}, {@link Double} or {@link String}.
     */
    record Literal(SourceSpan span, Object value) implements Expr {
        @Override
        public Kind kind() {
            return Kind.LITERAL;
        }
    }

    record Identifier(SourceSpan span, String name) implements Expr {
        @Override
        public Kind kind() {
            return Kind.IDENTIFIER;
        }
    }

    record Binary(SourceSpan span, Expr left, BinaryOperator operator, Expr right) implements Expr {
        @Override
        public Kind kind() {
            return Kind.BINARY;
        }
    }

    record Unary(SourceSpan span, UnaryOperator operator, Expr operand) implements Expr {
        @Override
        public Kind kind() {
            return Kind.UNARY;
        }
    }

    record Call(SourceSpan span, Expr callee, List<Expr> arguments) implements Expr {
        public Call {
            arguments = List.copyOf(arguments);
        }

        @Override
        public Kind kind() {
            return Kind.CALL;
        }
    }

    record Lambda(SourceSpan span, List<String> parameters, Expr body) implements Expr {
        public Lambda {
            parameters = List.copyOf(parameters);
        }

        @Override
        public Kind kind() {
            return Kind.LAMBDA;
        }
    }

    record Conditional(SourceSpan span, Expr condition, Expr thenBranch, Option<Expr> elseBranch) implements Expr {
        @Override
        public Kind kind() {
            return Kind.CONDITIONAL;
        }
    }

    /**
     * {@code match subject with { pattern -> body, ... }}. Parsed, never evaluated.
     */
    record Match(SourceSpan span, Expr subject, List<MatchArm> arms) implements Expr {
        public Match {
            arms = List.copyOf(arms);
        }

        @Override
        public Kind kind() {
            return Kind.MATCH;
        }
    }

    record MatchArm(SourceSpan span, Pattern pattern, Expr body) {}

    /**
     * Statement sequence; its value is the value of the last statement.
     */
    record Block(SourceSpan span, List<Stmt> statements) implements Expr {
        public Block {
            statements = List.copyOf(statements);
        }

        @Override
        public Kind kind() {
            return Kind.BLOCK;
        }
    }

    record ArrayLiteral(SourceSpan span, List<Expr> elements) implements Expr {
        public ArrayLiteral {
            elements = List.copyOf(elements);
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY;
        }
    }

    /**
     * Record literal; field order is kept for output.
     */
    record RecordLiteral(SourceSpan span, List<RecordField> fields) implements Expr {
        public RecordLiteral {
            fields = List.copyOf(fields);
        }

        @Override
        public Kind kind() {
            return Kind.RECORD;
        }
    }

    /**
     * @param quoted true when the name was written as a string literal key
     */
    record RecordField(String name, boolean quoted, Expr value) {}

    record Field(SourceSpan span, Expr object, String name) implements Expr {
        @Override
        public Kind kind() {
            return Kind.FIELD;
        }
    }

    record Index(SourceSpan span, Expr collection, Expr index) implements Expr {
        @Override
        public Kind kind() {
            return Kind.INDEX;
        }
    }

    /**
     * {@code left |> right}. Removed by the pipe desugaring pass before evaluation or codegen.
     */
    record Pipe(SourceSpan span, Expr left, Expr right) implements Expr {
        @Override
        public Kind kind() {
            return Kind.PIPE;
        }
    }

    record Template(SourceSpan span, List<TemplatePart> parts) implements Expr {
        public Template {
            parts = List.copyOf(parts);
        }

        @Override
        public Kind kind() {
            return Kind.TEMPLATE;
        }
    }

    sealed interface TemplatePart {
        record Text(String text) implements TemplatePart {}

        record Embedded(Expr expression) implements TemplatePart {}
    }
}
