package org.noteg.lang.ast;

import org.noteg.lang.tree.SourceSpan;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Type expressions carried by type declarations. They have no runtime meaning.
 */
public sealed interface TypeExpr {
    SourceSpan span();

    /**
     * {@code Name} or {@code Name<A, B>}
     */
    record Named(SourceSpan span, String name, List<TypeExpr> arguments) implements TypeExpr {
        public Named {
            arguments = List.copyOf(arguments);
        }
    }

    /**
     * {@code [T]}
     */
    record ArrayType(SourceSpan span, TypeExpr element) implements TypeExpr {}

    /**
     * {@code { name: T, ... }}
     */
    record RecordType(SourceSpan span, List<FieldType> fields) implements TypeExpr {
        public RecordType {
            fields = List.copyOf(fields);
        }
    }

    record FieldType(String name, TypeExpr type) {}

    /**
     * {@code (A, B) -> R}
     */
    record FunctionType(SourceSpan span, List<TypeExpr> parameters, TypeExpr result) implements TypeExpr {
        public FunctionType {
            parameters = List.copyOf(parameters);
        }
    }

    /**
     * Render a type back to NoteG syntax, e.g. {@code (number, [string]) -> { ok: bool }}.
     */
    static String describe(TypeExpr type) {
        if (type instanceof Named named) {
            return named.arguments().isEmpty()
                   ? named.name()
                   : named.name() + describeAll(named.arguments(), "<", ">");
        }
        if (type instanceof ArrayType array) {
            return "[" + describe(array.element()) + "]";
        }
        if (type instanceof RecordType record) {
            return record.fields().isEmpty()
                   ? "{}"
                   : record.fields()
                           .stream()
                           .map(field -> field.name() + ": " + describe(field.type()))
                           .collect(Collectors.joining(", ", "{ ", " }"));
        }
        var function = (FunctionType) type;
        return describeAll(function.parameters(), "(", ")") + " -> " + describe(function.result());
    }

    private static String describeAll(List<TypeExpr> types, String open, String close) {
        return types.stream()
                    .map(TypeExpr::describe)
                    .collect(Collectors.joining(", ", open, close));
    }
}
