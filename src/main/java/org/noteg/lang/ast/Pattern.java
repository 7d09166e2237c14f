package org.noteg.lang.ast;

import org.noteg.lang.tree.SourceSpan;

import java.util.List;

/**
 * Patterns used by match arms.
 */
public sealed interface Pattern {
    SourceSpan span();

    /**
     * {@code _}
     */
    record Wildcard(SourceSpan span) implements Pattern {}

    record Binding(SourceSpan span, String name) implements Pattern {}

    record Literal(SourceSpan span, Object value) implements Pattern {}

    record ArrayPattern(SourceSpan span, List<Pattern> elements) implements Pattern {
        public ArrayPattern {
            elements = List.copyOf(elements);
        }
    }

    /**
     * {@code { name: pattern, other }}; a bare name binds the field to that name.
     */
    record RecordPattern(SourceSpan span, List<FieldPattern> fields) implements Pattern {
        public RecordPattern {
            fields = List.copyOf(fields);
        }
    }

    record FieldPattern(String name, Pattern pattern) {}
}
