package org.noteg.lang.lexer;

import org.noteg.lang.tree.SourceLocation;
import org.noteg.lang.tree.SourceSpan;

/**
 * A classified, positioned lexical unit.
 *
 * @param kind    token kind
 * @param lexeme  exact source text of the token
 * @param literal decoded value: string contents with escapes applied for {@code STRING} and
 *                template segments, the diagnostic message for {@code ERROR}, otherwise the lexeme
 * @param span    source range
 */
public record Token(TokenKind kind, String lexeme, String literal, SourceSpan span) {

    public SourceLocation start() {
        return span.start();
    }

    public SourceLocation end() {
        return span.end();
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    /**
     * Description used in "Unexpected ..." messages.
     */
    public String describe() {
        return switch (kind) {
            case IDENTIFIER -> "identifier '" + lexeme + "'";
            case NUMBER -> "number " + lexeme;
            case STRING, TEMPLATE_TEXT, TEMPLATE_END -> "string \"" + literal + "\"";
            case ERROR -> "invalid token '" + lexeme + "'";
            default -> kind.description();
        };
    }

    @Override
    public String toString() {
        return kind + " '" + lexeme + "' " + span;
    }
}
