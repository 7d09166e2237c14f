package org.noteg.lang.error;

import io.vavr.control.Option;
import org.noteg.lang.tree.SourceLocation;

/**
 * Parse error with location and context information.
 */
public sealed interface ParseError extends LangError {
    SourceLocation position();

    @Override
    default Option<SourceLocation> location() {
        return Option.some(position());
    }

    /**
     * A token other than the one the grammar requires.
     */
    record UnexpectedToken(SourceLocation position, String found, String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected " + found + " at " + position + ", expected " + expected;
        }
    }

    /**
     * Input ended while a construct was still open.
     */
    record UnexpectedEnd(SourceLocation position, String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + position + ", expected " + expected;
        }
    }

    /**
     * Error token produced by the lexer (unterminated string, stray character).
     */
    record LexicalError(SourceLocation position, String reason) implements ParseError {
        @Override
        public String message() {
            return reason + " at " + position;
        }
    }
}
