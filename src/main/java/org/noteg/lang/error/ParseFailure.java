package org.noteg.lang.error;

import io.vavr.control.Option;
import org.noteg.lang.tree.SourceLocation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * All parse errors of one source text, reported together.
 */
public record ParseFailure(List<ParseError> errors) implements LangError {

    public ParseFailure {
        errors = List.copyOf(errors);
    }

    @Override
    public String message() {
        return errors.stream()
                     .map(ParseError::message)
                     .collect(Collectors.joining("\n"));
    }

    @Override
    public Option<SourceLocation> location() {
        return errors.isEmpty() ? Option.none() : errors.get(0).location();
    }
}
