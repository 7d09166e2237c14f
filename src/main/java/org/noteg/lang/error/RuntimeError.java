package org.noteg.lang.error;

import io.vavr.control.Option;
import org.noteg.lang.tree.SourceLocation;

/**
 * Failure raised while evaluating a program.
 */
public record RuntimeError(String message, Option<SourceLocation> location) implements LangError {

    public static RuntimeError of(String message) {
        return new RuntimeError(message, Option.none());
    }

    public static RuntimeError at(SourceLocation location, String message) {
        return new RuntimeError(message, Option.some(location));
    }

    /**
     * Attach a location unless one is already present.
     */
    public RuntimeError locatedAt(SourceLocation fallback) {
        return location.isDefined() ? this : at(fallback, message);
    }

    @Override
    public String toString() {
        return location.map(loc -> message + " at " + loc).getOrElse(message);
    }
}
