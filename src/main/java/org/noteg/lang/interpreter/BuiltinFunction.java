package org.noteg.lang.interpreter;

import io.vavr.control.Either;
import org.noteg.lang.error.RuntimeError;

import java.util.List;

/**
 * Native implementation behind a builtin value.
 */
@FunctionalInterface
public interface BuiltinFunction {
    Either<RuntimeError, Value> apply(List<Value> arguments);
}
