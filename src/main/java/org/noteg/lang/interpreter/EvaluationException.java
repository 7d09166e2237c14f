package org.noteg.lang.interpreter;

import org.noteg.lang.error.RuntimeError;

/**
 * Unwinds evaluation at the first runtime error. Never escapes {@link Interpreter}.
 */
final class EvaluationException extends RuntimeException {
    private final RuntimeError error;

    EvaluationException(RuntimeError error) {
        super(error.message(), null, false, false);
        this.error = error;
    }

    RuntimeError error() {
        return error;
    }
}
