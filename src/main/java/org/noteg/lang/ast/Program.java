package org.noteg.lang.ast;

import java.util.List;

/**
 * A parsed source file: its top-level statements in source order.
 */
public record Program(List<Stmt> statements) {
    public Program {
        statements = List.copyOf(statements);
    }

    public static Program empty() {
        return new Program(List.of());
    }
}
