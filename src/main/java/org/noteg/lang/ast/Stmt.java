package org.noteg.lang.ast;

import io.vavr.control.Option;
import org.noteg.lang.tree.SourceSpan;

import java.util.List;

/**
 * Statement nodes. The set is closed; consumers switch over {@link #kind()}.
 */
public sealed interface Stmt {

    enum Kind {
        LET,
        CONST,
        EXPRESSION,
        TYPE,
        MODULE,
        IMPORT,
        EXPORT
    }

    Kind kind();

    SourceSpan span();

    record Let(SourceSpan span, String name, Expr value) implements Stmt {
        @Override
        public Kind kind() {
            return Kind.LET;
        }
    }

    /**
     * Same runtime meaning as {@link Let}: binds or overwrites one name in the current scope.
     */
    record Const(SourceSpan span, String name, Expr value) implements Stmt {
        @Override
        public Kind kind() {
            return Kind.CONST;
        }
    }

    record ExpressionStatement(SourceSpan span, Expr expression) implements Stmt {
        @Override
        public Kind kind() {
            return Kind.EXPRESSION;
        }
    }

    record TypeDeclaration(SourceSpan span, String name, TypeExpr type) implements Stmt {
        @Override
        public Kind kind() {
            return Kind.TYPE;
        }
    }

    record ModuleDeclaration(SourceSpan span, String name, List<Stmt> body) implements Stmt {
        public ModuleDeclaration {
            body = List.copyOf(body);
        }

        @Override
        public Kind kind() {
            return Kind.MODULE;
        }
    }

    /**
     * {@code import a, b from "path"}
     */
    record ImportDeclaration(SourceSpan span, List<String> names, String source) implements Stmt {
        public ImportDeclaration {
            names = List.copyOf(names);
        }

        @Override
        public Kind kind() {
            return Kind.IMPORT;
        }
    }

    /**
     * {@code export let x = ...} (names holds the bound name) or {@code export a, b}.
     */
    record ExportDeclaration(SourceSpan span, List<String> names, Option<Stmt> declaration) implements Stmt {
        public ExportDeclaration {
            names = List.copyOf(names);
        }

        @Override
        public Kind kind() {
            return Kind.EXPORT;
        }
    }

    /**
     * Name introduced by a binding statement, if this is one.
     */
    static Option<String> boundName(Stmt stmt) {
        if (stmt instanceof Let let) {
            return Option.some(let.name());
        }
        if (stmt instanceof Const constant) {
            return Option.some(constant.name());
        }
        if (stmt instanceof ExportDeclaration export) {
            return export.declaration().flatMap(Stmt::boundName);
        }
        return Option.none();
    }
}
