package org.noteg.lang.parser;

import org.noteg.lang.ast.Expr;
import org.noteg.lang.ast.Program;
import org.noteg.lang.ast.Stmt;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites every {@code left |> right} into a call: {@code a |> f(b)} becomes {@code f(a, b)} and
 * {@code a |> f} becomes {@code f(a)}. Nested pipes are rewritten innermost first, so
 * {@code a |> (f() |> g())} becomes {@code g(a, f())}.
 *
 * <p>Runs once, right after parsing; the interpreter and the compiler never see a pipe node.
 */
public final class PipeDesugarer {
    private PipeDesugarer() {}

    public static Program desugar(Program program) {
        return new Program(statements(program.statements()));
    }

    public static Expr desugar(Expr expr) {
        return switch (expr.kind()) {
            case LITERAL, IDENTIFIER -> expr;
            case BINARY -> {
                var binary = (Expr.Binary) expr;
                yield new Expr.Binary(binary.span(), desugar(binary.left()), binary.operator(), desugar(binary.right()));
            }
            case UNARY -> {
                var unary = (Expr.Unary) expr;
                yield new Expr.Unary(unary.span(), unary.operator(), desugar(unary.operand()));
            }
            case CALL -> {
                var call = (Expr.Call) expr;
                yield new Expr.Call(call.span(), desugar(call.callee()), expressions(call.arguments()));
            }
            case LAMBDA -> {
                var lambda = (Expr.Lambda) expr;
                yield new Expr.Lambda(lambda.span(), lambda.parameters(), desugar(lambda.body()));
            }
            case CONDITIONAL -> {
                var conditional = (Expr.Conditional) expr;
                yield new Expr.Conditional(conditional.span(),
                                           desugar(conditional.condition()),
                                           desugar(conditional.thenBranch()),
                                           conditional.elseBranch().map(branch -> desugar(branch)));
            }
            case MATCH -> {
                var match = (Expr.Match) expr;
                var arms = match.arms()
                                .stream()
                                .map(arm -> new Expr.MatchArm(arm.span(), arm.pattern(), desugar(arm.body())))
                                .toList();
                yield new Expr.Match(match.span(), desugar(match.subject()), arms);
            }
            case BLOCK -> {
                var block = (Expr.Block) expr;
                yield new Expr.Block(block.span(), statements(block.statements()));
            }
            case ARRAY -> {
                var array = (Expr.ArrayLiteral) expr;
                yield new Expr.ArrayLiteral(array.span(), expressions(array.elements()));
            }
            case RECORD -> {
                var record = (Expr.RecordLiteral) expr;
                var fields = record.fields()
                                   .stream()
                                   .map(field -> new Expr.RecordField(field.name(), field.quoted(), desugar(field.value())))
                                   .toList();
                yield new Expr.RecordLiteral(record.span(), fields);
            }
            case FIELD -> {
                var field = (Expr.Field) expr;
                yield new Expr.Field(field.span(), desugar(field.object()), field.name());
            }
            case INDEX -> {
                var index = (Expr.Index) expr;
                yield new Expr.Index(index.span(), desugar(index.collection()), desugar(index.index()));
            }
            case PIPE -> pipe((Expr.Pipe) expr);
            case TEMPLATE -> {
                var template = (Expr.Template) expr;
                var parts = template.parts()
                                    .stream()
                                    .map(PipeDesugarer::part)
                                    .toList();
                yield new Expr.Template(template.span(), parts);
            }
        };
    }

    private static Expr pipe(Expr.Pipe pipe) {
        var argument = desugar(pipe.left());
        var target = desugar(pipe.right());
        if (target instanceof Expr.Call call) {
            var arguments = new ArrayList<Expr>(call.arguments().size() + 1);
            arguments.add(argument);
            arguments.addAll(call.arguments());
            return new Expr.Call(pipe.span(), call.callee(), arguments);
        }
        return new Expr.Call(pipe.span(), target, List.of(argument));
    }

    private static Expr.TemplatePart part(Expr.TemplatePart part) {
        if (part instanceof Expr.TemplatePart.Embedded embedded) {
            return new Expr.TemplatePart.Embedded(desugar(embedded.expression()));
        }
        return part;
    }

    private static List<Expr> expressions(List<Expr> expressions) {
        return expressions.stream()
                          .map(expr -> desugar(expr))
                          .toList();
    }

    private static List<Stmt> statements(List<Stmt> statements) {
        return statements.stream()
                         .map(PipeDesugarer::statement)
                         .toList();
    }

    private static Stmt statement(Stmt stmt) {
        return switch (stmt.kind()) {
            case LET -> {
                var let = (Stmt.Let) stmt;
                yield new Stmt.Let(let.span(), let.name(), desugar(let.value()));
            }
            case CONST -> {
                var constant = (Stmt.Const) stmt;
                yield new Stmt.Const(constant.span(), constant.name(), desugar(constant.value()));
            }
            case EXPRESSION -> {
                var expression = (Stmt.ExpressionStatement) stmt;
                yield new Stmt.ExpressionStatement(expression.span(), desugar(expression.expression()));
            }
            case MODULE -> {
                var module = (Stmt.ModuleDeclaration) stmt;
                yield new Stmt.ModuleDeclaration(module.span(), module.name(), statements(module.body()));
            }
            case EXPORT -> {
                var export = (Stmt.ExportDeclaration) stmt;
                yield new Stmt.ExportDeclaration(export.span(), export.names(), export.declaration().map(PipeDesugarer::statement));
            }
            case TYPE, IMPORT -> stmt;
        };
    }
}
