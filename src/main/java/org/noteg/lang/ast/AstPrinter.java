package org.noteg.lang.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prints syntax trees as nested calls, e.g. {@code 1 + 2 * 3} prints as
 * {@code binary(+, 1, binary(*, 2, 3))}.
 */
public final class AstPrinter {
    private AstPrinter() {}

    /**
     * One line per top-level statement.
     */
    public static String print(Program program) {
        return program.statements()
                      .stream()
                      .map(node -> print(node))
                      .collect(Collectors.joining("\n"));
    }

    public static String print(Stmt stmt) {
        return switch (stmt.kind()) {
            case LET -> {
                var let = (Stmt.Let) stmt;
                yield parenthesize("let", let.name(), print(let.value()));
            }
            case CONST -> {
                var constant = (Stmt.Const) stmt;
                yield parenthesize("const", constant.name(), print(constant.value()));
            }
            case EXPRESSION -> print(((Stmt.ExpressionStatement) stmt).expression());
            case TYPE -> {
                var type = (Stmt.TypeDeclaration) stmt;
                yield parenthesize("type", type.name(), TypeExpr.describe(type.type()));
            }
            case MODULE -> {
                var module = (Stmt.ModuleDeclaration) stmt;
                var parts = new ArrayList<String>();
                parts.add(module.name());
                module.body().forEach(member -> parts.add(print(member)));
                yield parenthesize("module", parts);
            }
            case IMPORT -> {
                var imported = (Stmt.ImportDeclaration) stmt;
                yield parenthesize("import", list(imported.names()), quote(imported.source()));
            }
            case EXPORT -> {
                var export = (Stmt.ExportDeclaration) stmt;
                yield export.declaration()
                            .map(declaration -> parenthesize("export", list(export.names()), print(declaration)))
                            .getOrElse(() -> parenthesize("export", list(export.names())));
            }
        };
    }

    public static String print(Expr expr) {
        return switch (expr.kind()) {
            case LITERAL -> literal(((Expr.Literal) expr).value());
            case IDENTIFIER -> ((Expr.Identifier) expr).name();
            case BINARY -> {
                var binary = (Expr.Binary) expr;
                yield parenthesize("binary", binary.operator().symbol(), print(binary.left()), print(binary.right()));
            }
            case UNARY -> {
                var unary = (Expr.Unary) expr;
                yield parenthesize("unary", unary.operator().symbol(), print(unary.operand()));
            }
            case CALL -> {
                var call = (Expr.Call) expr;
                var parts = new ArrayList<String>();
                parts.add(print(call.callee()));
                call.arguments().forEach(argument -> parts.add(print(argument)));
                yield parenthesize("call", parts);
            }
            case LAMBDA -> {
                var lambda = (Expr.Lambda) expr;
                yield parenthesize("fn", list(lambda.parameters()), print(lambda.body()));
            }
            case CONDITIONAL -> {
                var conditional = (Expr.Conditional) expr;
                yield conditional.elseBranch()
                                 .map(elseBranch -> parenthesize("if",
                                                                 print(conditional.condition()),
                                                                 print(conditional.thenBranch()),
                                                                 print(elseBranch)))
                                 .getOrElse(() -> parenthesize("if",
                                                               print(conditional.condition()),
                                                               print(conditional.thenBranch())));
            }
            case MATCH -> {
                var match = (Expr.Match) expr;
                var parts = new ArrayList<String>();
                parts.add(print(match.subject()));
                match.arms().forEach(arm -> parts.add(parenthesize("arm", print(arm.pattern()), print(arm.body()))));
                yield parenthesize("match", parts);
            }
            case BLOCK -> parenthesize("block", ((Expr.Block) expr).statements()
                                                                   .stream()
                                                                   .map(node -> print(node))
                                                                   .collect(Collectors.toList()));
            case ARRAY -> parenthesize("array", ((Expr.ArrayLiteral) expr).elements()
                                                                          .stream()
                                                                          .map(node -> print(node))
                                                                          .collect(Collectors.toList()));
            case RECORD -> parenthesize("record", ((Expr.RecordLiteral) expr).fields()
                                                                            .stream()
                                                                            .map(field -> field.name() + ": " + print(field.value()))
                                                                            .collect(Collectors.toList()));
            case FIELD -> {
                var field = (Expr.Field) expr;
                yield parenthesize("field", print(field.object()), field.name());
            }
            case INDEX -> {
                var index = (Expr.Index) expr;
                yield parenthesize("index", print(index.collection()), print(index.index()));
            }
            case PIPE -> {
                var pipe = (Expr.Pipe) expr;
                yield parenthesize("pipe", print(pipe.left()), print(pipe.right()));
            }
            case TEMPLATE -> parenthesize("template", ((Expr.Template) expr).parts()
                                                                           .stream()
                                                                           .map(AstPrinter::part)
                                                                           .collect(Collectors.toList()));
        };
    }

    public static String print(Pattern pattern) {
        if (pattern instanceof Pattern.Wildcard) {
            return "_";
        }
        if (pattern instanceof Pattern.Binding binding) {
            return binding.name();
        }
        if (pattern instanceof Pattern.Literal literal) {
            return literal(literal.value());
        }
        if (pattern instanceof Pattern.ArrayPattern array) {
            return array.elements()
                        .stream()
                        .map(node -> print(node))
                        .collect(Collectors.joining(", ", "[", "]"));
        }
        return ((Pattern.RecordPattern) pattern).fields()
                                                .stream()
                                                .map(field -> field.name() + ": " + print(field.pattern()))
                                                .collect(Collectors.joining(", ", "{", "}"));
    }

    private static String part(Expr.TemplatePart part) {
        return part instanceof Expr.TemplatePart.Text text
               ? quote(text.text())
               : print(((Expr.TemplatePart.Embedded) part).expression());
    }

    private static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Double number) {
            return number == Math.rint(number) && Math.abs(number) < 1e15
                   ? Long.toString(number.longValue())
                   : number.toString();
        }
        if (value instanceof String string) {
            return quote(string);
        }
        return value.toString();
    }

    private static String quote(String s) {
        return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\t", "\\t") + "\"";
    }

    private static String list(List<String> names) {
        return "[" + String.join(", ", names) + "]";
    }

    private static String parenthesize(String name, String... parts) {
        return parenthesize(name, List.of(parts));
    }

    private static String parenthesize(String name, List<String> parts) {
        var builder = new StringBuilder();
        builder.append(name).append("(");
        builder.append(String.join(", ", parts));
        builder.append(")");
        return builder.toString();
    }
}
