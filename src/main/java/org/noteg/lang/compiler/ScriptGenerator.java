package org.noteg.lang.compiler;

import io.vavr.control.Option;
import org.noteg.lang.ast.BinaryOperator;
import org.noteg.lang.ast.Expr;
import org.noteg.lang.ast.Program;
import org.noteg.lang.ast.Stmt;
import org.noteg.lang.ast.TypeExpr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Generates JavaScript source from a desugared {@link Program}.
 *
 * <p>Every top-level statement becomes exactly one output line. Nested statement lists (blocks and
 * module bodies) are emitted inline as immediately invoked arrow functions.
 *
 * <p>Builtins are emitted as {@code $$}-prefixed helpers that reach JavaScript globals only through
 * {@code globalThis}, so user bindings can take any builtin or global name. A binding that shadows a
 * name from an enclosing scope is renamed with a numeric suffix ({@code x$1}).
 */
public final class ScriptGenerator {

    private static final String HELPER_PREFIX = "$$";

    // One helper per line, keyed by builtin name
    private static final Map<String, String> PREAMBLE = preamble();

    private static final Pattern PLAIN_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final CompilerOptions options;

    private ScriptGenerator(CompilerOptions options) {
        this.options = options;
    }

    public static ScriptGenerator create(CompilerOptions options) {
        return new ScriptGenerator(options);
    }

    public String generate(Program program) {
        var sb = new StringBuilder();

        generateHeader(sb);
        generatePreamble(sb);
        generateStatements(sb, program);

        return sb.toString();
    }

    private static Map<String, String> preamble() {
        var helpers = new LinkedHashMap<String, String>();
        helpers.put("print", """
            function $$print(...args) { globalThis.console.log(args.map((arg) => $$str(arg)).join(" ")); return null; }""");
        helpers.put("len", """
            function $$len(value) { return value.length; }""");
        helpers.put("str", """
            function $$str(value) { if (value === null) return "null"; if (globalThis.Array.isArray(value)) return "[" + value.map((item) => $$str(item)).join(", ") + "]"; if (typeof value === "function") return "<fn>"; if (typeof value === "object") { const fields = globalThis.Object.entries(value).map(([k, v]) => k + ": " + $$str(v)); return fields.length === 0 ? "{}" : "{ " + fields.join(", ") + " }"; } return globalThis.String(value); }""");
        helpers.put("num", """
            function $$num(value) { if (typeof value === "number") return value; if (typeof value !== "string" || !/^-?[0-9]+(\\.[0-9]+)?$/.test(value.trim())) throw new globalThis.Error("num: cannot convert " + $$str(value) + " to a number"); return globalThis.Number(value.trim()); }""");
        helpers.put("type", """
            function $$type(value) { if (value === null) return "null"; if (globalThis.Array.isArray(value)) return "array"; switch (typeof value) { case "boolean": return "bool"; case "object": return "record"; default: return typeof value; } }""");
        return helpers;
    }

    // === Sections ===

    private void generateHeader(StringBuilder sb) {
        sb.append("// Generated by noteg-lang (profile: ").append(options.emissionProfile()).append(")\n");
        if (options.strict()) {
            sb.append("\"use strict\";\n");
        }
    }

    private void generatePreamble(StringBuilder sb) {
        for (var helper : PREAMBLE.values()) {
            sb.append(helper).append("\n");
        }
    }

    private void generateStatements(StringBuilder sb, Program program) {
        var scope = Scope.root(program.statements());
        for (var stmt : program.statements()) {
            generateStatement(sb, stmt, scope, true);
            sb.append("\n");
        }
    }

    // === Statements ===

    private void generateStatement(StringBuilder sb, Stmt stmt, Scope scope, boolean topLevel) {
        switch (stmt.kind()) {
            case LET -> {
                var let = (Stmt.Let) stmt;
                generateBinding(sb, let.name(), false, let.value(), scope);
            }
            case CONST -> {
                var constant = (Stmt.Const) stmt;
                generateBinding(sb, constant.name(), true, constant.value(), scope);
            }
            case EXPRESSION -> {
                generateExpression(sb, ((Stmt.ExpressionStatement) stmt).expression(), scope);
                sb.append(";");
            }
            case TYPE -> {
                var type = (Stmt.TypeDeclaration) stmt;
                comment(sb, "type " + type.name() + " = " + TypeExpr.describe(type.type()), topLevel);
            }
            case MODULE -> generateModule(sb, (Stmt.ModuleDeclaration) stmt, scope);
            case IMPORT -> {
                var imported = (Stmt.ImportDeclaration) stmt;
                comment(sb, "import " + String.join(", ", imported.names()) + " from " + quote(imported.source()), topLevel);
            }
            case EXPORT -> {
                var export = (Stmt.ExportDeclaration) stmt;
                if (export.declaration().isDefined()) {
                    generateStatement(sb, export.declaration().get(), scope, topLevel);
                    sb.append(" ");
                }
                comment(sb, "export " + String.join(", ", export.names()), topLevel);
            }
        }
    }

    /**
     * First binding of a name in a scope declares it; later ones assign.
     *
     * <p>The value is generated before the name is declared, so it still sees any outer binding of the
     * same name. Lambdas are the exception: they are declared first so they can call themselves.
     */
    private void generateBinding(StringBuilder sb, String name, boolean constant, Expr value, Scope scope) {
        if (scope.isLocal(name)) {
            sb.append(scope.resolve(name)).append(" = ");
            generateExpression(sb, value, scope);
            sb.append(";");
            return;
        }
        var code = new StringBuilder();
        String target;
        if (value.kind() == Expr.Kind.LAMBDA) {
            target = scope.declare(name);
            generateExpression(code, value, scope);
        } else {
            generateExpression(code, value, scope);
            target = scope.declare(name);
        }
        sb.append(constant && !scope.isRebound(name) ? "const " : "let ")
          .append(target).append(" = ").append(code).append(";");
    }

    private void generateModule(StringBuilder sb, Stmt.ModuleDeclaration module, Scope scope) {
        var bodyScope = scope.child(module.body());
        var body = new StringBuilder();
        body.append("(() => { ");
        for (var stmt : module.body()) {
            generateStatement(body, stmt, bodyScope, false);
            body.append(" ");
        }
        var exported = new ArrayList<String>();
        for (var stmt : module.body()) {
            if (stmt instanceof Stmt.ExportDeclaration export) {
                for (var name : export.names()) {
                    var field = key(name);
                    var local = bodyScope.resolve(name);
                    exported.add(field.equals(local) ? field : field + ": " + local);
                }
            }
        }
        body.append(exported.isEmpty() ? "return {};" : "return { " + String.join(", ", exported) + " };");
        body.append(" })()");

        var name = module.name();
        if (scope.isLocal(name)) {
            sb.append(scope.resolve(name));
        } else {
            sb.append(scope.isRebound(name) ? "let " : "const ").append(scope.declare(name));
        }
        sb.append(" = ").append(body).append(";");
    }

    // === Expressions ===

    private void generateExpression(StringBuilder sb, Expr expr, Scope scope) {
        switch (expr.kind()) {
            case LITERAL -> literal(sb, ((Expr.Literal) expr).value());
            case IDENTIFIER -> sb.append(scope.resolve(((Expr.Identifier) expr).name()));
            case BINARY -> {
                var binary = (Expr.Binary) expr;
                sb.append("(");
                generateExpression(sb, binary.left(), scope);
                sb.append(" ").append(operator(binary.operator())).append(" ");
                generateExpression(sb, binary.right(), scope);
                sb.append(")");
            }
            case UNARY -> {
                var unary = (Expr.Unary) expr;
                sb.append("(").append(unary.operator().symbol());
                generateExpression(sb, unary.operand(), scope);
                sb.append(")");
            }
            case CALL -> {
                var call = (Expr.Call) expr;
                generatePostfixTarget(sb, call.callee(), scope);
                sb.append("(");
                generateList(sb, call.arguments(), scope);
                sb.append(")");
            }
            case LAMBDA -> {
                var lambda = (Expr.Lambda) expr;
                var parameters = scope.parameters(lambda.parameters());
                sb.append("((");
                for (int i = 0; i < lambda.parameters().size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(parameters.resolve(lambda.parameters().get(i)));
                }
                sb.append(") => ");
                generateExpression(sb, lambda.body(), parameters);
                sb.append(")");
            }
            case CONDITIONAL -> {
                var conditional = (Expr.Conditional) expr;
                sb.append("(");
                generateExpression(sb, conditional.condition(), scope);
                sb.append(" ? ");
                generateExpression(sb, conditional.thenBranch(), scope);
                sb.append(" : ");
                if (conditional.elseBranch().isDefined()) {
                    generateExpression(sb, conditional.elseBranch().get(), scope);
                } else {
                    sb.append("null");
                }
                sb.append(")");
            }
            case MATCH -> sb.append("/* unimplemented: match */ null");
            case BLOCK -> generateBlock(sb, (Expr.Block) expr, scope);
            case ARRAY -> {
                sb.append("[");
                generateList(sb, ((Expr.ArrayLiteral) expr).elements(), scope);
                sb.append("]");
            }
            case RECORD -> {
                var fields = ((Expr.RecordLiteral) expr).fields();
                if (fields.isEmpty()) {
                    sb.append("({})");
                } else {
                    sb.append("({ ");
                    for (int i = 0; i < fields.size(); i++) {
                        if (i > 0) sb.append(", ");
                        sb.append(key(fields.get(i).name())).append(": ");
                        generateExpression(sb, fields.get(i).value(), scope);
                    }
                    sb.append(" })");
                }
            }
            case FIELD -> {
                var field = (Expr.Field) expr;
                generatePostfixTarget(sb, field.object(), scope);
                sb.append(".").append(ReservedWords.escape(field.name()));
            }
            case INDEX -> {
                var index = (Expr.Index) expr;
                generatePostfixTarget(sb, index.collection(), scope);
                sb.append("[");
                generateExpression(sb, index.index(), scope);
                sb.append("]");
            }
            case PIPE -> throw new IllegalStateException("Pipe expression at " + expr.span()
                                                         + " reached code generation without desugaring");
            case TEMPLATE -> generateTemplate(sb, (Expr.Template) expr, scope);
        }
    }

    /**
     * {@code (() => { ...; return last; })()} with the block's own binding scope.
     */
    private void generateBlock(StringBuilder sb, Expr.Block block, Scope outer) {
        var statements = block.statements();
        var scope = outer.child(statements);
        sb.append("(() => { ");
        for (int i = 0; i < statements.size() - 1; i++) {
            generateStatement(sb, statements.get(i), scope, false);
            sb.append(" ");
        }
        if (statements.isEmpty()) {
            sb.append("return null;");
        } else {
            var last = statements.get(statements.size() - 1);
            if (last instanceof Stmt.ExpressionStatement expression) {
                sb.append("return ");
                generateExpression(sb, expression.expression(), scope);
                sb.append(";");
            } else {
                generateStatement(sb, last, scope, false);
                sb.append(" return ")
                  .append(bindingName(last).map(scope::resolve).getOrElse("null"))
                  .append(";");
            }
        }
        sb.append(" })()");
    }

    private void generateTemplate(StringBuilder sb, Expr.Template template, Scope scope) {
        sb.append("`");
        for (var part : template.parts()) {
            if (part instanceof Expr.TemplatePart.Text text) {
                templateText(sb, text.text());
            } else {
                sb.append("${");
                generateExpression(sb, ((Expr.TemplatePart.Embedded) part).expression(), scope);
                sb.append("}");
            }
        }
        sb.append("`");
    }

    private void generatePostfixTarget(StringBuilder sb, Expr target, Scope scope) {
        switch (target.kind()) {
            case IDENTIFIER, FIELD, INDEX, CALL -> generateExpression(sb, target, scope);
            default -> {
                sb.append("(");
                generateExpression(sb, target, scope);
                sb.append(")");
            }
        }
    }

    private void generateList(StringBuilder sb, List<Expr> expressions, Scope scope) {
        for (int i = 0; i < expressions.size(); i++) {
            if (i > 0) sb.append(", ");
            generateExpression(sb, expressions.get(i), scope);
        }
    }

    // === Helpers ===

    private static String operator(BinaryOperator operator) {
        return switch (operator) {
            case EQUAL -> "===";
            case NOT_EQUAL -> "!==";
            default -> operator.symbol();
        };
    }

    private static void literal(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof Double number) {
            sb.append(number(number));
        } else if (value instanceof String string) {
            sb.append(quote(string));
        } else {
            sb.append(value);
        }
    }

    static String number(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    static String quote(String s) {
        var sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x2028 || c == 0x2029) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    private static void templateText(StringBuilder sb, String text) {
        for (char c : text.toCharArray()) {
            switch (c) {
                case '`' -> sb.append("\\`");
                case '\\' -> sb.append("\\\\");
                case '$' -> sb.append("\\$");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
    }

    private static String key(String name) {
        return PLAIN_NAME.matcher(name).matches() ? ReservedWords.escape(name) : quote(name);
    }

    private static void comment(StringBuilder sb, String text, boolean lineComment) {
        if (lineComment) {
            sb.append("// ").append(text.replace('\n', ' ').replace('\r', ' '));
        } else {
            sb.append("/* ").append(text.replace("*/", "* /")).append(" */");
        }
    }

    private static Option<String> bindingName(Stmt stmt) {
        if (stmt instanceof Stmt.ModuleDeclaration module) {
            return Option.some(module.name());
        }
        return Stmt.boundName(stmt);
    }

    /**
     * Bindings of one statement list or parameter list, mapped to the JavaScript names they were emitted as.
     */
    private static final class Scope {
        private final Scope parent;
        private final Set<String> bound;
        private final Set<String> rebound;
        private final boolean lambdaBody;
        private final Map<String, String> names = new HashMap<>();
        private int renames;

        private Scope(Scope parent, Set<String> bound, Set<String> rebound, boolean lambdaBody) {
            this.parent = parent;
            this.bound = bound;
            this.rebound = rebound;
            this.lambdaBody = lambdaBody;
        }

        static Scope root(List<Stmt> statements) {
            return of(null, statements);
        }

        Scope child(List<Stmt> statements) {
            return of(this, statements);
        }

        Scope parameters(List<String> parameters) {
            var scope = new Scope(this, Set.copyOf(parameters), Set.of(), true);
            parameters.forEach(parameter -> scope.names.put(parameter, ReservedWords.escape(parameter)));
            return scope;
        }

        private static Scope of(Scope parent, List<Stmt> statements) {
            var counts = new HashMap<String, Integer>();
            for (var stmt : statements) {
                bindingName(stmt).forEach(name -> counts.merge(name, 1, Integer::sum));
            }
            var rebound = new HashSet<String>();
            counts.forEach((name, count) -> {
                if (count > 1) {
                    rebound.add(name);
                }
            });
            return new Scope(parent, counts.keySet(), rebound, false);
        }

        boolean isLocal(String name) {
            return names.containsKey(name);
        }

        boolean isRebound(String name) {
            return rebound.contains(name);
        }

        /**
         * Declare {@code name} here, renaming it when an enclosing scope already binds it.
         *
         * @return the JavaScript name to emit
         */
        String declare(String name) {
            var escaped = ReservedWords.escape(name);
            var emitted = parent != null && parent.lookup(name).isDefined()
                          ? escaped + "$" + root().nextRename()
                          : escaped;
            names.put(name, emitted);
            return emitted;
        }

        /**
         * JavaScript name for a reference to {@code name}. An unbound builtin name refers to its helper,
         * unless a lambda body refers ahead to a binding made later in an enclosing statement list.
         */
        String resolve(String name) {
            var found = lookup(name);
            if (found.isDefined()) {
                return found.get();
            }
            if (PREAMBLE.containsKey(name) && !boundAfterCall(name)) {
                return HELPER_PREFIX + name;
            }
            return ReservedWords.escape(name);
        }

        private Option<String> lookup(String name) {
            for (var scope = this; scope != null; scope = scope.parent) {
                var emitted = scope.names.get(name);
                if (emitted != null) {
                    return Option.some(emitted);
                }
            }
            return Option.none();
        }

        private boolean boundAfterCall(String name) {
            var deferred = false;
            for (var scope = this; scope != null; scope = scope.parent) {
                if (deferred && scope.bound.contains(name)) {
                    return true;
                }
                deferred |= scope.lambdaBody;
            }
            return false;
        }

        private Scope root() {
            var scope = this;
            while (scope.parent != null) {
                scope = scope.parent;
            }
            return scope;
        }

        private int nextRename() {
            return ++renames;
        }
    }
}
