package org.noteg.lang.interpreter;

import io.vavr.control.Either;
import org.noteg.lang.ast.BinaryOperator;
import org.noteg.lang.ast.Expr;
import org.noteg.lang.ast.Program;
import org.noteg.lang.ast.Stmt;
import org.noteg.lang.error.LangError;
import org.noteg.lang.error.ParseFailure;
import org.noteg.lang.error.RuntimeError;
import org.noteg.lang.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.DoubleBinaryOperator;

/**
 * Tree-walking evaluator.
 *
 * <p>Evaluation is fail-fast: the first runtime error aborts the remaining statements and is
 * returned to the caller. Every call to {@link #execute(Program)} starts from a fresh global
 * environment, so one instance can be reused and shared between threads.
 */
public final class Interpreter {
    private static final Logger log = LoggerFactory.getLogger(Interpreter.class);

    private final Consumer<String> output;

    private Interpreter(Consumer<String> output) {
        this.output = output;
    }

    /**
     * Interpreter whose {@code print} writes to standard output.
     */
    public static Interpreter create() {
        return new Interpreter(System.out::println);
    }

    /**
     * Interpreter whose {@code print} lines go to {@code output}.
     */
    public static Interpreter create(Consumer<String> output) {
        return new Interpreter(output);
    }

    /**
     * Parse and evaluate source text. Parse errors are reported together as a {@link ParseFailure}.
     */
    public Either<LangError, Value> interpret(String source) {
        return Parser.parse(source)
                     .<LangError>mapLeft(ParseFailure::new)
                     .flatMap(program -> Either.narrow(execute(program)));
    }

    /**
     * Evaluate a desugared program; the result is the value of its last statement.
     */
    public Either<RuntimeError, Value> execute(Program program) {
        var globals = Builtins.globals(output);
        try {
            var result = executeAll(program.statements(), globals);
            log.debug("Evaluated {} statements to a {} value", program.statements().size(), result.typeName());
            return Either.right(result);
        } catch (EvaluationException e) {
            log.debug("Evaluation failed: {}", e.error());
            return Either.left(e.error());
        } catch (StackOverflowError e) {
            log.debug("Evaluation exceeded the maximum call depth");
            return Either.left(RuntimeError.of("maximum call depth exceeded"));
        }
    }

    // === Statements ===

    private Value executeAll(List<Stmt> statements, Environment environment) {
        Value last = Value.NullValue.INSTANCE;
        for (var statement : statements) {
            last = execute(statement, environment);
        }
        return last;
    }

    private Value execute(Stmt stmt, Environment environment) {
        return switch (stmt.kind()) {
            case LET -> {
                var let = (Stmt.Let) stmt;
                yield bind(let.name(), let.value(), environment);
            }
            case CONST -> {
                var constant = (Stmt.Const) stmt;
                yield bind(constant.name(), constant.value(), environment);
            }
            case EXPRESSION -> evaluate(((Stmt.ExpressionStatement) stmt).expression(), environment);
            case TYPE, IMPORT -> Value.NullValue.INSTANCE;
            case MODULE -> module((Stmt.ModuleDeclaration) stmt, environment);
            case EXPORT -> {
                var export = (Stmt.ExportDeclaration) stmt;
                yield export.declaration().isDefined()
                      ? execute(export.declaration().get(), environment)
                      : Value.NullValue.INSTANCE;
            }
        };
    }

    private Value bind(String name, Expr valueExpr, Environment environment) {
        var value = evaluate(valueExpr, environment);
        environment.define(name, value);
        return value;
    }

    /**
     * Runs the body in its own scope and binds a record of the exported names to the module name.
     */
    private Value module(Stmt.ModuleDeclaration module, Environment environment) {
        var scope = environment.child();
        var exportedNames = new ArrayList<String>();
        for (var statement : module.body()) {
            execute(statement, scope);
            if (statement instanceof Stmt.ExportDeclaration export) {
                exportedNames.addAll(export.names());
            }
        }
        var exports = new LinkedHashMap<String, Value>();
        for (var name : exportedNames) {
            var value = scope.lookupLocal(name)
                             .getOrElseThrow(() -> error(module,
                                                         "module " + module.name() + " exports undefined name: " + name));
            exports.put(name, value);
        }
        var record = new Value.RecordValue(exports);
        environment.define(module.name(), record);
        return record;
    }

    // === Expressions ===

    private Value evaluate(Expr expr, Environment environment) {
        return switch (expr.kind()) {
            case LITERAL -> Value.of(((Expr.Literal) expr).value());
            case IDENTIFIER -> {
                var name = ((Expr.Identifier) expr).name();
                yield environment.lookup(name)
                                 .getOrElseThrow(() -> error(expr, "undefined variable: " + name));
            }
            case BINARY -> binary((Expr.Binary) expr, environment);
            case UNARY -> unary((Expr.Unary) expr, environment);
            case CALL -> call((Expr.Call) expr, environment);
            case LAMBDA -> {
                var lambda = (Expr.Lambda) expr;
                yield new Value.Closure(lambda.parameters(), lambda.body(), environment);
            }
            case CONDITIONAL -> conditional((Expr.Conditional) expr, environment);
            case MATCH -> throw error(expr, "match expressions are not yet implemented");
            case BLOCK -> executeAll(((Expr.Block) expr).statements(), environment.child());
            case ARRAY -> {
                var elements = new ArrayList<Value>();
                for (var element : ((Expr.ArrayLiteral) expr).elements()) {
                    elements.add(evaluate(element, environment));
                }
                yield new Value.ArrayValue(elements);
            }
            case RECORD -> {
                var fields = new LinkedHashMap<String, Value>();
                for (var field : ((Expr.RecordLiteral) expr).fields()) {
                    fields.put(field.name(), evaluate(field.value(), environment));
                }
                yield new Value.RecordValue(fields);
            }
            case FIELD -> field((Expr.Field) expr, environment);
            case INDEX -> index((Expr.Index) expr, environment);
            case PIPE -> throw new IllegalStateException("Pipe expression at " + expr.span()
                                                         + " reached the interpreter without desugaring");
            case TEMPLATE -> template((Expr.Template) expr, environment);
        };
    }

    private Value binary(Expr.Binary binary, Environment environment) {
        var operator = binary.operator();
        var left = evaluate(binary.left(), environment);

        if (operator == BinaryOperator.AND || operator == BinaryOperator.OR) {
            var leftValue = requireBool(binary, left, operator.symbol());
            if (operator == BinaryOperator.AND ? !leftValue : leftValue) {
                return Value.BoolValue.of(leftValue);
            }
            var right = evaluate(binary.right(), environment);
            return Value.BoolValue.of(requireBool(binary, right, operator.symbol()));
        }

        var right = evaluate(binary.right(), environment);
        return switch (operator) {
            case EQUAL -> Value.BoolValue.of(isEqual(left, right));
            case NOT_EQUAL -> Value.BoolValue.of(!isEqual(left, right));
            case ADD -> add(binary, left, right);
            case SUBTRACT -> new Value.NumberValue(number(binary, left, right, (l, r) -> l - r));
            case MULTIPLY -> new Value.NumberValue(number(binary, left, right, (l, r) -> l * r));
            case DIVIDE -> {
                if (right instanceof Value.NumberValue divisor && divisor.value() == 0) {
                    requireNumbers(binary, left, right);
                    throw error(binary, "division by zero");
                }
                yield new Value.NumberValue(number(binary, left, right, (l, r) -> l / r));
            }
            case LESS, LESS_EQUAL, GREATER, GREATER_EQUAL -> Value.BoolValue.of(compare(binary, left, right));
            case AND, OR -> throw new IllegalStateException("Logical operators are evaluated above");
        };
    }

    private Value add(Expr.Binary binary, Value left, Value right) {
        if (left instanceof Value.StringValue l && right instanceof Value.StringValue r) {
            return new Value.StringValue(l.value() + r.value());
        }
        return new Value.NumberValue(number(binary, left, right, (l, r) -> l + r));
    }

    private double number(Expr.Binary binary,
                          Value left,
                          Value right,
                          DoubleBinaryOperator operation) {
        requireNumbers(binary, left, right);
        return operation.applyAsDouble(((Value.NumberValue) left).value(), ((Value.NumberValue) right).value());
    }

    private void requireNumbers(Expr.Binary binary, Value left, Value right) {
        if (!(left instanceof Value.NumberValue) || !(right instanceof Value.NumberValue)) {
            throw mismatch(binary, left, right);
        }
    }

    private boolean compare(Expr.Binary binary, Value left, Value right) {
        int comparison;
        if (left instanceof Value.NumberValue l && right instanceof Value.NumberValue r) {
            comparison = Double.compare(l.value(), r.value());
        } else if (left instanceof Value.StringValue l && right instanceof Value.StringValue r) {
            comparison = l.value().compareTo(r.value());
        } else {
            throw mismatch(binary, left, right);
        }
        return switch (binary.operator()) {
            case LESS -> comparison < 0;
            case LESS_EQUAL -> comparison <= 0;
            case GREATER -> comparison > 0;
            case GREATER_EQUAL -> comparison >= 0;
            default -> throw new IllegalStateException("Not a comparison: " + binary.operator());
        };
    }

    /**
     * Primitives compare by value, containers and functions by identity; different kinds are never equal.
     */
    private static boolean isEqual(Value left, Value right) {
        if (left.kind() != right.kind()) {
            return false;
        }
        return switch (left.kind()) {
            case NULL -> true;
            case BOOL -> ((Value.BoolValue) left).value() == ((Value.BoolValue) right).value();
            case NUMBER -> ((Value.NumberValue) left).value() == ((Value.NumberValue) right).value();
            case STRING -> ((Value.StringValue) left).value().equals(((Value.StringValue) right).value());
            case ARRAY, RECORD, CLOSURE, BUILTIN -> left == right;
        };
    }

    private Value unary(Expr.Unary unary, Environment environment) {
        var operand = evaluate(unary.operand(), environment);
        return switch (unary.operator()) {
            case NEGATE -> {
                if (operand instanceof Value.NumberValue number) {
                    yield new Value.NumberValue(-number.value());
                }
                throw error(unary, "cannot apply '-' to " + operand.typeName());
            }
            case NOT -> Value.BoolValue.of(!requireBool(unary, operand, "!"));
        };
    }

    private Value call(Expr.Call call, Environment environment) {
        var callee = evaluate(call.callee(), environment);
        var arguments = new ArrayList<Value>(call.arguments().size());
        for (var argument : call.arguments()) {
            arguments.add(evaluate(argument, environment));
        }

        if (callee instanceof Value.Closure closure) {
            if (closure.parameters().size() != arguments.size()) {
                throw error(call, "function expects " + closure.parameters().size()
                                  + " arguments but got " + arguments.size());
            }
            var scope = closure.environment().child();
            for (int i = 0; i < arguments.size(); i++) {
                scope.define(closure.parameters().get(i), arguments.get(i));
            }
            return evaluate(closure.body(), scope);
        }
        if (callee instanceof Value.Builtin builtin) {
            return builtin.function()
                          .apply(arguments)
                          .getOrElseThrow(error -> new EvaluationException(error.locatedAt(call.span().start())));
        }
        throw error(call, "cannot call a value of type " + callee.typeName());
    }

    private Value conditional(Expr.Conditional conditional, Environment environment) {
        var condition = evaluate(conditional.condition(), environment);
        if (requireBool(conditional.condition(), condition, "if")) {
            return evaluate(conditional.thenBranch(), environment);
        }
        return conditional.elseBranch().isDefined()
               ? evaluate(conditional.elseBranch().get(), environment)
               : Value.NullValue.INSTANCE;
    }

    private Value field(Expr.Field field, Environment environment) {
        var object = evaluate(field.object(), environment);
        if (!(object instanceof Value.RecordValue record)) {
            throw error(field, "cannot access field '" + field.name() + "' on " + object.typeName());
        }
        var value = record.fields().get(field.name());
        if (value == null) {
            throw error(field, "record has no field '" + field.name() + "'");
        }
        return value;
    }

    private Value index(Expr.Index index, Environment environment) {
        var collection = evaluate(index.collection(), environment);
        var position = evaluate(index.index(), environment);
        if (!(collection instanceof Value.ArrayValue) && !(collection instanceof Value.StringValue)) {
            throw error(index, "cannot index a value of type " + collection.typeName());
        }
        if (!(position instanceof Value.NumberValue number)) {
            throw error(index, "index must be a number but got " + position.typeName());
        }
        if (!number.isInteger()) {
            throw error(index, "index must be an integer but got " + number.display());
        }
        int length = collection instanceof Value.ArrayValue array
                     ? array.elements().size()
                     : ((Value.StringValue) collection).value().length();
        double offset = number.value();
        if (offset < 0 || offset >= length) {
            throw error(index, "index " + number.display() + " out of bounds for length " + length);
        }
        int i = (int) offset;
        if (collection instanceof Value.ArrayValue array) {
            return array.elements().get(i);
        }
        return new Value.StringValue(String.valueOf(((Value.StringValue) collection).value().charAt(i)));
    }

    private Value template(Expr.Template template, Environment environment) {
        var sb = new StringBuilder();
        for (var part : template.parts()) {
            if (part instanceof Expr.TemplatePart.Text text) {
                sb.append(text.text());
                continue;
            }
            var embedded = ((Expr.TemplatePart.Embedded) part).expression();
            var value = evaluate(embedded, environment);
            switch (value.kind()) {
                case NULL, BOOL, NUMBER, STRING -> sb.append(value.display());
                default -> throw error(embedded, "cannot interpolate a value of type " + value.typeName() + " into a string template");
            }
        }
        return new Value.StringValue(sb.toString());
    }

    // === Errors ===

    private boolean requireBool(Expr expr, Value value, String operation) {
        if (value instanceof Value.BoolValue bool) {
            return bool.value();
        }
        throw error(expr, "'" + operation + "' expects a bool but got " + value.typeName());
    }

    private static EvaluationException mismatch(Expr.Binary binary, Value left, Value right) {
        return error(binary, "cannot apply '" + binary.operator().symbol() + "' to "
                             + left.typeName() + " and " + right.typeName());
    }

    private static EvaluationException error(Expr expr, String message) {
        return new EvaluationException(RuntimeError.at(expr.span().start(), message));
    }

    private static EvaluationException error(Stmt stmt, String message) {
        return new EvaluationException(RuntimeError.at(stmt.span().start(), message));
    }
}
