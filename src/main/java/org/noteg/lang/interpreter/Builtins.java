package org.noteg.lang.interpreter;

import io.vavr.control.Either;
import org.noteg.lang.error.RuntimeError;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Factory for the builtin functions every program starts with.
 *
 * <p>Each call to {@link #globals(Consumer)} builds a fresh root environment, so nothing is
 * shared between independent interpretations.
 */
public final class Builtins {
    public static final List<String> NAMES = List.of("print", "len", "str", "num", "type");

    // number literal with an optional leading minus, matched after trimming
    private static final Pattern NUMBER_TEXT = Pattern.compile("-?[0-9]+(\\.[0-9]+)?");

    private Builtins() {}

    /**
     * New root environment holding the builtins.
     *
     * @param output sink receiving each line written by {@code print}
     */
    public static Environment globals(Consumer<String> output) {
        var environment = Environment.root();
        define(environment, "print", arguments -> print(output, arguments));
        define(environment, "len", unary("len", Builtins::len));
        define(environment, "str", unary("str", value -> Either.right(new Value.StringValue(value.display()))));
        define(environment, "num", unary("num", Builtins::num));
        define(environment, "type", unary("type", value -> Either.right(new Value.StringValue(value.typeName()))));
        return environment;
    }

    private static void define(Environment environment, String name, BuiltinFunction function) {
        environment.define(name, new Value.Builtin(name, function));
    }

    private static BuiltinFunction unary(String name, Function<Value, Either<RuntimeError, Value>> body) {
        return arguments -> arguments.size() == 1
                            ? body.apply(arguments.get(0))
                            : Either.left(RuntimeError.of(name + " expects 1 argument but got " + arguments.size()));
    }

    private static Either<RuntimeError, Value> print(Consumer<String> output, List<Value> arguments) {
        output.accept(arguments.stream()
                               .map(Value::display)
                               .collect(Collectors.joining(" ")));
        return Either.right(Value.NullValue.INSTANCE);
    }

    private static Either<RuntimeError, Value> len(Value value) {
        if (value instanceof Value.StringValue string) {
            return Either.right(new Value.NumberValue(string.value().length()));
        }
        if (value instanceof Value.ArrayValue array) {
            return Either.right(new Value.NumberValue(array.elements().size()));
        }
        return Either.left(RuntimeError.of("len expects a string or array but got " + value.typeName()));
    }

    private static Either<RuntimeError, Value> num(Value value) {
        if (value instanceof Value.NumberValue) {
            return Either.right(value);
        }
        if (value instanceof Value.StringValue string) {
            var text = string.value().trim();
            if (!NUMBER_TEXT.matcher(text).matches()) {
                return Either.left(RuntimeError.of("num cannot convert \"" + string.value() + "\" to a number"));
            }
            return Either.right(new Value.NumberValue(Double.parseDouble(text)));
        }
        return Either.left(RuntimeError.of("num expects a string but got " + value.typeName()));
    }
}
