package org.noteg.lang.interpreter;

import org.junit.jupiter.api.Test;
import org.noteg.lang.error.LangError;
import org.noteg.lang.error.ParseFailure;
import org.noteg.lang.error.RuntimeError;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InterpreterTest {

    private final List<String> output = new ArrayList<>();
    private final Interpreter interpreter = Interpreter.create(output::add);

    private Value eval(String source) {
        var result = interpreter.interpret(source);
        assertTrue(result.isRight(), () -> "unexpected error: " + result.getLeft().message());
        return result.get();
    }

    private String display(String source) {
        return eval(source).display();
    }

    private RuntimeError failure(String source) {
        var result = interpreter.interpret(source);
        assertTrue(result.isLeft(), () -> "expected an error but got " + result.get().display());
        return assertInstanceOf(RuntimeError.class, result.getLeft());
    }

    // === Arithmetic and operators ===

    @Test
    void arithmetic_followsPrecedence() {
        assertEquals("7", display("1 + 2 * 3"));
    }

    @Test
    void arithmetic_isRightAssociative() {
        assertEquals("6", display("8 - 4 - 2"));
        assertEquals("4", display("8 / 4 / 2"));
    }

    @Test
    void division_producesFractions() {
        assertEquals("3.5", display("7 / 2"));
    }

    @Test
    void divisionByZero_isAlwaysAnError() {
        var error = failure("10 / 0");

        assertEquals("division by zero", error.message());
        assertEquals(1, error.location().get().column());
        assertEquals("division by zero", failure("0 / 0").message());
    }

    @Test
    void plus_concatenatesStrings() {
        assertEquals("ab", display("\"a\" + \"b\""));
    }

    @Test
    void plus_rejectsMixedOperands() {
        assertEquals("cannot apply '+' to number and string", failure("1 + \"a\"").message());
    }

    @Test
    void unaryOperators() {
        assertEquals("-3", display("-(1 + 2)"));
        assertEquals("false", display("!true"));
        assertTrue(failure("-\"a\"").message().contains("'-'"));
        assertTrue(failure("!1").message().contains("bool"));
    }

    @Test
    void comparisons_onNumbersAndStrings() {
        assertEquals(Value.BoolValue.TRUE, eval("1 <= 1"));
        assertEquals(Value.BoolValue.TRUE, eval("\"apple\" < \"banana\""));
        assertEquals(Value.BoolValue.FALSE, eval("2 > 3"));
        assertEquals("cannot apply '<' to number and string", failure("1 < \"a\"").message());
    }

    @Test
    void equality_isStructuralForPrimitivesOnly() {
        assertEquals(Value.BoolValue.TRUE, eval("1 == 1"));
        assertEquals(Value.BoolValue.TRUE, eval("\"a\" == \"a\""));
        assertEquals(Value.BoolValue.TRUE, eval("null == null"));
        assertEquals(Value.BoolValue.FALSE, eval("1 == \"1\""));
        assertEquals(Value.BoolValue.FALSE, eval("[1] == [1]"));
        assertEquals(Value.BoolValue.TRUE, eval("let a = [1]\na == a"));
        assertEquals(Value.BoolValue.TRUE, eval("1 != null"));
    }

    @Test
    void logicalOperators_shortCircuit() {
        assertEquals(Value.BoolValue.FALSE, eval("false && missing"));
        assertEquals(Value.BoolValue.TRUE, eval("true || missing"));
        assertEquals(Value.BoolValue.TRUE, eval("true && !false"));
    }

    @Test
    void logicalOperators_requireBools() {
        assertEquals("'&&' expects a bool but got number", failure("1 && true").message());
        assertEquals("'||' expects a bool but got string", failure("false || \"x\"").message());
    }

    // === Bindings and scopes ===

    @Test
    void bindings_flowBetweenStatements() {
        assertEquals("6", display("let a = 3\nlet b = a * 2\nb"));
    }

    @Test
    void rebinding_overwritesInSameScope() {
        assertEquals("2", display("let a = 1\nlet a = 2\na"));
    }

    @Test
    void blockBinding_shadowsOnlyInsideBlock() {
        assertEquals("[2, 1]", display("let x = 1\nlet inner = { let x = 2\n x }\n[inner, x]"));
    }

    @Test
    void undefinedVariable_namesTheVariable() {
        var error = failure("let a = 1\nmissingName + a");

        assertEquals("undefined variable: missingName", error.message());
        assertEquals(2, error.location().get().line());
    }

    @Test
    void statementValues() {
        assertEquals(Value.NullValue.INSTANCE, eval(""));
        assertEquals("5", display("let five = 5"));
        assertEquals(Value.NullValue.INSTANCE, eval("type Id = number"));
        assertEquals(Value.NullValue.INSTANCE, eval("import a from \"lib\""));
        assertEquals(Value.NullValue.INSTANCE, eval("{}"));
    }

    @Test
    void evaluation_stopsAtFirstError() {
        var result = interpreter.interpret("print(1)\nmissing\nprint(2)");

        assertTrue(result.isLeft());
        assertEquals(List.of("1"), output);
    }

    @Test
    void parseErrors_areReportedTogether() {
        LangError error = interpreter.interpret("let = 1\nlet = 2").getLeft();

        var failure = assertInstanceOf(ParseFailure.class, error);
        assertEquals(2, failure.errors().size());
    }

    // === Functions ===

    @Test
    void closures_captureTheirEnvironment() {
        assertEquals("5", display("let make = fn(n) -> fn(x) -> x + n\nlet add2 = make(2)\nadd2(3)"));
    }

    @Test
    void functionDeclaration_supportsRecursion() {
        assertEquals("120", display("fn fact(n) -> if n <= 1 then 1 else n * fact(n - 1)\nfact(5)"));
    }

    @Test
    void functionWithBlockBody() {
        assertEquals("7", display("fn f(a) {\n  let b = a + 1\n  b * 1 + 1\n}\nf(5)"));
    }

    @Test
    void wrongArgumentCount_isAnError() {
        assertEquals("function expects 1 arguments but got 2", failure("let f = fn(a) -> a\nf(1, 2)").message());
    }

    @Test
    void callingANonFunction_isAnError() {
        assertEquals("cannot call a value of type number", failure("let n = 1\nn(2)").message());
    }

    @Test
    void unboundedRecursion_isReportedAsError() {
        assertEquals("maximum call depth exceeded", failure("fn loop(n) -> loop(n + 1)\nloop(0)").message());
    }

    @Test
    void functionsDisplayTheirParameters() {
        assertEquals("<fn(a, b)>", display("fn (a, b) -> a"));
        assertEquals("<builtin print>", display("print"));
    }

    // === Conditionals ===

    @Test
    void conditionals() {
        assertEquals("yes", display("if 1 < 2 then \"yes\" else \"no\""));
        assertEquals(Value.NullValue.INSTANCE, eval("if false then 1"));
        assertEquals("'if' expects a bool but got number", failure("if 1 then 2").message());
    }

    // === Collections ===

    @Test
    void indexing_arraysAndStrings() {
        assertEquals("20", display("[10, 20][1]"));
        assertEquals("b", display("\"abc\"[1]"));
    }

    @Test
    void indexing_rejectsBadIndexes() {
        assertEquals("index 5 out of bounds for length 1", failure("[1][5]").message());
        assertEquals("index -1 out of bounds for length 1", failure("[1][-1]").message());
        assertEquals("index must be an integer but got 0.5", failure("[1][0.5]").message());
        assertEquals("index must be a number but got string", failure("[1][\"a\"]").message());
        assertEquals("cannot index a value of type number", failure("let n = 1\nn[0]").message());
    }

    @Test
    void records_keepFieldOrderAndSupportAccess() {
        assertEquals("{ b: 1, a: [2] }", display("{ b: 1, a: [2] }"));
        assertEquals("2", display("let r = { a: 1, b: 2 }\nr.b"));
        assertEquals("x", display("let r = { type: \"x\" }\nr.type"));
        assertEquals("{ quoted key: 1 }", display("{ \"quoted key\": 1 }"));
    }

    @Test
    void nestedRecord_withAdjacentClosingBraces() {
        assertEquals("1", display("let r = {a: {b: 1}}\nr.a.b"));
    }

    @Test
    void nestedBlocks_withAdjacentClosingBraces() {
        assertEquals("2", display("let f = fn (x) { if x then { 1 } else { 2 }}\nf(false)"));
        assertEquals("3", display("{ { 3 }}"));
    }

    @Test
    void fieldAccess_errors() {
        assertEquals("record has no field 'c'", failure("let r = { a: 1 }\nr.c").message());
        assertEquals("cannot access field 'x' on number", failure("let n = 5\nn.x").message());
    }

    // === Templates ===

    @Test
    void bareInterpolation_evaluatesToString() {
        assertEquals(new Value.StringValue("4"), eval("{{ 2 + 2 }}"));
    }

    @Test
    void stringTemplate_interpolatesDisplayForms() {
        assertEquals("Hello, World!", display("let name = \"World\"\n\"Hello, {{ name }}!\""));
        assertEquals("1.5 2 null true", display("\"{{ 1.5 }} {{ 2 }} {{ null }} {{ true }}\""));
    }

    @Test
    void stringTemplate_rejectsCompoundValues() {
        assertEquals("cannot interpolate a value of type array into a string template", failure("{{ [1, 2] }}").message());
        assertTrue(failure("{{ { a: 1 } }}").message().contains("record"));
        assertTrue(failure("\"f: {{ print }}\"").message().contains("function"));
    }

    // === Pipes, match, modules ===

    @Test
    void pipe_passesLeftAsFirstArgument() {
        assertEquals("10", display("let double = fn(x) -> x * 2\n5 |> double"));
        assertEquals("3", display("[1, 2, 3] |> len"));
        assertEquals("7", display("let add = fn(a, b) -> a + b\n3 |> add(4)"));
    }

    @Test
    void match_isNotYetExecutable() {
        assertEquals("match expressions are not yet implemented", failure("match 1 with { _ -> 2 }").message());
    }

    @Test
    void module_exposesExportedNamesAsRecord() {
        var source = """
            module Geometry {
              export let two = 2
              let hidden = 3
              export fn twice(x) -> x * two
            }
            Geometry.twice(Geometry.two)
            """;

        assertEquals("4", display(source));
    }

    @Test
    void module_hidesUnexportedBindings() {
        var source = "module M {\n  let hidden = 3\n  export let shown = hidden\n}\nM.hidden";

        assertEquals("record has no field 'hidden'", failure(source).message());
        assertEquals("{ shown: 3 }", display("module M {\n  let hidden = 3\n  export let shown = hidden\n}"));
    }

    @Test
    void module_exportListRefersToBodyBindings() {
        assertEquals("{ a: 1 }", display("module M {\n  let a = 1\n  export a\n}\nM"));
        assertEquals("module M exports undefined name: nope", failure("module M { export nope }").message());
    }

    @Test
    void topLevelExport_runsItsDeclaration() {
        assertEquals("2", display("export let a = 1\na + 1"));
    }

    // === Output ===

    @Test
    void print_joinsDisplayFormsWithSpaces() {
        var result = eval("print(\"a\", 1, [true, null])");

        assertEquals(Value.NullValue.INSTANCE, result);
        assertEquals(List.of("a 1 [true, null]"), output);
    }

    @Test
    void eachInterpretation_startsWithFreshGlobals() {
        eval("let leaked = 1");

        assertEquals("undefined variable: leaked", failure("leaked").message());
    }
}
