package org.noteg.lang.parser;

import org.junit.jupiter.api.Test;
import org.noteg.lang.ast.AstPrinter;
import org.noteg.lang.ast.Expr;
import org.noteg.lang.ast.Stmt;

import static org.assertj.core.api.Assertions.assertThat;

class ParserTest {

    private static String print(String source) {
        var result = Parser.parse(source);
        assertThat(result.isRight())
            .describedAs("parse errors: %s", result.isLeft() ? result.getLeft() : "")
            .isTrue();
        return AstPrinter.print(result.get());
    }

    @Test
    void multiplicationBindsTighterThanAddition() {
        assertThat(print("1 + 2 * 3")).isEqualTo("binary(+, 1, binary(*, 2, 3))");
    }

    @Test
    void sameLevelOperatorsAreRightAssociative() {
        assertThat(print("8 - 4 - 2")).isEqualTo("binary(-, 8, binary(-, 4, 2))");
        assertThat(print("8 / 4 / 2")).isEqualTo("binary(/, 8, binary(/, 4, 2))");
    }

    @Test
    void parenthesesOverrideAssociativity() {
        assertThat(print("(8 - 4) - 2")).isEqualTo("binary(-, binary(-, 8, 4), 2)");
    }

    @Test
    void logicalAndBindsTighterThanOr() {
        assertThat(print("a || b && c")).isEqualTo("binary(||, a, binary(&&, b, c))");
    }

    @Test
    void comparisonBindsTighterThanEquality() {
        assertThat(print("a < b == c >= d")).isEqualTo("binary(==, binary(<, a, b), binary(>=, c, d))");
    }

    @Test
    void unaryBindsTighterThanMultiplication() {
        assertThat(print("-x * 2")).isEqualTo("binary(*, unary(-, x), 2)");
        assertThat(print("!!ok")).isEqualTo("unary(!, unary(!, ok))");
    }

    @Test
    void postfixOperatorsChain() {
        assertThat(print("f(1)(2).name[0]")).isEqualTo("index(field(call(call(f, 1), 2), name), 0)");
    }

    @Test
    void fieldNamesMayBeKeywords() {
        assertThat(print("config.type")).isEqualTo("field(config, type)");
    }

    @Test
    void typeWithoutNameIsTheBuiltin() {
        assertThat(print("type(42)")).isEqualTo("call(type, 42)");
    }

    @Test
    void bindingsAndSeparateStatements() {
        assertThat(print("let x = 1\nconst y = 2\n\nx")).isEqualTo("let(x, 1)\nconst(y, 2)\nx");
    }

    @Test
    void bindingValueMayStartOnNextLine() {
        assertThat(print("let x =\n  1 +\n  2")).isEqualTo("let(x, binary(+, 1, 2))");
    }

    @Test
    void functionDeclarationIsSugarForLetLambda() {
        assertThat(print("fn add(a, b) -> a + b")).isEqualTo("let(add, fn([a, b], binary(+, a, b)))");
    }

    @Test
    void lambdaForms() {
        assertThat(print("fn (x) => x")).isEqualTo("fn([x], x)");
        assertThat(print("fn () -> 1")).isEqualTo("fn([], 1)");
        assertThat(print("fn (x) { x }")).isEqualTo("fn([x], block(x))");
    }

    @Test
    void emptyBracesAreAnEmptyBlock() {
        assertThat(print("{}")).isEqualTo("block()");
    }

    @Test
    void bracesWithNameColonAreARecord() {
        assertThat(print("{ a: 1, \"b c\": 2 }")).isEqualTo("record(a: 1, b c: 2)");
        assertThat(print("{\n  a: 1,\n  b: 2\n}")).isEqualTo("record(a: 1, b: 2)");
    }

    @Test
    void bracesWithStatementsAreABlock() {
        assertThat(print("{ let a = 1\n a }")).isEqualTo("block(let(a, 1), a)");
    }

    @Test
    void arrays() {
        assertThat(print("[1, \"two\", [3]]")).isEqualTo("array(1, \"two\", array(3))");
        assertThat(print("[]")).isEqualTo("array()");
    }

    @Test
    void literals() {
        assertThat(print("true")).isEqualTo("true");
        assertThat(print("null")).isEqualTo("null");
        assertThat(print("2.5")).isEqualTo("2.5");
    }

    @Test
    void conditionals() {
        assertThat(print("if x then 1 else 2")).isEqualTo("if(x, 1, 2)");
        assertThat(print("if x then 1")).isEqualTo("if(x, 1)");
        assertThat(print("if x then 1\nelse 2")).isEqualTo("if(x, 1, 2)");
        assertThat(print("if x { 1 } else { 2 }")).isEqualTo("if(x, block(1), block(2))");
    }

    @Test
    void conditionalWithoutElseLeavesFollowingStatementAlone() {
        assertThat(print("if x then 1\ny")).isEqualTo("if(x, 1)\ny");
    }

    @Test
    void matchExpression() {
        assertThat(print("match x with { 0 -> \"zero\", [a, _] -> a, { name } -> name, _ -> null }"))
            .isEqualTo("match(x, arm(0, \"zero\"), arm([a, _], a), arm({name: name}, name), arm(_, null))");
    }

    @Test
    void typeDeclaration() {
        assertThat(print("type Point = { x: number, y: number }")).isEqualTo("type(Point, { x: number, y: number })");
        assertThat(print("type Mapper = (number) -> [string]")).isEqualTo("type(Mapper, (number) -> [string])");
        assertThat(print("type Box = Option<number>")).isEqualTo("type(Box, Option<number>)");
    }

    @Test
    void moduleImportAndExport() {
        assertThat(print("module M {\n  export let a = 1\n  let b = 2\n}"))
            .isEqualTo("module(M, export([a], let(a, 1)), let(b, 2))");
        assertThat(print("import a, b from \"lib\"")).isEqualTo("import([a, b], \"lib\")");
        assertThat(print("export a, b")).isEqualTo("export([a, b])");
    }

    @Test
    void stringTemplate() {
        assertThat(print("\"hi {{ name }}!\"")).isEqualTo("template(\"hi \", name, \"!\")");
        assertThat(print("{{ 2 + 2 }}")).isEqualTo("template(binary(+, 2, 2))");
    }

    @Test
    void pipeIsDesugaredIntoCall() {
        assertThat(print("x |> f(1)")).isEqualTo("call(f, x, 1)");
        assertThat(print("x |> f")).isEqualTo("call(f, x)");
    }

    @Test
    void pipeIsRightAssociative() {
        assertThat(print("a |> f() |> g()")).isEqualTo("call(g, a, call(f))");
    }

    @Test
    void parseSyntaxKeepsPipes() {
        var program = Parser.parseSyntax("x |> f(1)").get();

        assertThat(AstPrinter.print(program)).isEqualTo("pipe(x, call(f, 1))");
    }

    @Test
    void pipeHasLowestPrecedence() {
        assertThat(print("1 + 2 |> f")).isEqualTo("call(f, binary(+, 1, 2))");
    }

    @Test
    void spansCoverTheStatement() {
        var program = Parser.parse("let total = 1 + 2").get();
        var let = (Stmt.Let) program.statements().get(0);
        var binary = (Expr.Binary) let.value();

        assertThat(let.span().start().column()).isEqualTo(1);
        assertThat(let.span().end().column()).isEqualTo(18);
        assertThat(binary.span().start().column()).isEqualTo(13);
    }
}
