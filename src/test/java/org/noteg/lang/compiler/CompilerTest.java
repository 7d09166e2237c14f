package org.noteg.lang.compiler;

import org.junit.jupiter.api.Test;
import org.noteg.lang.interpreter.Builtins;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CompilerTest {

    private static final int PROLOGUE_LINES = 2 + Builtins.NAMES.size();

    private static List<String> lines(String source) {
        return lines(source, CompilerOptions.DEFAULT);
    }

    private static List<String> lines(String source, CompilerOptions options) {
        var result = Compiler.create(options).compile(source);
        assertTrue(result.isRight(), () -> "compile failed: " + result.getLeft());
        return Arrays.asList(result.get().split("\n"));
    }

    /**
     * The lines generated for the program's own statements.
     */
    private static List<String> body(String source) {
        var all = lines(source);
        return all.subList(PROLOGUE_LINES, all.size());
    }

    private static String single(String source) {
        var statements = body(source);
        assertEquals(1, statements.size(), () -> "expected one statement line but got " + statements);
        return statements.get(0);
    }

    // === Prologue ===

    @Test
    void header_namesProfile_andEnablesStrictMode() {
        var output = lines("1");

        assertEquals("// Generated by noteg-lang (profile: es2022)", output.get(0));
        assertEquals("\"use strict\";", output.get(1));
    }

    @Test
    void header_withoutStrict_omitsDirective() {
        var options = CompilerOptions.builder().strict(false).emissionProfile("es5").build();
        var output = lines("1", options);

        assertEquals("// Generated by noteg-lang (profile: es5)", output.get(0));
        assertThat(output).doesNotContain("\"use strict\";");
        assertThat(output.get(1)).startsWith("function $$print(");
    }

    @Test
    void preamble_definesEveryBuiltinOnItsOwnLine() {
        var output = lines("1");

        assertThat(output.subList(2, PROLOGUE_LINES))
            .hasSize(5)
            .anySatisfy(line -> assertThat(line).startsWith("function $$print("))
            .anySatisfy(line -> assertThat(line).startsWith("function $$len("))
            .anySatisfy(line -> assertThat(line).startsWith("function $$str("))
            .anySatisfy(line -> assertThat(line).startsWith("function $$num("))
            .anySatisfy(line -> assertThat(line).startsWith("function $$type("));
    }

    @Test
    void preamble_reachesGlobalsOnlyThroughGlobalThis() {
        var output = lines("1");

        assertThat(output.subList(2, PROLOGUE_LINES))
            .allSatisfy(line -> assertThat(line).doesNotContainPattern("(?<!globalThis\\.)\\b(console|String|Number|Array|Object|Error)\\b"))
            .anySatisfy(line -> assertThat(line).contains("globalThis.console.log("));
    }

    @Test
    void minifyAndSourceMap_leaveOutputUnchanged() {
        var plain = Compiler.create().compile("let x = [1, 2]").get();
        var options = CompilerOptions.builder().minify(true).sourceMap(true).build();

        assertEquals(plain, Compiler.create(options).compile("let x = [1, 2]").get());
    }

    // === Statements ===

    @Test
    void eachTopLevelStatement_producesOneLine() {
        var statements = body("let a = {\n  let t = 1\n  t + 1\n}\nprint(a)\n\nconst b = 2");

        assertEquals(3, statements.size());
        assertEquals("$$print(a);", statements.get(1));
        assertEquals("const b = 2;", statements.get(2));
    }

    @Test
    void letAndConst_declareBindings() {
        assertEquals("let x = (1 + 2);", single("let x = 1 + 2"));
        assertEquals("const y = 2;", single("const y = 2"));
    }

    @Test
    void rebinding_assignsInsteadOfRedeclaring() {
        assertEquals(List.of("let a = 1;", "a = 2;"), body("let a = 1\nlet a = 2"));
    }

    @Test
    void constBoundTwice_isDeclaredWithLet() {
        assertEquals(List.of("let c = 1;", "c = 2;"), body("const c = 1\nconst c = 2"));
    }

    @Test
    void builtinCall_usesHelper() {
        assertEquals("$$print($$len(xs));", single("print(len(xs))"));
        assertEquals("$$str;", single("str"));
    }

    @Test
    void bindingBuiltinName_declaresFreshBinding() {
        assertEquals("let print = 1;", single("let print = 1"));
        assertEquals(List.of("let str = 5;", "$$print(\"hi\");"), body("let str = 5\nprint(\"hi\")"));
        assertEquals(List.of("let str = $$str(1);", "str;"), body("let str = str(1)\nstr"));
    }

    @Test
    void builtinBoundLater_isReferencedByName() {
        assertEquals(List.of("let f = (() => str(1));", "let str = ((x) => x);"),
                     body("let f = fn() -> str(1)\nlet str = fn(x) -> x"));
    }

    @Test
    void bindingGlobalName_leavesHelpersIntact() {
        assertEquals(List.of("let String = 1;", "$$print(String);"), body("let String = 1\nprint(String)"));
        assertEquals("let $globalThis = 1;", single("let globalThis = 1"));
    }

    @Test
    void shadowingInBlock_renamesInnerBinding() {
        assertEquals(List.of("let x = 1;", "let y = (() => { let x$1 = (x + 1); return x$1; })();"),
                     body("let x = 1\nlet y = { let x = x + 1\n x }"));
    }

    @Test
    void shadowingInBlock_rebindingKeepsRenamedName() {
        assertEquals(List.of("let x = 1;", "(() => { let x$1 = (x + 1); x$1 = (x$1 * 2); return x$1; })();"),
                     body("let x = 1\n{ let x = x + 1\n let x = x * 2\n x }"));
    }

    @Test
    void shadowingParameter_renamesBlockBinding() {
        assertEquals("let f = ((n) => (() => { let n$1 = (n + 1); return n$1; })());",
                     single("let f = fn(n) -> { let n = n + 1\n n }"));
    }

    @Test
    void shadowingLambda_seesItsOwnName() {
        assertEquals(List.of("let f = 1;", "(() => { let f$1 = ((n) => f$1(n)); return f$1; })();"),
                     body("let f = 1\n{ let f = fn(n) -> f(n) }"));
    }

    @Test
    void distinctShadows_getDistinctSuffixes() {
        assertEquals(List.of("let x = 1;", "[(() => { let x$1 = 2; return x$1; })(), (() => { let x$2 = 3; return x$2; })()];"),
                     body("let x = 1\n[{ let x = 2 }, { let x = 3 }]"));
    }

    @Test
    void reservedWords_areEscaped() {
        assertEquals(List.of("let $class = 1;", "($class + 1);"), body("let class = 1\nclass + 1"));
        assertEquals("(($new) => $new);", single("fn (new) -> new"));
        assertEquals("r.$class;", single("r.class"));
    }

    @Test
    void typeDeclaration_becomesComment() {
        assertEquals("// type Point = { x: number, y: number }", single("type Point = { x: number, y: number }"));
    }

    @Test
    void import_becomesComment() {
        assertEquals("// import a, b from \"lib\"", single("import a, b from \"lib\""));
    }

    @Test
    void export_annotatesDeclaration() {
        assertEquals("let a = 1; // export a", single("export let a = 1"));
        assertEquals("// export a, b", single("export a, b"));
    }

    @Test
    void module_becomesRecordOfExports() {
        assertEquals("const M = (() => { let a = 1; /* export a */ let b = 2; return { a }; })();",
                     single("module M {\n  export let a = 1\n  let b = 2\n}"));
    }

    @Test
    void module_exportOfShadowingBinding_mapsField() {
        assertEquals(List.of("let a = 1;", "const M = (() => { let a$1 = 2; /* export a */ return { a: a$1 }; })();"),
                     body("let a = 1\nmodule M {\n  export let a = 2\n}"));
    }

    @Test
    void module_withoutExports_returnsEmptyObject() {
        assertEquals("const M = (() => { let b = 2; return {}; })();", single("module M {\n  let b = 2\n}"));
    }

    // === Expressions ===

    @Test
    void equality_usesStrictOperators() {
        assertEquals("(a === b);", single("a == b"));
        assertEquals("(a !== b);", single("a != b"));
    }

    @Test
    void binaryAndUnary_areParenthesized() {
        assertEquals("(1 + (2 * 3));", single("1 + 2 * 3"));
        assertEquals("((-x) * 2);", single("-x * 2"));
        assertEquals("(!ok);", single("!ok"));
        assertEquals("(a || (b && c));", single("a || b && c"));
    }

    @Test
    void literals() {
        assertEquals("10;", single("10"));
        assertEquals("1.5;", single("1.5"));
        assertEquals("true;", single("true"));
        assertEquals("null;", single("null"));
        assertEquals("\"line\\nbreak \\\"q\\\"\";", single("\"line\\nbreak \\\"q\\\"\""));
    }

    @Test
    void conditional_becomesTernary() {
        assertEquals("(a ? 1 : 2);", single("if a then 1 else 2"));
        assertEquals("(a ? 1 : null);", single("if a then 1"));
    }

    @Test
    void lambda_becomesArrowFunction() {
        assertEquals("let f = ((a, b) => (a + b));", single("let f = fn(a, b) -> a + b"));
        assertEquals("let add = ((a, b) => (a + b));", single("fn add(a, b) -> a + b"));
    }

    @Test
    void lambdaCallee_isWrapped() {
        assertEquals("(((x) => x))(1);", single("(fn (x) -> x)(1)"));
    }

    @Test
    void block_becomesImmediatelyInvokedFunction() {
        assertEquals("let v = (() => { let t = 1; return (t + 1); })();", single("let v = { let t = 1\n t + 1 }"));
        assertEquals("(() => { return null; })();", single("{}"));
        assertEquals("(() => { let t = 1; return t; })();", single("{ let t = 1 }"));
    }

    @Test
    void arraysAndRecords() {
        assertEquals("[1, \"a\"];", single("[1, \"a\"]"));
        assertEquals("({ a: 1, \"b c\": 2 });", single("{ a: 1, \"b c\": 2 }"));
        assertEquals("({ $class: 1 });", single("{ class: 1 }"));
    }

    @Test
    void postfixChain_keepsOrder() {
        assertEquals("a.b[0](1);", single("a.b[0](1)"));
    }

    @Test
    void pipe_isDesugaredBeforeGeneration() {
        assertEquals("f(x, 1);", single("x |> f(1)"));
    }

    @Test
    void template_becomesTemplateLiteral() {
        assertEquals("`Hi ${name}!`;", single("\"Hi {{ name }}!\""));
        assertEquals("`a\\`b ${x}`;", single("\"a`b {{ x }}\""));
    }

    @Test
    void match_emitsPlaceholder() {
        assertEquals("/* unimplemented: match */ null;", single("match x with { _ -> 1 }"));
    }

    // === Failures ===

    @Test
    void parseErrors_areReportedTogether() {
        var result = Compiler.create().compile("let = 1\nlet = 2");

        assertTrue(result.isLeft());
        assertThat(result.getLeft().errors()).hasSize(2);
    }
}
