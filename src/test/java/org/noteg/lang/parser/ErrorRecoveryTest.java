package org.noteg.lang.parser;

import org.junit.jupiter.api.Test;
import org.noteg.lang.ast.AstPrinter;
import org.noteg.lang.error.ParseError;
import org.noteg.lang.error.ParseFailure;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for statement-level error recovery and diagnostic reporting.
 */
class ErrorRecoveryTest {

    @Test
    void malformedStatement_isReported_andParsingContinues() {
        var result = Parser.parseWithDiagnostics("let = 5\nlet y = 2\ny");

        assertEquals(1, result.errorCount());
        assertTrue(result.program().isDefined());
        // "=" is skipped, so 5 becomes a statement of its own
        assertEquals("5\nlet(y, 2)\ny", AstPrinter.print(result.program().get()));
    }

    @Test
    void malformedStatement_errorCarriesExpectationAndPosition() {
        var errors = Parser.parse("let = 5").getLeft();

        assertEquals(1, errors.size());
        var error = assertInstanceOf(ParseError.UnexpectedToken.class, errors.get(0));
        assertEquals("identifier", error.expected());
        assertEquals(1, error.position().line());
        assertEquals(5, error.position().column());
        assertTrue(error.location().isDefined());
    }

    @Test
    void collectsMultipleErrors() {
        var errors = Parser.parse("let = 1\nlet = 2\nok").getLeft();

        assertEquals(2, errors.size());
        assertEquals(1, errors.get(0).position().line());
        assertEquals(2, errors.get(1).position().line());
    }

    @Test
    void lexerErrorToken_becomesLexicalError() {
        var errors = Parser.parse("let x = @").getLeft();

        assertEquals(1, errors.size());
        var error = assertInstanceOf(ParseError.LexicalError.class, errors.get(0));
        assertEquals("Unexpected character: @", error.reason());
        assertEquals("Unexpected character: @ at 1:9", error.message());
    }

    @Test
    void unterminatedString_isReported() {
        var errors = Parser.parse("let s = \"abc").getLeft();

        var error = assertInstanceOf(ParseError.LexicalError.class, errors.get(0));
        assertEquals("Unterminated string literal", error.reason());
    }

    @Test
    void truncatedInput_isUnexpectedEnd() {
        var errors = Parser.parse("let x =").getLeft();

        assertEquals(1, errors.size());
        var error = assertInstanceOf(ParseError.UnexpectedEnd.class, errors.get(0));
        assertEquals("expression", error.expected());
        assertTrue(error.message().startsWith("Unexpected end of input"));
    }

    @Test
    void unclosedBlock_isUnexpectedEnd() {
        var errors = Parser.parse("{ 1").getLeft();

        var error = assertInstanceOf(ParseError.UnexpectedEnd.class, errors.get(0));
        assertEquals("'}'", error.expected());
    }

    @Test
    void parseFailure_joinsAllMessages() {
        var failure = new ParseFailure(Parser.parse("let = 1\nlet = 2").getLeft());

        var lines = failure.message().split("\n");
        assertEquals(2, lines.length);
        assertTrue(lines[0].contains("1:5"));
        assertTrue(lines[1].contains("2:5"));
        assertEquals(1, failure.location().get().line());
    }

    @Test
    void validSource_hasNoDiagnostics() {
        var result = Parser.parseWithDiagnostics("let x = 1");

        assertTrue(result.isSuccess());
        assertFalse(result.hasErrors());
        assertEquals("", result.formatDiagnostics());
    }

    @Test
    void diagnostics_formatAgainstSource() {
        var result = Parser.parseWithDiagnostics("let x = @");
        var formatted = result.formatDiagnostics("main.ng");

        assertTrue(formatted.contains("error: Unexpected character: @ at 1:9"));
        assertTrue(formatted.contains("--> main.ng:1:9"));
        assertTrue(formatted.contains("1 | let x = @"));
        assertTrue(formatted.contains("^ Unexpected character: @"));
    }

    @Test
    void onlyErrors_yieldNoPartialProgram() {
        var result = Parser.parseWithDiagnostics("@");

        assertTrue(result.hasErrors());
        assertTrue(result.program().isEmpty());
    }
}
