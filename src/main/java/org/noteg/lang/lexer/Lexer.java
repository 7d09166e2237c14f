package org.noteg.lang.lexer;

import org.noteg.lang.tree.SourceLocation;
import org.noteg.lang.tree.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Lexer for NoteG source text.
 *
 * <p>Scanning is total: malformed input yields an {@link TokenKind#ERROR} token in place and
 * scanning resumes with the next character. The result always ends with exactly one
 * {@link TokenKind#EOF} token.
 *
 * <p>String literals containing {@code {{ ... }}} are split around the interpolated tokens: every
 * segment followed by {@code {{} is a {@link TokenKind#TEMPLATE_TEXT}, the segment closing the string
 * is a {@link TokenKind#TEMPLATE_END}. {@code "a {{ x }} b"} scans as
 * {@code TEMPLATE_TEXT INTERPOLATION_START IDENTIFIER INTERPOLATION_END TEMPLATE_END}.
 * Outside an interpolation, or while braces opened inside it are still open, {@code }}} is two
 * {@link TokenKind#RIGHT_BRACE} tokens, so {@code {a: {b: 1}}} nests as expected.
 */
public final class Lexer {
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private static final Map<String, TokenKind> KEYWORDS = Map.ofEntries(
        Map.entry("let", TokenKind.LET),
        Map.entry("const", TokenKind.CONST),
        Map.entry("fn", TokenKind.FN),
        Map.entry("if", TokenKind.IF),
        Map.entry("then", TokenKind.THEN),
        Map.entry("else", TokenKind.ELSE),
        Map.entry("match", TokenKind.MATCH),
        Map.entry("with", TokenKind.WITH),
        Map.entry("type", TokenKind.TYPE),
        Map.entry("module", TokenKind.MODULE),
        Map.entry("import", TokenKind.IMPORT),
        Map.entry("export", TokenKind.EXPORT),
        Map.entry("true", TokenKind.TRUE),
        Map.entry("false", TokenKind.FALSE),
        Map.entry("null", TokenKind.NULL));

    private final String input;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Interpolation> interpolations = new ArrayDeque<>();
    private int pos;
    private int line;
    private int column;

    private Lexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<Token> tokenize(String input) {
        return new Lexer(input).tokenizeAll();
    }

    public static boolean isKeyword(String word) {
        return KEYWORDS.containsKey(word);
    }

    private List<Token> tokenizeAll() {
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) {
                break;
            }
            scanToken();
        }
        tokens.add(new Token(TokenKind.EOF, "", "", SourceSpan.at(currentLocation())));
        return List.copyOf(tokens);
    }

    private void scanToken() {
        var start = currentLocation();
        char c = peek();

        if (c == '\n') {
            advance();
            emit(TokenKind.NEWLINE, start);
        } else if (isIdentifierStart(c)) {
            scanIdentifier(start);
        } else if (isDigit(c)) {
            scanNumber(start);
        } else if (c == '"') {
            advance();
            scanStringBody(start, false);
        } else if (c == '{' && peekNext() == '{') {
            advance();
            advance();
            interpolations.push(new Interpolation(false));
            emit(TokenKind.INTERPOLATION_START, start);
        } else if (c == '}' && peekNext() == '}' && closesInterpolation()) {
            advance();
            advance();
            emit(TokenKind.INTERPOLATION_END, start);
            if (interpolations.pop().insideString) {
                scanStringBody(currentLocation(), true);
            }
        } else {
            scanOperator(start);
        }
    }

    /**
     * {@code }}} ends an interpolation only when every brace opened inside it is closed; otherwise
     * it is two ordinary closing braces.
     */
    private boolean closesInterpolation() {
        return !interpolations.isEmpty() && interpolations.peek().openBraces == 0;
    }

    private void trackBrace(TokenKind kind) {
        var current = interpolations.peek();
        if (current == null) {
            return;
        }
        if (kind == TokenKind.LEFT_BRACE) {
            current.openBraces++;
        } else if (kind == TokenKind.RIGHT_BRACE && current.openBraces > 0) {
            current.openBraces--;
        }
    }

    private void scanIdentifier(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        var word = sb.toString();
        emit(KEYWORDS.getOrDefault(word, TokenKind.IDENTIFIER), start);
    }

    private void scanNumber(SourceLocation start) {
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }
        if (!isAtEnd() && peek() == '.' && isDigit(peekNext())) {
            advance();
            while (!isAtEnd() && isDigit(peek())) {
                advance();
            }
        }
        emit(TokenKind.NUMBER, start);
    }

    /**
     * Scan string contents up to the closing quote or the next {@code {{}.
     *
     * @param continuation true when resuming a string after an interpolation closed
     */
    private void scanStringBody(SourceLocation start, boolean continuation) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '{' && peekNext() == '{') {
                tokens.add(token(TokenKind.TEMPLATE_TEXT, start, sb.toString()));
                var open = currentLocation();
                advance();
                advance();
                interpolations.push(new Interpolation(true));
                emit(TokenKind.INTERPOLATION_START, open);
                return;
            }
            if (peek() == '\\' && pos + 1 < input.length()) {
                advance();
                sb.append(scanEscapeSequence());
            } else {
                sb.append(advance());
            }
        }
        if (isAtEnd()) {
            tokens.add(token(TokenKind.ERROR, start, "Unterminated string literal"));
            return;
        }
        advance();
        tokens.add(token(continuation ? TokenKind.TEMPLATE_END : TokenKind.STRING, start, sb.toString()));
    }

    private String scanEscapeSequence() {
        char c = advance();
        return switch (c) {
            case 'n' -> "\n";
            case 't' -> "\t";
            case '\\' -> "\\";
            case '"' -> "\"";
            default -> "\\" + c;
        };
    }

    private void scanOperator(SourceLocation start) {
        char c = advance();
        var kind = switch (c) {
            case '+' -> TokenKind.PLUS;
            case '*' -> TokenKind.STAR;
            case '/' -> TokenKind.SLASH;
            case '(' -> TokenKind.LEFT_PAREN;
            case ')' -> TokenKind.RIGHT_PAREN;
            case '[' -> TokenKind.LEFT_BRACKET;
            case ']' -> TokenKind.RIGHT_BRACKET;
            case '{' -> TokenKind.LEFT_BRACE;
            case '}' -> TokenKind.RIGHT_BRACE;
            case ',' -> TokenKind.COMMA;
            case '.' -> TokenKind.DOT;
            case ':' -> TokenKind.COLON;
            case '-' -> match('>') ? TokenKind.ARROW : TokenKind.MINUS;
            case '!' -> match('=') ? TokenKind.NOT_EQUAL : TokenKind.BANG;
            case '<' -> match('=') ? TokenKind.LESS_EQUAL : TokenKind.LESS;
            case '>' -> match('=') ? TokenKind.GREATER_EQUAL : TokenKind.GREATER;
            case '=' -> match('=')
                        ? TokenKind.EQUAL
                        : match('>') ? TokenKind.FAT_ARROW : TokenKind.ASSIGN;
            case '&' -> match('&') ? TokenKind.AND : TokenKind.ERROR;
            case '|' -> match('|')
                        ? TokenKind.OR
                        : match('>') ? TokenKind.PIPE : TokenKind.ERROR;
            default -> TokenKind.ERROR;
        };
        if (kind == TokenKind.ERROR) {
            tokens.add(token(TokenKind.ERROR, start, "Unexpected character: " + c));
        } else {
            trackBrace(kind);
            emit(kind, start);
        }
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r') {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private void emit(TokenKind kind, SourceLocation start) {
        var lexeme = input.substring(start.offset(), pos);
        tokens.add(new Token(kind, lexeme, lexeme, span(start)));
    }

    private Token token(TokenKind kind, SourceLocation start, String literal) {
        return new Token(kind, input.substring(start.offset(), pos), literal, span(start));
    }

    private boolean match(char expected) {
        if (isAtEnd() || peek() != expected) {
            return false;
        }
        advance();
        return true;
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static final class Interpolation {
        // true when the opening {{ was found inside a string literal
        private final boolean insideString;
        private int openBraces;

        private Interpolation(boolean insideString) {
            this.insideString = insideString;
        }
    }
}
