package org.noteg.lang.parser;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.noteg.lang.ast.BinaryOperator;
import org.noteg.lang.ast.Expr;
import org.noteg.lang.ast.Pattern;
import org.noteg.lang.ast.Program;
import org.noteg.lang.ast.Stmt;
import org.noteg.lang.ast.TypeExpr;
import org.noteg.lang.ast.UnaryOperator;
import org.noteg.lang.error.Diagnostic;
import org.noteg.lang.error.ParseError;
import org.noteg.lang.lexer.Lexer;
import org.noteg.lang.lexer.Token;
import org.noteg.lang.lexer.TokenKind;
import org.noteg.lang.tree.SourceLocation;
import org.noteg.lang.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Recursive-descent parser for NoteG.
 *
 * <p>Binary operators are right-associative at every precedence level: {@code a - b - c}
 * parses as {@code a - (b - c)}. When a statement fails to parse, the error is recorded, the
 * offending token is discarded and parsing resumes with the next statement, so one pass
 * reports every independent error.
 */
public final class Parser {
    private static final String FROM = "from";

    private final List<Token> tokens;
    private final List<ParseError> errors = new ArrayList<>();
    private int pos;

    private Parser(List<Token> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parse source text and desugar pipes. The returned program contains no {@link Expr.Pipe}.
     */
    public static Either<List<ParseError>, Program> parse(String source) {
        return parseSyntax(source).map(program -> PipeDesugarer.desugar(program));
    }

    /**
     * Parse source text into the tree exactly as written, pipes included.
     */
    public static Either<List<ParseError>, Program> parseSyntax(String source) {
        var parser = new Parser(Lexer.tokenize(source));
        var program = parser.parseProgram();
        return parser.errors.isEmpty()
               ? Either.right(program)
               : Either.left(List.copyOf(parser.errors));
    }

    /**
     * Parse with recovery, returning whatever statements parsed along with rich diagnostics.
     */
    public static ParseResultWithDiagnostics parseWithDiagnostics(String source) {
        var parser = new Parser(Lexer.tokenize(source));
        var program = PipeDesugarer.desugar(parser.parseProgram());
        if (parser.errors.isEmpty()) {
            return ParseResultWithDiagnostics.success(program, source);
        }
        var diagnostics = parser.errors.stream()
                                       .map(error -> Diagnostic.of(error, parser.spanAt(error.position())))
                                       .toList();
        var partial = program.statements().isEmpty() ? Option.<Program>none() : Option.some(program);
        return ParseResultWithDiagnostics.withErrors(partial, diagnostics, source);
    }

    private Program parseProgram() {
        var statements = new ArrayList<Stmt>();
        while (true) {
            skipNewlines();
            if (isAtEnd()) {
                break;
            }
            var result = parseStatement();
            if (result.isRight()) {
                statements.add(result.get());
            } else {
                errors.add(result.getLeft());
                advance();
            }
        }
        return new Program(statements);
    }

    // === Statements ===

    private Either<ParseError, Stmt> parseStatement() {
        var start = peek().start();
        return switch (peek().kind()) {
            case LET, CONST -> parseBinding(start);
            case FN -> peekAt(1).is(TokenKind.IDENTIFIER)
                       ? parseFunctionDeclaration(start)
                       : parseExpressionStatement(start);
            case TYPE -> peekAt(1).is(TokenKind.IDENTIFIER)
                         ? parseTypeDeclaration(start)
                         : parseExpressionStatement(start);
            case MODULE -> parseModule(start);
            case IMPORT -> parseImport(start);
            case EXPORT -> parseExport(start);
            default -> parseExpressionStatement(start);
        };
    }

    private Either<ParseError, Stmt> parseBinding(SourceLocation start) {
        var keyword = advance();
        var name = expect(TokenKind.IDENTIFIER, "identifier");
        if (name.isLeft()) {
            return fail(name);
        }
        var assign = expect(TokenKind.ASSIGN, "'='");
        if (assign.isLeft()) {
            return fail(assign);
        }
        skipNewlines();
        var value = parseExpression();
        if (value.isLeft()) {
            return fail(value);
        }
        var span = span(start);
        return Either.right(keyword.is(TokenKind.LET)
                            ? new Stmt.Let(span, name.get().lexeme(), value.get())
                            : new Stmt.Const(span, name.get().lexeme(), value.get()));
    }

    private Either<ParseError, Stmt> parseFunctionDeclaration(SourceLocation start) {
        advance();
        var name = advance();
        var lambda = parseLambdaRest(start);
        if (lambda.isLeft()) {
            return fail(lambda);
        }
        return Either.right(new Stmt.Let(span(start), name.lexeme(), lambda.get()));
    }

    private Either<ParseError, Stmt> parseTypeDeclaration(SourceLocation start) {
        advance();
        var name = expect(TokenKind.IDENTIFIER, "type name");
        if (name.isLeft()) {
            return fail(name);
        }
        var assign = expect(TokenKind.ASSIGN, "'='");
        if (assign.isLeft()) {
            return fail(assign);
        }
        skipNewlines();
        var type = parseType();
        if (type.isLeft()) {
            return fail(type);
        }
        return Either.right(new Stmt.TypeDeclaration(span(start), name.get().lexeme(), type.get()));
    }

    private Either<ParseError, Stmt> parseModule(SourceLocation start) {
        advance();
        var name = expect(TokenKind.IDENTIFIER, "module name");
        if (name.isLeft()) {
            return fail(name);
        }
        skipNewlines();
        var open = expect(TokenKind.LEFT_BRACE, "'{'");
        if (open.isLeft()) {
            return fail(open);
        }
        var body = parseStatementsUntilBrace();
        if (body.isLeft()) {
            return fail(body);
        }
        return Either.right(new Stmt.ModuleDeclaration(span(start), name.get().lexeme(), body.get()));
    }

    private Either<ParseError, Stmt> parseImport(SourceLocation start) {
        advance();
        var names = new ArrayList<String>();
        if (!check(TokenKind.STRING)) {
            do {
                var name = expect(TokenKind.IDENTIFIER, "imported name");
                if (name.isLeft()) {
                    return fail(name);
                }
                names.add(name.get().lexeme());
            } while (match(TokenKind.COMMA));

            if (!(check(TokenKind.IDENTIFIER) && peek().lexeme().equals(FROM))) {
                return Either.left(unexpected("'from'"));
            }
            advance();
        }
        var source = expect(TokenKind.STRING, "module path string");
        if (source.isLeft()) {
            return fail(source);
        }
        return Either.right(new Stmt.ImportDeclaration(span(start), names, source.get().literal()));
    }

    private Either<ParseError, Stmt> parseExport(SourceLocation start) {
        advance();
        if (check(TokenKind.LET) || check(TokenKind.CONST) || check(TokenKind.FN)) {
            var declaration = parseStatement();
            if (declaration.isLeft()) {
                return declaration;
            }
            var names = Stmt.boundName(declaration.get()).toJavaList();
            return Either.right(new Stmt.ExportDeclaration(span(start), names, Option.some(declaration.get())));
        }
        var names = new ArrayList<String>();
        do {
            var name = expect(TokenKind.IDENTIFIER, "exported name or declaration");
            if (name.isLeft()) {
                return fail(name);
            }
            names.add(name.get().lexeme());
        } while (match(TokenKind.COMMA));
        return Either.right(new Stmt.ExportDeclaration(span(start), names, Option.none()));
    }

    private Either<ParseError, Stmt> parseExpressionStatement(SourceLocation start) {
        var expression = parseExpression();
        if (expression.isLeft()) {
            return fail(expression);
        }
        return Either.right(new Stmt.ExpressionStatement(span(start), expression.get()));
    }

    /**
     * Statements up to and including the closing brace. The opening brace is already consumed.
     */
    private Either<ParseError, List<Stmt>> parseStatementsUntilBrace() {
        var statements = new ArrayList<Stmt>();
        while (true) {
            skipNewlines();
            if (match(TokenKind.RIGHT_BRACE)) {
                return Either.right(statements);
            }
            if (isAtEnd()) {
                return Either.left(unexpected("'}'"));
            }
            var statement = parseStatement();
            if (statement.isLeft()) {
                return fail(statement);
            }
            statements.add(statement.get());
        }
    }

    // === Expressions ===

    private Either<ParseError, Expr> parseExpression() {
        return parsePipe();
    }

    private Either<ParseError, Expr> parsePipe() {
        var left = parseOr();
        if (left.isLeft() || !match(TokenKind.PIPE)) {
            return left;
        }
        skipNewlines();
        return parsePipe().map(right -> new Expr.Pipe(left.get().span().merge(right.span()), left.get(), right));
    }

    private Either<ParseError, Expr> parseOr() {
        return rightAssociative(this::parseAnd, this::parseOr, TokenKind.OR);
    }

    private Either<ParseError, Expr> parseAnd() {
        return rightAssociative(this::parseEquality, this::parseAnd, TokenKind.AND);
    }

    private Either<ParseError, Expr> parseEquality() {
        return rightAssociative(this::parseComparison, this::parseEquality, TokenKind.EQUAL, TokenKind.NOT_EQUAL);
    }

    private Either<ParseError, Expr> parseComparison() {
        return rightAssociative(this::parseAdditive,
                                this::parseComparison,
                                TokenKind.LESS,
                                TokenKind.LESS_EQUAL,
                                TokenKind.GREATER,
                                TokenKind.GREATER_EQUAL);
    }

    private Either<ParseError, Expr> parseAdditive() {
        return rightAssociative(this::parseMultiplicative, this::parseAdditive, TokenKind.PLUS, TokenKind.MINUS);
    }

    private Either<ParseError, Expr> parseMultiplicative() {
        return rightAssociative(this::parseUnary, this::parseMultiplicative, TokenKind.STAR, TokenKind.SLASH);
    }

    /**
     * One precedence level: {@code operand (op sameLevel)?}. Recursing into the same level on the
     * right is what makes the level right-associative.
     */
    private Either<ParseError, Expr> rightAssociative(Supplier<Either<ParseError, Expr>> operand,
                                                      Supplier<Either<ParseError, Expr>> sameLevel,
                                                      TokenKind... operators) {
        var left = operand.get();
        if (left.isLeft() || !checkAny(operators)) {
            return left;
        }
        var operator = BinaryOperator.fromToken(advance().kind());
        skipNewlines();
        return sameLevel.get()
                        .map(right -> new Expr.Binary(left.get().span().merge(right.span()),
                                                      left.get(),
                                                      operator,
                                                      right));
    }

    private Either<ParseError, Expr> parseUnary() {
        if (check(TokenKind.BANG) || check(TokenKind.MINUS)) {
            var start = peek().start();
            var operator = advance().is(TokenKind.BANG) ? UnaryOperator.NOT : UnaryOperator.NEGATE;
            var operand = parseUnary();
            if (operand.isLeft()) {
                return operand;
            }
            return Either.right(new Expr.Unary(span(start), operator, operand.get()));
        }
        return parsePostfix();
    }

    private Either<ParseError, Expr> parsePostfix() {
        var start = peek().start();
        var result = parsePrimary();
        if (result.isLeft()) {
            return result;
        }
        var expr = result.get();
        while (true) {
            if (match(TokenKind.LEFT_PAREN)) {
                var arguments = parseExpressionList(TokenKind.RIGHT_PAREN, "')'");
                if (arguments.isLeft()) {
                    return fail(arguments);
                }
                expr = new Expr.Call(span(start), expr, arguments.get());
            } else if (match(TokenKind.DOT)) {
                if (!isFieldName(peek())) {
                    return Either.left(unexpected("field name"));
                }
                expr = new Expr.Field(span(start), expr, advance().lexeme());
            } else if (match(TokenKind.LEFT_BRACKET)) {
                skipNewlines();
                var index = parseExpression();
                if (index.isLeft()) {
                    return index;
                }
                skipNewlines();
                var close = expect(TokenKind.RIGHT_BRACKET, "']'");
                if (close.isLeft()) {
                    return fail(close);
                }
                expr = new Expr.Index(span(start), expr, index.get());
            } else {
                return Either.right(expr);
            }
        }
    }

    private Either<ParseError, Expr> parsePrimary() {
        var token = peek();
        var start = token.start();
        switch (token.kind()) {
            case NUMBER -> {
                advance();
                return Either.right(new Expr.Literal(token.span(), Double.parseDouble(token.lexeme())));
            }
            case STRING -> {
                advance();
                return Either.right(new Expr.Literal(token.span(), token.literal()));
            }
            case TRUE, FALSE -> {
                advance();
                return Either.right(new Expr.Literal(token.span(), token.is(TokenKind.TRUE)));
            }
            case NULL -> {
                advance();
                return Either.right(new Expr.Literal(token.span(), null));
            }
            case IDENTIFIER, TYPE -> {
                // outside a declaration, type names the builtin
                advance();
                return Either.right(new Expr.Identifier(token.span(), token.lexeme()));
            }
            case TEMPLATE_TEXT -> {
                return parseTemplate(start);
            }
            case INTERPOLATION_START -> {
                return parseBareInterpolation(start);
            }
            case LEFT_PAREN -> {
                advance();
                skipNewlines();
                var inner = parseExpression();
                if (inner.isLeft()) {
                    return inner;
                }
                skipNewlines();
                var close = expect(TokenKind.RIGHT_PAREN, "')'");
                return close.isLeft() ? fail(close) : inner;
            }
            case LEFT_BRACKET -> {
                advance();
                var elements = parseExpressionList(TokenKind.RIGHT_BRACKET, "']'");
                if (elements.isLeft()) {
                    return fail(elements);
                }
                return Either.right(new Expr.ArrayLiteral(span(start), elements.get()));
            }
            case LEFT_BRACE -> {
                return isRecordStart() ? parseRecord(start) : parseBlock(start);
            }
            case FN -> {
                advance();
                return parseLambdaRest(start);
            }
            case IF -> {
                return parseConditional(start);
            }
            case MATCH -> {
                return parseMatch(start);
            }
            default -> {
                return Either.left(unexpected("expression"));
            }
        }
    }

    private Either<ParseError, Expr> parseTemplate(SourceLocation start) {
        var parts = new ArrayList<Expr.TemplatePart>();
        parts.add(new Expr.TemplatePart.Text(advance().literal()));
        while (true) {
            var open = expect(TokenKind.INTERPOLATION_START, "'{{'");
            if (open.isLeft()) {
                return fail(open);
            }
            var embedded = parseInterpolatedExpression();
            if (embedded.isLeft()) {
                return embedded;
            }
            parts.add(new Expr.TemplatePart.Embedded(embedded.get()));
            var segment = peek();
            if (segment.is(TokenKind.TEMPLATE_END)) {
                advance();
                parts.add(new Expr.TemplatePart.Text(segment.literal()));
                return Either.right(new Expr.Template(span(start), parts));
            }
            if (!segment.is(TokenKind.TEMPLATE_TEXT)) {
                return Either.left(unexpected("rest of template string"));
            }
            advance();
            parts.add(new Expr.TemplatePart.Text(segment.literal()));
        }
    }

    private Either<ParseError, Expr> parseBareInterpolation(SourceLocation start) {
        advance();
        var embedded = parseInterpolatedExpression();
        if (embedded.isLeft()) {
            return embedded;
        }
        return Either.right(new Expr.Template(span(start), List.of(new Expr.TemplatePart.Embedded(embedded.get()))));
    }

    /**
     * Expression between {@code {{} and {@code }}}, consuming the closing delimiter.
     */
    private Either<ParseError, Expr> parseInterpolatedExpression() {
        skipNewlines();
        var embedded = parseExpression();
        if (embedded.isLeft()) {
            return embedded;
        }
        skipNewlines();
        var close = expect(TokenKind.INTERPOLATION_END, "'}}'");
        return close.isLeft() ? fail(close) : embedded;
    }

    private Either<ParseError, Expr> parseBlock(SourceLocation start) {
        advance();
        var statements = parseStatementsUntilBrace();
        if (statements.isLeft()) {
            return fail(statements);
        }
        return Either.right(new Expr.Block(span(start), statements.get()));
    }

    private Either<ParseError, Expr> parseRecord(SourceLocation start) {
        advance();
        var fields = new ArrayList<Expr.RecordField>();
        while (true) {
            skipNewlines();
            if (match(TokenKind.RIGHT_BRACE)) {
                return Either.right(new Expr.RecordLiteral(span(start), fields));
            }
            var key = peek();
            if (!key.is(TokenKind.STRING) && !isFieldName(key)) {
                return Either.left(unexpected("field name"));
            }
            advance();
            var colon = expect(TokenKind.COLON, "':'");
            if (colon.isLeft()) {
                return fail(colon);
            }
            skipNewlines();
            var value = parseExpression();
            if (value.isLeft()) {
                return value;
            }
            var quoted = key.is(TokenKind.STRING);
            fields.add(new Expr.RecordField(quoted ? key.literal() : key.lexeme(), quoted, value.get()));
            skipNewlines();
            if (!match(TokenKind.COMMA) && !check(TokenKind.RIGHT_BRACE)) {
                return Either.left(unexpected("',' or '}'"));
            }
        }
    }

    /**
     * Parameter list and body of a lambda; {@code fn} (and the name, for declarations) is consumed.
     */
    private Either<ParseError, Expr> parseLambdaRest(SourceLocation start) {
        var open = expect(TokenKind.LEFT_PAREN, "'('");
        if (open.isLeft()) {
            return fail(open);
        }
        var parameters = new ArrayList<String>();
        skipNewlines();
        if (!check(TokenKind.RIGHT_PAREN)) {
            do {
                skipNewlines();
                var parameter = expect(TokenKind.IDENTIFIER, "parameter name");
                if (parameter.isLeft()) {
                    return fail(parameter);
                }
                parameters.add(parameter.get().lexeme());
                skipNewlines();
            } while (match(TokenKind.COMMA));
        }
        var close = expect(TokenKind.RIGHT_PAREN, "')'");
        if (close.isLeft()) {
            return fail(close);
        }
        Either<ParseError, Expr> body;
        if (match(TokenKind.ARROW) || match(TokenKind.FAT_ARROW)) {
            skipNewlines();
            body = parseExpression();
        } else if (check(TokenKind.LEFT_BRACE)) {
            body = parseBlock(peek().start());
        } else {
            return Either.left(unexpected("'->' or function body"));
        }
        return body.map(expr -> new Expr.Lambda(span(start), parameters, expr));
    }

    private Either<ParseError, Expr> parseConditional(SourceLocation start) {
        advance();
        var condition = parseExpression();
        if (condition.isLeft()) {
            return condition;
        }
        skipNewlines();
        Either<ParseError, Expr> thenBranch;
        if (match(TokenKind.THEN)) {
            skipNewlines();
            thenBranch = parseExpression();
        } else if (check(TokenKind.LEFT_BRACE)) {
            thenBranch = parseBlock(peek().start());
        } else {
            return Either.left(unexpected("'then'"));
        }
        if (thenBranch.isLeft()) {
            return thenBranch;
        }
        Option<Expr> elseBranch = Option.none();
        if (nextSignificant().is(TokenKind.ELSE)) {
            skipNewlines();
            advance();
            skipNewlines();
            var parsed = parseExpression();
            if (parsed.isLeft()) {
                return parsed;
            }
            elseBranch = Option.some(parsed.get());
        }
        return Either.right(new Expr.Conditional(span(start), condition.get(), thenBranch.get(), elseBranch));
    }

    private Either<ParseError, Expr> parseMatch(SourceLocation start) {
        advance();
        var subject = parseExpression();
        if (subject.isLeft()) {
            return subject;
        }
        skipNewlines();
        var with = expect(TokenKind.WITH, "'with'");
        if (with.isLeft()) {
            return fail(with);
        }
        skipNewlines();
        var open = expect(TokenKind.LEFT_BRACE, "'{'");
        if (open.isLeft()) {
            return fail(open);
        }
        var arms = new ArrayList<Expr.MatchArm>();
        while (true) {
            skipNewlines();
            if (match(TokenKind.RIGHT_BRACE)) {
                return Either.right(new Expr.Match(span(start), subject.get(), arms));
            }
            var armStart = peek().start();
            var pattern = parsePattern();
            if (pattern.isLeft()) {
                return fail(pattern);
            }
            if (!match(TokenKind.ARROW) && !match(TokenKind.FAT_ARROW)) {
                return Either.left(unexpected("'->'"));
            }
            skipNewlines();
            var body = parseExpression();
            if (body.isLeft()) {
                return body;
            }
            arms.add(new Expr.MatchArm(span(armStart), pattern.get(), body.get()));
            match(TokenKind.COMMA);
        }
    }

    private Either<ParseError, List<Expr>> parseExpressionList(TokenKind closing, String closingDescription) {
        var elements = new ArrayList<Expr>();
        skipNewlines();
        if (match(closing)) {
            return Either.right(elements);
        }
        while (true) {
            skipNewlines();
            var element = parseExpression();
            if (element.isLeft()) {
                return fail(element);
            }
            elements.add(element.get());
            skipNewlines();
            if (match(closing)) {
                return Either.right(elements);
            }
            if (!match(TokenKind.COMMA)) {
                return Either.left(unexpected("',' or " + closingDescription));
            }
        }
    }

    // === Patterns ===

    private Either<ParseError, Pattern> parsePattern() {
        var token = peek();
        var start = token.start();
        switch (token.kind()) {
            case IDENTIFIER -> {
                advance();
                return Either.right(token.lexeme().equals("_")
                                    ? new Pattern.Wildcard(token.span())
                                    : new Pattern.Binding(token.span(), token.lexeme()));
            }
            case NUMBER -> {
                advance();
                return Either.right(new Pattern.Literal(token.span(), Double.parseDouble(token.lexeme())));
            }
            case MINUS -> {
                advance();
                var number = expect(TokenKind.NUMBER, "number");
                if (number.isLeft()) {
                    return fail(number);
                }
                return Either.right(new Pattern.Literal(span(start), -Double.parseDouble(number.get().lexeme())));
            }
            case STRING -> {
                advance();
                return Either.right(new Pattern.Literal(token.span(), token.literal()));
            }
            case TRUE, FALSE -> {
                advance();
                return Either.right(new Pattern.Literal(token.span(), token.is(TokenKind.TRUE)));
            }
            case NULL -> {
                advance();
                return Either.right(new Pattern.Literal(token.span(), null));
            }
            case LEFT_BRACKET -> {
                return parseArrayPattern(start);
            }
            case LEFT_BRACE -> {
                return parseRecordPattern(start);
            }
            default -> {
                return Either.left(unexpected("pattern"));
            }
        }
    }

    private Either<ParseError, Pattern> parseArrayPattern(SourceLocation start) {
        advance();
        var elements = new ArrayList<Pattern>();
        skipNewlines();
        if (!check(TokenKind.RIGHT_BRACKET)) {
            do {
                skipNewlines();
                var element = parsePattern();
                if (element.isLeft()) {
                    return element;
                }
                elements.add(element.get());
                skipNewlines();
            } while (match(TokenKind.COMMA));
        }
        var close = expect(TokenKind.RIGHT_BRACKET, "']'");
        if (close.isLeft()) {
            return fail(close);
        }
        return Either.right(new Pattern.ArrayPattern(span(start), elements));
    }

    private Either<ParseError, Pattern> parseRecordPattern(SourceLocation start) {
        advance();
        var fields = new ArrayList<Pattern.FieldPattern>();
        skipNewlines();
        if (!check(TokenKind.RIGHT_BRACE)) {
            do {
                skipNewlines();
                var name = expect(TokenKind.IDENTIFIER, "field name");
                if (name.isLeft()) {
                    return fail(name);
                }
                Pattern pattern = new Pattern.Binding(name.get().span(), name.get().lexeme());
                if (match(TokenKind.COLON)) {
                    var nested = parsePattern();
                    if (nested.isLeft()) {
                        return nested;
                    }
                    pattern = nested.get();
                }
                fields.add(new Pattern.FieldPattern(name.get().lexeme(), pattern));
                skipNewlines();
            } while (match(TokenKind.COMMA));
        }
        var close = expect(TokenKind.RIGHT_BRACE, "'}'");
        if (close.isLeft()) {
            return fail(close);
        }
        return Either.right(new Pattern.RecordPattern(span(start), fields));
    }

    // === Types ===

    private Either<ParseError, TypeExpr> parseType() {
        var start = peek().start();
        if (match(TokenKind.LEFT_BRACKET)) {
            var element = parseType();
            if (element.isLeft()) {
                return element;
            }
            var close = expect(TokenKind.RIGHT_BRACKET, "']'");
            if (close.isLeft()) {
                return fail(close);
            }
            return Either.right(new TypeExpr.ArrayType(span(start), element.get()));
        }
        if (match(TokenKind.LEFT_BRACE)) {
            return parseRecordType(start);
        }
        if (match(TokenKind.LEFT_PAREN)) {
            return parseFunctionType(start);
        }
        var name = expect(TokenKind.IDENTIFIER, "type");
        if (name.isLeft()) {
            return fail(name);
        }
        var arguments = new ArrayList<TypeExpr>();
        if (match(TokenKind.LESS)) {
            do {
                var argument = parseType();
                if (argument.isLeft()) {
                    return argument;
                }
                arguments.add(argument.get());
            } while (match(TokenKind.COMMA));
            var close = expect(TokenKind.GREATER, "'>'");
            if (close.isLeft()) {
                return fail(close);
            }
        }
        return Either.right(new TypeExpr.Named(span(start), name.get().lexeme(), arguments));
    }

    private Either<ParseError, TypeExpr> parseRecordType(SourceLocation start) {
        var fields = new ArrayList<TypeExpr.FieldType>();
        while (true) {
            skipNewlines();
            if (match(TokenKind.RIGHT_BRACE)) {
                return Either.right(new TypeExpr.RecordType(span(start), fields));
            }
            if (!isFieldName(peek())) {
                return Either.left(unexpected("field name"));
            }
            var name = advance().lexeme();
            var colon = expect(TokenKind.COLON, "':'");
            if (colon.isLeft()) {
                return fail(colon);
            }
            var type = parseType();
            if (type.isLeft()) {
                return type;
            }
            fields.add(new TypeExpr.FieldType(name, type.get()));
            skipNewlines();
            if (!match(TokenKind.COMMA) && !check(TokenKind.RIGHT_BRACE)) {
                return Either.left(unexpected("',' or '}'"));
            }
        }
    }

    private Either<ParseError, TypeExpr> parseFunctionType(SourceLocation start) {
        var parameters = new ArrayList<TypeExpr>();
        if (!check(TokenKind.RIGHT_PAREN)) {
            do {
                var parameter = parseType();
                if (parameter.isLeft()) {
                    return parameter;
                }
                parameters.add(parameter.get());
            } while (match(TokenKind.COMMA));
        }
        var close = expect(TokenKind.RIGHT_PAREN, "')'");
        if (close.isLeft()) {
            return fail(close);
        }
        var arrow = expect(TokenKind.ARROW, "'->'");
        if (arrow.isLeft()) {
            return fail(arrow);
        }
        var result = parseType();
        if (result.isLeft()) {
            return result;
        }
        return Either.right(new TypeExpr.FunctionType(span(start), parameters, result.get()));
    }

    // === Token helpers ===

    /**
     * A brace opens a record literal when its first entry is {@code name:} or {@code "key":}.
     */
    private boolean isRecordStart() {
        int lookahead = pos + 1;
        while (tokens.get(lookahead).is(TokenKind.NEWLINE)) {
            lookahead++;
        }
        var first = tokens.get(lookahead);
        if (!first.is(TokenKind.STRING) && !isFieldName(first)) {
            return false;
        }
        return tokens.get(lookahead + 1).is(TokenKind.COLON);
    }

    private static boolean isFieldName(Token token) {
        return token.is(TokenKind.IDENTIFIER)
               || token.kind().isKeyword()
               || token.is(TokenKind.TRUE)
               || token.is(TokenKind.FALSE)
               || token.is(TokenKind.NULL);
    }

    private ParseError unexpected(String expected) {
        var token = peek();
        return switch (token.kind()) {
            case EOF -> new ParseError.UnexpectedEnd(token.start(), expected);
            case ERROR -> new ParseError.LexicalError(token.start(), token.literal());
            default -> new ParseError.UnexpectedToken(token.start(), token.describe(), expected);
        };
    }

    private Either<ParseError, Token> expect(TokenKind kind, String expected) {
        if (check(kind)) {
            return Either.right(advance());
        }
        return Either.left(unexpected(expected));
    }

    private static <T> Either<ParseError, T> fail(Either<ParseError, ?> failed) {
        return Either.left(failed.getLeft());
    }

    private void skipNewlines() {
        while (check(TokenKind.NEWLINE)) {
            advance();
        }
    }

    /**
     * First token at or after the cursor that is not a newline, without consuming anything.
     */
    private Token nextSignificant() {
        int lookahead = pos;
        while (tokens.get(lookahead).is(TokenKind.NEWLINE)) {
            lookahead++;
        }
        return tokens.get(lookahead);
    }

    private boolean check(TokenKind kind) {
        return peek().is(kind);
    }

    private boolean checkAny(TokenKind... kinds) {
        for (var kind : kinds) {
            if (check(kind)) {
                return true;
            }
        }
        return false;
    }

    private boolean match(TokenKind kind) {
        if (check(kind)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean isAtEnd() {
        return check(TokenKind.EOF);
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int distance) {
        return tokens.get(Math.min(pos + distance, tokens.size() - 1));
    }

    private Token advance() {
        var token = tokens.get(pos);
        if (!isAtEnd()) {
            pos++;
        }
        return token;
    }

    private SourceSpan span(SourceLocation start) {
        var end = pos == 0 ? start : tokens.get(pos - 1).end();
        return SourceSpan.of(start, end.isBefore(start) ? start : end);
    }

    private SourceSpan spanAt(SourceLocation location) {
        return tokens.stream()
                     .filter(token -> token.start().offset() == location.offset())
                     .findFirst()
                     .map(Token::span)
                     .orElse(SourceSpan.at(location));
    }
}
