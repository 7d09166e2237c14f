package org.noteg.lang.lexer;

/**
 * Token kinds produced by {@link Lexer}.
 */
public enum TokenKind {
    // Literals
    STRING("string literal"),
    TEMPLATE_TEXT("template text"),
    TEMPLATE_END("end of template string"),
    NUMBER("number"),
    TRUE("'true'"),
    FALSE("'false'"),
    NULL("'null'"),
    IDENTIFIER("identifier"),

    // Keywords
    LET("'let'"),
    CONST("'const'"),
    FN("'fn'"),
    IF("'if'"),
    THEN("'then'"),
    ELSE("'else'"),
    MATCH("'match'"),
    WITH("'with'"),
    TYPE("'type'"),
    MODULE("'module'"),
    IMPORT("'import'"),
    EXPORT("'export'"),

    // Operators
    PLUS("'+'"),
    MINUS("'-'"),
    STAR("'*'"),
    SLASH("'/'"),
    BANG("'!'"),
    ASSIGN("'='"),
    EQUAL("'=='"),
    NOT_EQUAL("'!='"),
    LESS("'<'"),
    LESS_EQUAL("'<='"),
    GREATER("'>'"),
    GREATER_EQUAL("'>='"),
    AND("'&&'"),
    OR("'||'"),
    ARROW("'->'"),
    FAT_ARROW("'=>'"),
    PIPE("'|>'"),

    // Delimiters
    LEFT_PAREN("'('"),
    RIGHT_PAREN("')'"),
    LEFT_BRACKET("'['"),
    RIGHT_BRACKET("']'"),
    LEFT_BRACE("'{'"),
    RIGHT_BRACE("'}'"),
    COMMA("','"),
    DOT("'.'"),
    COLON("':'"),
    INTERPOLATION_START("'{{'"),
    INTERPOLATION_END("'}}'"),

    // Special
    NEWLINE("newline"),
    EOF("end of input"),
    ERROR("invalid token");

    private final String description;

    TokenKind(String description) {
        this.description = description;
    }

    /**
     * Human-readable name used in parse error messages.
     */
    public String description() {
        return description;
    }

    public boolean isKeyword() {
        return ordinal() >= LET.ordinal() && ordinal() <= EXPORT.ordinal();
    }
}
