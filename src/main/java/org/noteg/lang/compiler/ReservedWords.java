package org.noteg.lang.compiler;

import java.util.Set;

/**
 * JavaScript words a NoteG identifier must not be emitted as.
 *
 * <p>NoteG identifiers never contain {@code $}, so prefixing one cannot collide with another name.
 */
public final class ReservedWords {
    public static final String ESCAPE_PREFIX = "$";

    private static final Set<String> WORDS = Set.of(
        "arguments", "await", "break", "case", "catch", "class", "const", "continue",
        "debugger", "default", "delete", "do", "else", "enum", "eval", "export",
        "extends", "false", "finally", "for", "function", "if", "implements", "import",
        "in", "instanceof", "interface", "let", "new", "null", "package", "private",
        "protected", "public", "return", "static", "super", "switch", "this", "throw",
        "true", "try", "typeof", "undefined", "var", "void", "while", "with", "yield",
        "NaN", "Infinity", "globalThis");

    private ReservedWords() {}

    public static boolean isReserved(String name) {
        return WORDS.contains(name);
    }

    public static String escape(String name) {
        return isReserved(name) ? ESCAPE_PREFIX + name : name;
    }
}
