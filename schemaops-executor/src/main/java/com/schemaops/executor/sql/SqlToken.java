package com.schemaops.executor.sql;

import java.util.Locale;

/**
 * Lexical token of a SQL statement.
 *
 * @param text for WORD tokens the original spelling; for QUOTED tokens the
 *             identifier without quotes; for SYMBOL tokens the character
 */
public record SqlToken(Kind kind, String text) {

    public enum Kind {
        WORD,
        QUOTED,
        SYMBOL
    }

    /**
     * True for an unquoted word matching the keyword, ignoring case.
     */
    public boolean is(String keyword) {
        return kind == Kind.WORD && text.equalsIgnoreCase(keyword);
    }

    public boolean isSymbol(char symbol) {
        return kind == Kind.SYMBOL && text.charAt(0) == symbol;
    }

    public boolean isName() {
        return kind == Kind.WORD || kind == Kind.QUOTED;
    }

    /**
     * Upper-cased keyword form.
     */
    public String keyword() {
        return text.toUpperCase(Locale.ROOT);
    }
}
