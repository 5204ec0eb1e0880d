package com.insightbi.platform.service.rls;

/**
 * How string literals are escaped when context values are substituted into a predicate.
 */
public enum LiteralDialect {
    /** ANSI quoting: a single quote is doubled, backslash is an ordinary character. */
    POSTGRES,
    /** Engines where backslash escapes inside string literals (Hive, MySQL). */
    HIVE;

    public String quote(String value) {
        String text = value == null ? "" : value;
        return switch (this) {
            case POSTGRES -> "'" + text.replace("'", "''") + "'";
            case HIVE -> "'" + text.replace("\\", "\\\\").replace("'", "\\'") + "'";
        };
    }
}
