package org.querylex.sql2.scanner;

/**
 * Selects which delimiter list {@link Sql2Scanner#previousDelimiter()} indexes.
 */
public enum DelimiterAlignment {
    /**
     * One entry per whitespace run actually skipped. Adjacent tokens leave no entry, so
     * lookups drift after the first gap without whitespace. Compatible with existing parsers.
     */
    POSITIONAL,
    /**
     * One entry per token: the whitespace following it, empty if the next token is adjacent.
     */
    TOKEN
}
