package org.querylex.sql2.lexer;

/**
 * What the lexer does when a bracketed identifier is still open at the end of the statement.
 */
public enum UnterminatedBracketPolicy {
    /** Fail the scan with an {@link org.querylex.sql2.api.UnterminatedLiteralException}. */
    ERROR,
    /** Drop the rest of the statement and record a warning diagnostic. */
    IGNORE
}
