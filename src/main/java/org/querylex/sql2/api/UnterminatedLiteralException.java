package org.querylex.sql2.api;

/**
 * Thrown while scanning when a quoted string or bracketed identifier reaches the end of the
 * statement before its closing character.
 */
public class UnterminatedLiteralException extends InvalidQueryException {

    private final String fragment;

    /**
     * Constructs a new exception.
     * @param literalKind Human-readable kind of literal, e.g. "quoted string".
     * @param fragment The partially scanned literal text.
     * @param statement The full statement text.
     */
    public UnterminatedLiteralException(String literalKind, String fragment, String statement) {
        super(String.format("Syntax error: unterminated %s '%s' in '%s'", literalKind, fragment, statement), statement);
        this.fragment = fragment;
    }

    /**
     * @return The partially scanned literal, starting with its opening character.
     */
    public String getFragment() {
        return fragment;
    }
}
