package org.querylex.sql2.api;

/**
 * Thrown by the token cursor when the next token differs from the one a parser expects.
 */
public class UnexpectedTokenException extends InvalidQueryException {

    private final String expected;
    private final String found;

    /**
     * Constructs a new exception.
     * @param expected The token the caller asked for.
     * @param found The token actually consumed; empty if the statement was exhausted.
     * @param statement The full statement text.
     */
    public UnexpectedTokenException(String expected, String found, String statement) {
        super(String.format("Syntax error: Expected '%s', found '%s' in %s", expected, found, statement), statement);
        this.expected = expected;
        this.found = found;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }
}
