package org.querylex.sql2.api;

/**
 * Thrown when a SQL2 statement cannot be scanned or does not match the tokens a caller expects.
 * <p>
 * The offending statement is kept verbatim so callers can report precise syntax errors.
 */
public class InvalidQueryException extends Exception {

    private final String statement;

    /**
     * Constructs a new exception.
     * @param message The detail message.
     * @param statement The full statement text being processed.
     */
    public InvalidQueryException(String message, String statement) {
        super(message, null);
        this.statement = statement;
    }

    /**
     * @return The full statement text that caused this exception.
     */
    public String getStatement() {
        return statement;
    }
}
