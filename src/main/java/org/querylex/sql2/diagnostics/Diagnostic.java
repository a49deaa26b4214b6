package org.querylex.sql2.diagnostics;

/**
 * Represents a single non-fatal message raised while scanning a statement.
 *
 * @param type The type of the diagnostic (e.g., WARNING).
 * @param message The diagnostic message.
 * @param statement The statement in which the issue occurred.
 * @param offset The character offset of the issue within the statement.
 */
public record Diagnostic(
        Type type,
        String message,
        String statement,
        int offset
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A problem the scanner recovered from by dropping input. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] offset %d: %s", type, offset, message);
    }
}
