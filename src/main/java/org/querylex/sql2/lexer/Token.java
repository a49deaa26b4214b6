package org.querylex.sql2.lexer;

/**
 * Represents a single token extracted from a statement by the {@link Sql2Lexer}.
 *
 * @param type The kind of the token.
 * @param text The token text. For quoted strings, escape backslashes are already removed.
 * @param offset The offset of the first source character consumed for this token.
 * @param endOffset The offset just past the last source character consumed for this token.
 */
public record Token(
        TokenType type,
        String text,
        int offset,
        int endOffset
) {
    /**
     * Returns a copy of this token with different text and the same kind and source span.
     * @param newText The replacement text.
     * @return The new token.
     */
    public Token withText(String newText) {
        return new Token(type, newText, offset, endOffset);
    }
}
