package org.querylex.sql2.lexer;

/**
 * Defines the kinds of tokens the {@link Sql2Lexer} can produce.
 * The kind follows from the sub-scanner that recognized the token.
 */
public enum TokenType {
    // Literals.
    /** A numeric literal such as 42, 1.5 or 1.5E10. */
    NUMBER,
    /** A quoted string literal, quotes included. */
    STRING,

    // Names.
    /** A bracketed identifier such as [nt:base], brackets included. */
    QUOTED_IDENTIFIER,
    /** A bare identifier or keyword such as SELECT or title. */
    IDENTIFIER,

    // Operators & punctuation.
    /** A one or two character operator built from ! &lt; &gt; | = : such as &lt;= or !=. */
    OPERATOR,
    /** A single punctuation character such as ( , . or *. */
    PUNCTUATION
}
