package org.querylex.sql2.lexer;

/**
 * Classifies statement characters for the scanner's dispatch.
 */
public enum CharClass {
    DIGIT,
    QUOTE,
    /** Always a one-character token. */
    PUNCTUATION,
    /** Starts a one or two character operator. */
    OPERATOR,
    BRACKET_OPEN,
    BRACKET_CLOSE,
    WHITESPACE,
    /** Anything else; starts a bare identifier. */
    OTHER;

    static final String WHITESPACE_CHARS = " \n\r\t";
    static final String PUNCTUATION_CHARS = "/-(){}*,.;+%?";
    static final String OPERATOR_CHARS = "!<>|=:";
    /** Characters that may follow an operator character to form a two-character operator. */
    static final String OPERATOR_SUFFIX_CHARS = "=|>";

    /**
     * Returns the class of the given character.
     * @param c The character to classify.
     * @return Its class, never null.
     */
    public static CharClass of(char c) {
        if (c >= '0' && c <= '9') return DIGIT;
        if (c == '"' || c == '\'') return QUOTE;
        if (c == '[') return BRACKET_OPEN;
        if (c == ']') return BRACKET_CLOSE;
        if (WHITESPACE_CHARS.indexOf(c) >= 0) return WHITESPACE;
        if (PUNCTUATION_CHARS.indexOf(c) >= 0) return PUNCTUATION;
        if (OPERATOR_CHARS.indexOf(c) >= 0) return OPERATOR;
        return OTHER;
    }

    /**
     * @param c The character to test.
     * @return true if the character may follow an operator character in a two-character operator.
     */
    public static boolean isOperatorSuffix(char c) {
        return OPERATOR_SUFFIX_CHARS.indexOf(c) >= 0;
    }

    /**
     * @param c The character to test.
     * @return true if the character can be part of a bare identifier.
     */
    public static boolean isIdentifierPart(char c) {
        CharClass cls = of(c);
        return cls == DIGIT || cls == QUOTE || cls == OTHER;
    }
}
