package org.querylex.sql2.filter;

import org.querylex.sql2.lexer.Token;
import org.querylex.sql2.lexer.TokenType;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Upper-cases bare identifiers that are SQL2 keywords, e.g. {@code select} becomes {@code SELECT}.
 * Every other token passes through unchanged.
 */
public class KeywordCaseFilter implements ITokenFilter {

    static final Set<String> KEYWORDS = Set.of(
            "SELECT", "FROM", "WHERE", "AS", "AND", "OR", "NOT",
            "JOIN", "INNER", "LEFT", "RIGHT", "OUTER", "ON",
            "ORDER", "BY", "ASC", "DESC", "LIKE", "IS", "NULL",
            "CONTAINS", "ISSAMENODE", "ISCHILDNODE", "ISDESCENDANTNODE",
            "LENGTH", "NAME", "LOCALNAME", "SCORE", "LOWER", "UPPER",
            "CAST", "TRUE", "FALSE");

    @Override
    public Optional<Token> filter(Token token) {
        if (token.type() != TokenType.IDENTIFIER) {
            return Optional.of(token);
        }
        String upper = token.text().toUpperCase(Locale.ROOT);
        if (KEYWORDS.contains(upper) && !upper.equals(token.text())) {
            return Optional.of(token.withText(upper));
        }
        return Optional.of(token);
    }
}
