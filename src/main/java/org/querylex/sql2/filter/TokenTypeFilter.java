package org.querylex.sql2.filter;

import org.querylex.sql2.lexer.Token;
import org.querylex.sql2.lexer.TokenType;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Drops every token of the given kinds.
 */
public class TokenTypeFilter implements ITokenFilter {

    private final Set<TokenType> dropped;

    public TokenTypeFilter(Collection<TokenType> dropped) {
        this.dropped = dropped.isEmpty() ? EnumSet.noneOf(TokenType.class) : EnumSet.copyOf(dropped);
    }

    public TokenTypeFilter(TokenType first, TokenType... rest) {
        this.dropped = EnumSet.of(first, rest);
    }

    @Override
    public Optional<Token> filter(Token token) {
        return dropped.contains(token.type()) ? Optional.empty() : Optional.of(token);
    }
}
