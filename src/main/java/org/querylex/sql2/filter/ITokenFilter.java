package org.querylex.sql2.filter;

import org.querylex.sql2.lexer.Token;

import java.util.Optional;

/**
 * A single step of a {@link TokenFilterChain}.
 */
@FunctionalInterface
public interface ITokenFilter {

    /**
     * Inspects a token and either passes it on, possibly modified, or drops it.
     * @param token The token to filter.
     * @return The token to pass on, or empty to drop it.
     */
    Optional<Token> filter(Token token);
}
