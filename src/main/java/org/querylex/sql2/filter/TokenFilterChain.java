package org.querylex.sql2.filter;

import org.querylex.sql2.lexer.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies an ordered list of filters to tokens. A token dropped by one filter is not seen by
 * the filters after it. An empty chain passes every token through unchanged.
 */
public class TokenFilterChain implements ITokenFilter {

    private final List<ITokenFilter> filters = new ArrayList<>();

    /**
     * Appends a filter to the end of the chain.
     * @param filter The filter to add.
     * @return This chain.
     */
    public TokenFilterChain addFilter(ITokenFilter filter) {
        filters.add(filter);
        return this;
    }

    @Override
    public Optional<Token> filter(Token token) {
        Optional<Token> result = Optional.of(token);
        for (ITokenFilter filter : filters) {
            result = filter.filter(result.get());
            if (result.isEmpty()) {
                return result;
            }
        }
        return result;
    }

    /**
     * Filters a whole token list.
     * @param tokens The tokens, in order.
     * @return The surviving tokens, in the same order.
     */
    public List<Token> apply(List<Token> tokens) {
        List<Token> kept = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            filter(token).ifPresent(kept::add);
        }
        return kept;
    }

    public int size() {
        return filters.size();
    }
}
