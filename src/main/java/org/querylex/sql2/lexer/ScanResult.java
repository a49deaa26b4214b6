package org.querylex.sql2.lexer;

import java.util.List;

/**
 * The immutable outcome of scanning one statement.
 *
 * @param statement The scanned statement.
 * @param tokens The tokens, in source order.
 * @param delimiters Every nonempty whitespace run the lexer skipped, in source order.
 */
public record ScanResult(
        String statement,
        List<Token> tokens,
        List<String> delimiters
) {
    public ScanResult {
        tokens = List.copyOf(tokens);
        delimiters = List.copyOf(delimiters);
    }
}
