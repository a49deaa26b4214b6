package org.querylex.sql2.scanner;

import org.querylex.sql2.api.UnexpectedTokenException;
import org.querylex.sql2.api.UnterminatedLiteralException;
import org.querylex.sql2.diagnostics.DiagnosticsEngine;
import org.querylex.sql2.lexer.CharClass;
import org.querylex.sql2.lexer.ScanResult;
import org.querylex.sql2.lexer.Sql2Lexer;
import org.querylex.sql2.lexer.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Splits a SQL2 statement into tokens and lets a parser walk through them.
 * <p>
 * The whole statement is scanned eagerly by the constructor. Afterwards the token list is
 * immutable and the read position only moves forward, through {@link #consume()}.
 * An instance belongs to a single parser and is not thread-safe.
 */
public class Sql2Scanner {

    private static final String DEFAULT_DELIMITER = " ";
    private static final String TRIMMED_CHARS = " \t\n\r\0\u000B";

    private final String statement;
    private final ScannerOptions options;
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final List<Token> tokens;
    private final List<String> delimiters;
    private final String leadingWhitespace;
    private int position = 0;

    /**
     * Scans a statement with the default options.
     * @param statement The SQL2 statement.
     * @throws UnterminatedLiteralException if a literal is left open.
     */
    public Sql2Scanner(String statement) throws UnterminatedLiteralException {
        this(statement, ScannerOptions.defaults());
    }

    /**
     * Scans a statement.
     * @param statement The SQL2 statement.
     * @param options The scanner options.
     * @throws UnterminatedLiteralException if a literal is left open.
     */
    public Sql2Scanner(String statement, ScannerOptions options) throws UnterminatedLiteralException {
        this.statement = statement;
        this.options = options;
        ScanResult result = new Sql2Lexer(statement, diagnostics, options.unterminatedBracket()).scan();
        this.tokens = result.tokens();
        this.leadingWhitespace = whitespaceAt(0);
        this.delimiters = options.delimiterAlignment() == DelimiterAlignment.TOKEN
                ? alignToTokens()
                : result.delimiters();
    }

    /**
     * Gets a token without moving the read position.
     * @param offset Number of tokens to look ahead, 0 for the current token.
     * @return The trimmed token text, or an empty string past the end.
     */
    public String lookahead(int offset) {
        return lookaheadToken(offset).map(t -> trim(t.text())).orElse("");
    }

    /**
     * Gets the current token without moving the read position.
     * @return The trimmed token text, or an empty string past the end.
     */
    public String lookahead() {
        return lookahead(0);
    }

    /**
     * Gets a token together with its kind and source span, without moving the read position.
     * @param offset Number of tokens to look ahead, 0 for the current token.
     * @return The token, or empty past either end of the token list.
     */
    public Optional<Token> lookaheadToken(int offset) {
        int index = position + offset;
        if (index < 0 || index >= tokens.size()) {
            return Optional.empty();
        }
        return Optional.of(tokens.get(index));
    }

    /**
     * Gets the current token and advances past it. Past the end this keeps returning an
     * empty string and leaves the position alone. A token whose text trims to nothing is
     * still stepped over.
     * @return The trimmed token text, or an empty string past the end.
     */
    public String consume() {
        String token = lookahead();
        if (!isAtEnd()) {
            position++;
        }
        return token;
    }

    /**
     * Gets the delimiter recorded at index {@code position - 1}. With
     * {@link DelimiterAlignment#TOKEN} this is the whitespace between the last consumed token and
     * the current one. With {@link DelimiterAlignment#POSITIONAL} it is only that whitespace as long as
     * no two tokens so far were adjacent and the statement had no leading whitespace.
     * @return The delimiter, or a single space if none is recorded at that index.
     */
    public String previousDelimiter() {
        int index = position - 1;
        if (index < 0 || index >= delimiters.size()) {
            return DEFAULT_DELIMITER;
        }
        return delimiters.get(index);
    }

    /**
     * Consumes the next token and checks that it equals the given one.
     * @param token The expected token.
     * @param caseInsensitive Whether letter case is ignored.
     * @throws UnexpectedTokenException if the consumed token differs.
     */
    public void expect(String token, boolean caseInsensitive) throws UnexpectedTokenException {
        String next = consume();
        if (!tokensEqual(next, token, caseInsensitive)) {
            throw new UnexpectedTokenException(token, next, statement);
        }
    }

    /**
     * Consumes the next token and checks, ignoring case, that it equals the given one.
     * @param token The expected token.
     * @throws UnexpectedTokenException if the consumed token differs.
     */
    public void expect(String token) throws UnexpectedTokenException {
        expect(token, true);
    }

    /**
     * Applies {@link #expect(String, boolean)} to each token in order.
     * @param expected The expected tokens.
     * @param caseInsensitive Whether letter case is ignored.
     * @throws UnexpectedTokenException on the first mismatch; earlier tokens stay consumed.
     */
    public void expectSequence(List<String> expected, boolean caseInsensitive) throws UnexpectedTokenException {
        for (String token : expected) {
            expect(token, caseInsensitive);
        }
    }

    /**
     * Applies {@link #expect(String)} to each token in order.
     * @param expected The expected tokens.
     * @throws UnexpectedTokenException on the first mismatch.
     */
    public void expectSequence(String... expected) throws UnexpectedTokenException {
        expectSequence(List.of(expected), true);
    }

    /**
     * Tests two tokens for equality.
     * @param token The first token.
     * @param value The second token.
     * @param caseInsensitive Whether letter case is ignored.
     * @return true if they are equal.
     */
    public boolean tokensEqual(String token, String value, boolean caseInsensitive) {
        if (caseInsensitive) {
            return token.toUpperCase(Locale.ROOT).equals(value.toUpperCase(Locale.ROOT));
        }
        return token.equals(value);
    }

    /**
     * Tests two tokens for equality, ignoring case.
     * @param token The first token.
     * @param value The second token.
     * @return true if they are equal.
     */
    public boolean tokensEqual(String token, String value) {
        return tokensEqual(token, value, true);
    }

    public boolean isAtEnd() {
        return position >= tokens.size();
    }

    public int getPosition() {
        return position;
    }

    public String getStatement() {
        return statement;
    }

    public ScannerOptions getOptions() {
        return options;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    /**
     * @return The delimiter list selected by the configured {@link DelimiterAlignment}.
     */
    public List<String> getDelimiters() {
        return delimiters;
    }

    /**
     * @return The whitespace in front of the first token.
     */
    public String getLeadingWhitespace() {
        return leadingWhitespace;
    }

    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    private List<String> alignToTokens() {
        List<String> aligned = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            aligned.add(whitespaceAt(token.endOffset()));
        }
        return List.copyOf(aligned);
    }

    /**
     * Strips space, tab, line feed, carriage return, NUL and vertical tab from both ends.
     * Other control characters such as form feed are part of the token text.
     */
    private static String trim(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && TRIMMED_CHARS.indexOf(text.charAt(start)) >= 0) start++;
        while (end > start && TRIMMED_CHARS.indexOf(text.charAt(end - 1)) >= 0) end--;
        return text.substring(start, end);
    }

    private String whitespaceAt(int from) {
        int end = from;
        while (end < statement.length() && CharClass.of(statement.charAt(end)) == CharClass.WHITESPACE) end++;
        return statement.substring(from, end);
    }
}
