package org.querylex.sql2.lexer;

import org.querylex.sql2.api.UnterminatedLiteralException;
import org.querylex.sql2.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) converts a single SQL2 statement
 * into a sequence of tokens and records the whitespace it skips between them.
 * <p>
 * A lexer instance scans exactly one statement and is not thread-safe.
 */
public class Sql2Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Sql2Lexer.class);

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final UnterminatedBracketPolicy bracketPolicy;
    private final List<Token> tokens = new ArrayList<>();
    private final List<String> delimiters = new ArrayList<>();
    private int current = 0;

    /**
     * Creates a new Lexer that rejects unterminated bracketed identifiers.
     * @param source The statement to scan.
     */
    public Sql2Lexer(String source) {
        this(source, new DiagnosticsEngine(), UnterminatedBracketPolicy.ERROR);
    }

    /**
     * Creates a new Lexer.
     * @param source The statement to scan.
     * @param diagnostics The engine receiving non-fatal warnings.
     * @param bracketPolicy How to treat a bracketed identifier left open at the end of the statement.
     */
    public Sql2Lexer(String source, DiagnosticsEngine diagnostics, UnterminatedBracketPolicy bracketPolicy) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.bracketPolicy = bracketPolicy;
    }

    /**
     * Performs the tokenization of the entire statement.
     * @return The tokens and the skipped whitespace runs.
     * @throws UnterminatedLiteralException if a literal is still open at the end of the statement.
     */
    public ScanResult scan() throws UnterminatedLiteralException {
        while (!isAtEnd()) {
            skipWhitespace();
            if (isAtEnd()) {
                break;
            }
            scanToken();
        }
        LOG.debug("Scanned {} tokens and {} delimiters from statement of length {}",
                tokens.size(), delimiters.size(), source.length());
        return new ScanResult(source, tokens, delimiters);
    }

    private void skipWhitespace() {
        int start = current;
        while (!isAtEnd() && CharClass.of(peek()) == CharClass.WHITESPACE) current++;
        if (current > start) {
            delimiters.add(source.substring(start, current));
        }
    }

    private void scanToken() throws UnterminatedLiteralException {
        int start = current;
        char c = peek();
        switch (CharClass.of(c)) {
            case DIGIT -> number(start);
            case QUOTE -> string(start);
            case PUNCTUATION, BRACKET_CLOSE -> {
                // A stray ']' would otherwise never be consumed.
                current++;
                addToken(TokenType.PUNCTUATION, start);
            }
            case OPERATOR -> {
                current++;
                if (!isAtEnd() && CharClass.isOperatorSuffix(peek())) current++;
                addToken(TokenType.OPERATOR, start);
            }
            case BRACKET_OPEN -> quotedIdentifier(start);
            default -> identifier(start);
        }
    }

    private void number(int start) {
        skipDigits();
        // The reference grammar takes a '.' whenever at least one character follows it.
        if (peek() == '.' && current + 1 < source.length()) {
            current++;
            skipDigits();
        }
        if (peek() == 'E' || peek() == 'e') {
            current++;
            skipDigits();
        }
        addToken(TokenType.NUMBER, start);
    }

    private void string(int start) throws UnterminatedLiteralException {
        char quote = advance();
        StringBuilder text = new StringBuilder().append(quote);

        while (!isAtEnd()) {
            char c = advance();
            if (c == quote) {
                text.append(c);
                tokens.add(logged(new Token(TokenType.STRING, text.toString(), start, current)));
                return;
            } else if (c == '\\' && peek() == quote) {
                text.append(advance());
            } else {
                text.append(c);
            }
        }
        throw new UnterminatedLiteralException("quoted string", text.toString(), source);
    }

    private void quotedIdentifier(int start) throws UnterminatedLiteralException {
        current++; // consume '['
        int level = 1;
        while (!isAtEnd()) {
            char c = advance();
            if (c == ']' && --level == 0) {
                addToken(TokenType.QUOTED_IDENTIFIER, start);
                return;
            } else if (c == '[') {
                level++;
            }
        }

        String fragment = source.substring(start);
        if (bracketPolicy == UnterminatedBracketPolicy.ERROR) {
            throw new UnterminatedLiteralException("quoted identifier", fragment, source);
        }
        LOG.warn("Dropping unterminated quoted identifier '{}' at offset {}", fragment, start);
        diagnostics.reportWarning("Unterminated quoted identifier '" + fragment + "' dropped", source, start);
    }

    private void identifier(int start) {
        while (!isAtEnd() && CharClass.isIdentifierPart(peek())) current++;
        addToken(TokenType.IDENTIFIER, start);
    }

    private void skipDigits() {
        while (!isAtEnd() && CharClass.of(peek()) == CharClass.DIGIT) current++;
    }

    private void addToken(TokenType type, int start) {
        tokens.add(logged(new Token(type, source.substring(start, current), start, current)));
    }

    private Token logged(Token token) {
        LOG.trace("{} '{}' [{}, {})", token.type(), token.text(), token.offset(), token.endOffset());
        return token;
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }
}
