package org.pcc.compiler.frontend.lexer;

import org.pcc.compiler.api.SourcePosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Scanning is all-or-nothing: the first lexical error ends the run, and the caller
 * receives the error together with the tokens scanned before it.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("PROMPT", TokenType.PROMPT),
            Map.entry("VAR", TokenType.VAR),
            Map.entry("TEMPLATE", TokenType.TEMPLATE),
            Map.entry("CONSTRAINT", TokenType.CONSTRAINT),
            Map.entry("OUTPUT", TokenType.OUTPUT),
            Map.entry("IF", TokenType.IF),
            Map.entry("ELSE", TokenType.ELSE),
            Map.entry("FOR", TokenType.FOR),
            Map.entry("WHILE", TokenType.WHILE),
            Map.entry("IN", TokenType.IN),
            Map.entry("AS", TokenType.AS),
            Map.entry("AND", TokenType.AND),
            Map.entry("OR", TokenType.OR),
            Map.entry("NOT", TokenType.NOT),
            Map.entry("RAW", TokenType.RAW),
            Map.entry("true", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE)
    );

    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();
    private LexError error;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer for in-memory source.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this(source, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param fileName The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return The recognized tokens and, if scanning stopped early, the error.
     */
    public LexResult scanTokens() {
        while (!isAtEnd() && error == null) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        if (error != null) {
            LOG.debug("Lexing of {} stopped after {} tokens: {}", fileName, tokens.size(), error.message());
            return new LexResult(tokens, Optional.of(error));
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, new SourcePosition(line, column, fileName)));
        LOG.debug("Lexed {} tokens from {}", tokens.size(), fileName);
        return new LexResult(tokens, Optional.empty());
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case ':': addToken(TokenType.COLON); break;
            case '.': addToken(TokenType.DOT); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '^': addToken(TokenType.CARET); break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '/':
                if (match('/')) {
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    addToken(TokenType.SLASH);
                }
                break;
            case '"', '\'':
                string(c);
                break;
            case '$':
                sigil(TokenType.VARIABLE_REF);
                break;
            case '@':
                sigil(TokenType.TEMPLATE_CALL);
                break;
            // Ignore whitespace
            case ' ', '\r', '\t':
                break;
            case '\n':
                newLine();
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    fail("Unexpected character '" + c + "'");
                }
                break;
        }
    }

    private void blockComment() {
        // An unterminated block comment swallows the rest of the input.
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            if (advance() == '\n') newLine();
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER);
        if (type == TokenType.TRUE) {
            addToken(type, Boolean.TRUE);
        } else if (type == TokenType.FALSE) {
            addToken(type, Boolean.FALSE);
        } else {
            addToken(type);
        }
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // consume the '.'
            while (isDigit(peek())) advance();
        }
        addToken(TokenType.NUMBER, Double.parseDouble(source.substring(start, current)));
    }

    private void sigil(TokenType type) {
        if (!isAlpha(peek())) {
            fail("Expected identifier after '" + source.charAt(start) + "'");
            return;
        }
        while (isAlphaNumeric(peek())) advance();
        addToken(type, source.substring(start + 1, current));
    }

    private void string(char quote) {
        StringBuilder value = new StringBuilder();
        while (peek() != quote) {
            if (isAtEnd() || peek() == '\n') {
                fail("Unterminated string");
                return;
            }
            char c = advance();
            if (c == '\\') {
                if (isAtEnd() || peek() == '\n') {
                    fail("Unterminated string");
                    return;
                }
                value.append(escape(advance()));
            } else {
                value.append(c);
            }
        }

        // The closing quote
        advance();
        addToken(TokenType.STRING, value.toString());
    }

    private static char escape(char c) {
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            default: return c;
        }
    }

    private void fail(String message) {
        error = new LexError(message, new SourcePosition(startLine, startColumn, fileName));
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, new SourcePosition(startLine, startColumn, fileName)));
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
