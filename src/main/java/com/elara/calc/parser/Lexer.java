package com.elara.calc.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Pull-based tokenizer. Each {@link #nextToken()} call scans exactly one token;
 * once the input is exhausted every further call returns an EOF token.
 */
public class Lexer {
    private final String source;
    private int start = 0;
    private int current = 0;

    public Lexer(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        this.source = source;
    }

    public Token nextToken() {
        skipWhitespace();
        start = current;
        if (isAtEnd()) return new Token(TokenType.EOF, "", null, source.length());

        char c = advance();
        switch (c) {
            case '+': return token(TokenType.PLUS);
            case '-': return token(TokenType.MINUS);
            case '*': return token(TokenType.STAR);
            case '/': return token(TokenType.SLASH);
            case '(': return token(TokenType.LEFT_PAREN);
            case ')': return token(TokenType.RIGHT_PAREN);
            default:
                if (isDigit(c)) return number();
                throw new LexicalException(start, "Unexpected character: '" + c + "'");
        }
    }

    /** Drains the remaining input. The returned list always ends with a single EOF token. */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type != TokenType.EOF);
        return tokens;
    }

    /** Joins lexemes with single spaces, leaving out EOF. */
    public static String render(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            if (token.type == TokenType.EOF) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(token.lexeme);
        }
        return sb.toString();
    }

    private Token number() {
        while (isDigit(peek())) advance();
        String digits = source.substring(start, current);
        try {
            return new Token(TokenType.NUMBER, digits, Long.parseLong(digits), start);
        } catch (NumberFormatException e) {
            throw new LexicalException(start, "Integer literal out of range: " + digits, e);
        }
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) current++;
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }
    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }

    private Token token(TokenType type) {
        return new Token(type, source.substring(start, current), null, start);
    }
}
