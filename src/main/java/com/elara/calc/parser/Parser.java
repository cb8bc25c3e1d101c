package com.elara.calc.parser;

import com.elara.calc.parser.Expr.Binary;
import com.elara.calc.parser.Expr.ExprInterface;
import com.elara.calc.parser.Expr.Literal;

/**
 * Recursive-descent parser with one token of lookahead.
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := factor (('*' | '/') factor)*
 * factor     := NUMBER | '(' expression ')'
 * </pre>
 */
public class Parser {
    public static final int DEFAULT_MAX_DEPTH = 256;

    private final Lexer lexer;
    private final int maxDepth;
    private Token current;
    private int depth = 0;

    public Parser(Lexer lexer) { this(lexer, DEFAULT_MAX_DEPTH); }

    public Parser(Lexer lexer, int maxDepth) {
        if (lexer == null) throw new IllegalArgumentException("lexer must not be null");
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1, got " + maxDepth);
        this.lexer = lexer;
        this.maxDepth = maxDepth;
        this.current = lexer.nextToken();
    }

    /** Parses a complete input: one expression followed by end of input. */
    public ExprInterface parse() {
        ExprInterface expr = parseExpression();
        eat(TokenType.EOF, "Unexpected token after expression.");
        return expr;
    }

    /** Parses one expression and leaves any trailing tokens unconsumed. */
    public ExprInterface parseExpression() {
        ExprInterface expr = term();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            Token operator = current;
            eat(operator.type, "Expect '+' or '-'.");
            expr = new Binary(expr, operator, term());
        }
        return expr;
    }

    /** The lookahead token that the next grammar production will inspect. */
    public Token peek() { return current; }

    private ExprInterface term() {
        ExprInterface expr = factor();
        while (check(TokenType.STAR) || check(TokenType.SLASH)) {
            Token operator = current;
            eat(operator.type, "Expect '*' or '/'.");
            expr = new Binary(expr, operator, factor());
        }
        return expr;
    }

    private ExprInterface factor() {
        Token token = current;
        if (check(TokenType.NUMBER)) {
            eat(TokenType.NUMBER, "Expect number.");
            return new Literal(token.literal);
        }
        if (check(TokenType.LEFT_PAREN)) {
            if (depth >= maxDepth) throw new ParseException(token, "Expression nested too deeply.");
            eat(TokenType.LEFT_PAREN, "Expect '('.");
            depth++;
            ExprInterface expr = parseExpression();
            eat(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            depth--;
            return expr;
        }
        throw new ParseException(token, "Expect expression.");
    }

    private void eat(TokenType type, String message) {
        if (!check(type)) throw new ParseException(current, message);
        current = lexer.nextToken();
    }

    private boolean check(TokenType type) { return current.type == type; }
}
