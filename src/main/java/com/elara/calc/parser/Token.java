package com.elara.calc.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    /** Parsed value for NUMBER tokens, null for everything else. */
    public final Long literal;
    public final int position;

    Token(TokenType type, String lexeme, Long literal, int position) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.position = position;
    }

    @Override
    public String toString() {
        return literal == null ? "Token(" + type + ")" : "Token(" + type + ", " + literal + ")";
    }
}
