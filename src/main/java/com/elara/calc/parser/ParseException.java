package com.elara.calc.parser;

public class ParseException extends CalcException {
    private final Token token;

    public ParseException(Token token, String message) {
        super("[pos " + token.position + "] " + message);
        this.token = token;
    }

    /** The lookahead token that did not fit the grammar. */
    public Token token() { return token; }
}
