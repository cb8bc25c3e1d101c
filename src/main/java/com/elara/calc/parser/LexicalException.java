package com.elara.calc.parser;

public class LexicalException extends CalcException {
    private final int position;

    public LexicalException(int position, String message) {
        super("[pos " + position + "] " + message);
        this.position = position;
    }

    public LexicalException(int position, String message, Throwable cause) {
        super("[pos " + position + "] " + message, cause);
        this.position = position;
    }

    public int position() { return position; }
}
