package com.elara.calc.parser;

/** Base type for every failure the calculator core reports to its caller. */
public class CalcException extends RuntimeException {
    public CalcException(String message) {
        super(message);
    }

    public CalcException(String message, Throwable cause) {
        super(message, cause);
    }
}
