package com.elara.calc.parser;

public class EvaluationException extends CalcException {
    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
