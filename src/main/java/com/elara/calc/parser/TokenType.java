package com.elara.calc.parser;

public enum TokenType {
    NUMBER,
    PLUS, MINUS, STAR, SLASH,
    LEFT_PAREN, RIGHT_PAREN,
    EOF
}
