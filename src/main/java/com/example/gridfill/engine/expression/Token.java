package com.example.gridfill.engine.expression;

import lombok.Value;

@Value
class Token {
    Type type;
    String text;
    int position;

    enum Type {
        IDENT, NUMBER, STRING, TRUE, FALSE, NULL,
        DOT, COMMA, LPAREN, RPAREN, QUESTION, COLON,
        PLUS, MINUS, STAR, SLASH, PERCENT,
        EQ, NE, LT, LE, GT, GE,
        AND, OR, NOT,
        EOF
    }

    boolean is(Type expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type == Type.EOF ? "end of expression" : "'" + text + "' at " + position;
    }
}
