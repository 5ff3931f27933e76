package com.formulagraph.app.expression;

enum TokenType {
    NUMBER,
    STRING,
    BOOLEAN,
    CELL,
    RANGE,
    NAME,
    OPERATOR,
    LEFT_PAREN,
    RIGHT_PAREN,
    SEPARATOR,
    END
}
