package com.sysmuse.math.convert;

enum TokenType {
    NUMBER,
    OPERATOR,
    LPAREN,
    RPAREN,
    EQUALS,
    EXPR      // pre-built Expr from a structured node
}
