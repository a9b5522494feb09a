package com.sysmuse.math.convert;

import com.sysmuse.math.expr.Expr;

final class Token {

    private final TokenType type;
    private final String value;
    private final Expr expr;

    private Token(TokenType type, String value, Expr expr) {
        this.type = type;
        this.value = value;
        this.expr = expr;
    }

    static Token of(TokenType type, String value) {
        return new Token(type, value, null);
    }

    static Token ofExpr(Expr expr) {
        return new Token(TokenType.EXPR, "", expr);
    }

    TokenType getType() {
        return type;
    }

    String getValue() {
        return value;
    }

    Expr getExpr() {
        return expr;
    }

    boolean isOperator(String op) {
        return type == TokenType.OPERATOR && value.equals(op);
    }

    @Override
    public String toString() {
        return type == TokenType.EXPR ? "Expr(" + expr + ")" : type + "(" + value + ")";
    }
}
