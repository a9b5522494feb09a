package com.sysmuse.math.convert;

import com.sysmuse.math.expr.DivExpr;
import com.sysmuse.math.expr.Expr;
import com.sysmuse.math.expr.FracExpr;
import com.sysmuse.math.expr.IntExpr;
import com.sysmuse.math.expr.PowExpr;
import com.sysmuse.math.expr.ProdExpr;
import com.sysmuse.math.expr.SumExpr;
import com.sysmuse.util.LoggingUtil;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.List;

/**
 * Recursive-descent parser turning a token list into an Expr tree.
 * Lenient: a missing operand becomes 0 and a missing ')' is assumed.
 */
class TokenParser {

    /** Decimals with more fractional digits than this are rounded to an integer. */
    static final int MAX_EXACT_DECIMALS = 10;

    private final List<Token> tokens;
    private int pos = 0;

    TokenParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    Expr parse() {
        return parseAddSub();
    }

    private Token current() {
        return pos < tokens.size() ? tokens.get(pos) : null;
    }

    private Expr parseAddSub() {
        Expr left = parseMulDiv();
        while (current() != null) {
            Token token = current();
            boolean plus = token.isOperator("+");
            boolean minus = token.isOperator("-");
            if (!plus && !minus) break;
            pos++;
            Expr right = parseMulDiv();
            left = new SumExpr(List.of(left, plus ? right : right.negate()));
        }
        return left;
    }

    private Expr parseMulDiv() {
        Expr left = parsePower();
        while (current() != null) {
            Token token = current();
            boolean times = token.isOperator("*");
            boolean divide = token.isOperator("/");
            if (!times && !divide) break;
            pos++;
            Expr right = parsePower();
            left = times ? new ProdExpr(List.of(left, right)) : new DivExpr(left, right);
        }
        return left;
    }

    // Left-associative: a^b^c = (a^b)^c
    private Expr parsePower() {
        Expr base = parseUnary();
        while (current() != null && current().isOperator("^")) {
            pos++;
            Expr exponent = parseUnary();
            base = new PowExpr(base, exponent);
        }
        return base;
    }

    private Expr parseUnary() {
        Token token = current();
        if (token != null && token.isOperator("-")) {
            pos++;
            return parseUnary().negate();
        }
        if (token != null && token.isOperator("+")) {
            pos++;
            return parseUnary();
        }
        return parsePrimary();
    }

    private Expr parsePrimary() {
        Token token = current();
        if (token == null) {
            return IntExpr.ZERO;
        }

        switch (token.getType()) {
            case EXPR:
                pos++;
                return token.getExpr();
            case NUMBER:
                pos++;
                return parseNumber(token.getValue());
            case LPAREN:
                pos++;
                Expr inner = parseAddSub();
                if (current() != null && current().getType() == TokenType.RPAREN) {
                    pos++;
                }
                return inner;
            default:
                return IntExpr.ZERO;
        }
    }

    /**
     * Integers stay exact, short decimals become fractions, long ones are rounded.
     */
    static Expr parseNumber(String text) {
        if (text.matches("\\d+")) {
            return new IntExpr(new BigInteger(text));
        }

        BigDecimal value;
        try {
            value = new BigDecimal(text).stripTrailingZeros();
        } catch (NumberFormatException e) {
            LoggingUtil.debug("Unparseable number literal '" + text + "', using 0");
            return IntExpr.ZERO;
        }

        if (value.scale() <= 0) {
            return new IntExpr(value.toBigIntegerExact());
        }
        if (value.scale() > MAX_EXACT_DECIMALS) {
            return new IntExpr(value.setScale(0, RoundingMode.HALF_UP).toBigIntegerExact());
        }
        return new FracExpr(new IntExpr(value.unscaledValue()),
                new IntExpr(BigInteger.TEN.pow(value.scale()))).simplify();
    }
}
