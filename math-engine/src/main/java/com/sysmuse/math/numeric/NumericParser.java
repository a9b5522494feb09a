package com.sysmuse.math.numeric;

import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent evaluator for preprocessed expression strings.
 *
 * Grammar, lowest precedence first: add/subtract, multiply/divide, power,
 * unary sign, primary. A primary is a parenthesized group, the imaginary unit
 * {@code i}, a function call or a number; any primary may carry a trailing {@code %}.
 */
class NumericParser {

    private static final List<String> FUNCTIONS = List.of(
            "sinh", "cosh", "tanh", "asinh", "acosh", "atanh",
            "sin", "cos", "tan", "asin", "acos", "atan",
            "log", "ln", "sqrt", "abs", "arg", "re", "im", "sgn", "exp");

    private static final double LN10 = Math.log(10);

    private final String expression;
    private int pos = 0;

    NumericParser(String expression) {
        this.expression = expression;
    }

    /**
     * Parse the whole input.
     *
     * @throws NumericParseException if the input is malformed or has trailing characters
     */
    Complex parse() {
        Operand result = parseAddSubtract();
        if (pos < expression.length()) {
            throw new NumericParseException("Unexpected character at position " + pos + ": " + expression.charAt(pos));
        }
        return result.resolve().demote();
    }

    private Operand parseAddSubtract() {
        Operand left = parseMultiplyDivide();

        while (pos < expression.length()) {
            char op = currentChar();
            if (op != '+' && op != '-') break;
            pos++;
            Operand right = parseMultiplyDivide();

            Complex l;
            Complex r;
            if (right.isPercent() && !left.isPercent()) {
                // 200 + 10% = 220
                l = left.raw();
                r = right.percentOf(l);
            } else if (left.isPercent() && !right.isPercent()) {
                // 50% + 100 = 150
                r = right.raw();
                l = left.percentOf(r);
            } else {
                l = left.resolve();
                r = right.resolve();
            }

            left = Operand.of((op == '+' ? l.plus(r) : l.minus(r)).demote());
        }

        return left;
    }

    private Operand parseMultiplyDivide() {
        Operand left = parsePower();

        while (pos < expression.length()) {
            char op = currentChar();
            if (op != '*' && op != '/') break;
            pos++;
            Complex l = left.resolve();
            Complex r = parsePower().resolve();

            if (op == '/' && l.isReal() && r.isReal() && r.getReal() == 0) {
                double numerator = l.getReal();
                if (numerator == 0 || Double.isNaN(numerator)) {
                    left = Operand.of(Complex.ofReal(Double.NaN));
                } else {
                    left = Operand.of(Complex.ofReal(numerator < 0 ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY));
                }
                continue;
            }

            left = Operand.of((op == '*' ? l.times(r) : l.dividedBy(r)).demote());
        }

        return left;
    }

    private Operand parsePower() {
        Operand base = parseUnary();

        while (pos < expression.length() && currentChar() == '^') {
            pos++;
            Complex exponent = parseUnary().resolve();
            Complex b = base.resolve();

            Complex result;
            if (isEuler(b)) {
                result = exponent.exp();
            } else if (!b.isReal() || !exponent.isReal()) {
                result = b.pow(exponent);
            } else {
                result = Complex.ofReal(Math.pow(b.getReal(), exponent.getReal()));
            }
            base = Operand.of(result.demote());
        }

        return base;
    }

    private static boolean isEuler(Complex value) {
        return Math.abs(value.getReal() - Math.E) < 1e-9 && Math.abs(value.getImag()) < 1e-9;
    }

    private Operand parseUnary() {
        if (pos < expression.length()) {
            if (currentChar() == '-') {
                pos++;
                return parseUnary().negate();
            }
            if (currentChar() == '+') {
                pos++;
                return parseUnary();
            }
        }
        return parsePrimary();
    }

    private Operand parsePrimary() {
        if (currentChar() == '(') {
            pos++;
            Complex result = parseAddSubtract().resolve();
            if (currentChar() != ')') {
                throw new NumericParseException("Missing closing parenthesis");
            }
            pos++;
            return withPercent(result);
        }

        if (currentChar() == 'i' && isStandaloneI()) {
            pos++;
            return withPercent(Complex.I);
        }

        String func = tryParseFunction();
        if (func != null) {
            pos++; // '('
            Complex arg = parseAddSubtract().resolve();
            if (currentChar() != ')') {
                throw new NumericParseException("Missing closing parenthesis for " + func);
            }
            pos++;
            return withPercent(applyFunction(func, arg).demote());
        }

        return withPercent(parseNumber());
    }

    private Operand withPercent(Complex value) {
        if (pos < expression.length() && currentChar() == '%') {
            pos++;
            return Operand.percent(value);
        }
        return Operand.of(value);
    }

    private boolean isStandaloneI() {
        if (currentChar() != 'i') return false;
        if (pos > 0 && isLetter(expression.charAt(pos - 1))) return false;
        return pos + 1 >= expression.length() || !isLetter(expression.charAt(pos + 1));
    }

    private String tryParseFunction() {
        for (String func : FUNCTIONS) {
            int end = pos + func.length();
            if (end < expression.length()
                    && expression.substring(pos, end).toLowerCase(Locale.ROOT).equals(func)
                    && expression.charAt(end) == '(') {
                pos = end;
                return func;
            }
        }
        return null;
    }

    private Complex parseNumber() {
        int start = pos;

        boolean hasDigits = false;
        while (pos < expression.length() && isDigit(currentChar())) {
            hasDigits = true;
            pos++;
        }
        if (pos < expression.length() && currentChar() == '.') {
            pos++;
            while (pos < expression.length() && isDigit(currentChar())) {
                hasDigits = true;
                pos++;
            }
        }

        if (!hasDigits) {
            throw new NumericParseException("Expected number at position " + start);
        }

        // Scientific notation: 1.5E-3
        if (pos + 1 < expression.length() && (currentChar() == 'e' || currentChar() == 'E')) {
            char next = expression.charAt(pos + 1);
            boolean signed = (next == '+' || next == '-')
                    && pos + 2 < expression.length() && isDigit(expression.charAt(pos + 2));
            if (isDigit(next) || signed) {
                pos += signed ? 2 : 1;
                while (pos < expression.length() && isDigit(currentChar())) {
                    pos++;
                }
            }
        }

        double value = Double.parseDouble(expression.substring(start, pos));

        // Imaginary coefficient: 2i, 3.5i
        if (pos < expression.length() && currentChar() == 'i' && isStandaloneI()) {
            pos++;
            return new Complex(0, value);
        }
        return Complex.ofReal(value);
    }

    private Complex applyFunction(String func, Complex arg) {
        if (!arg.isReal()) {
            return applyComplexFunction(func, arg);
        }

        double a = arg.getReal();
        switch (func) {
            case "sin":
                return Complex.ofReal(Math.sin(a));
            case "cos":
                return Complex.ofReal(Math.cos(a));
            case "tan":
                return Complex.ofReal(Math.tan(a));
            case "asin":
                return Complex.ofReal(Math.asin(a));
            case "acos":
                return Complex.ofReal(Math.acos(a));
            case "atan":
                return Complex.ofReal(Math.atan(a));
            case "sinh":
                return Complex.ofReal(Math.sinh(a));
            case "cosh":
                return Complex.ofReal(Math.cosh(a));
            case "tanh":
                return Complex.ofReal(Math.tanh(a));
            case "asinh":
                return Complex.ofReal(Math.log(a + Math.sqrt(a * a + 1)));
            case "acosh":
                return Complex.ofReal(Math.log(a + Math.sqrt(a * a - 1)));
            case "atanh":
                return Complex.ofReal(0.5 * Math.log((1 + a) / (1 - a)));
            case "log":
                return Complex.ofReal(Math.log(a) / LN10);
            case "ln":
                return Complex.ofReal(Math.log(a));
            case "sqrt":
                return a < 0 ? new Complex(0, Math.sqrt(-a)) : Complex.ofReal(Math.sqrt(a));
            case "abs":
                return Complex.ofReal(Math.abs(a));
            case "arg":
                return Complex.ofReal(Math.atan2(0.0, a));
            case "re":
                return Complex.ofReal(a);
            case "im":
                return Complex.ofReal(0.0);
            case "sgn":
                return Complex.ofReal(Math.signum(a));
            case "exp":
                return Complex.ofReal(Math.exp(a));
            default:
                throw new NumericParseException("Unknown function: " + func);
        }
    }

    private Complex applyComplexFunction(String func, Complex z) {
        switch (func) {
            case "abs":
                return Complex.ofReal(z.magnitude());
            case "arg":
                return Complex.ofReal(z.phase());
            case "re":
                return Complex.ofReal(z.getReal());
            case "im":
                return Complex.ofReal(z.getImag());
            case "sgn":
                return z.dividedBy(Complex.ofReal(z.magnitude()));
            case "exp":
                return z.exp();
            case "ln":
                return z.ln();
            case "log":
                return z.ln().scale(1 / LN10);
            case "sqrt":
                return z.sqrt();
            case "sin": {
                // sin(z) = (e^(iz) - e^(-iz)) / 2i
                Complex diff = Complex.I.times(z).exp().minus(Complex.I.times(z).negate().exp());
                return new Complex(diff.getImag() / 2, -diff.getReal() / 2);
            }
            case "cos": {
                // cos(z) = (e^(iz) + e^(-iz)) / 2
                Complex sum = Complex.I.times(z).exp().plus(Complex.I.times(z).negate().exp());
                return sum.scale(0.5);
            }
            case "tan":
                return applyComplexFunction("sin", z).dividedBy(applyComplexFunction("cos", z));
            case "sinh":
                return z.exp().minus(z.negate().exp()).scale(0.5);
            case "cosh":
                return z.exp().plus(z.negate().exp()).scale(0.5);
            case "tanh":
                return applyComplexFunction("sinh", z).dividedBy(applyComplexFunction("cosh", z));
            default:
                throw new NumericParseException("Complex function not implemented: " + func);
        }
    }

    private char currentChar() {
        return pos < expression.length() ? expression.charAt(pos) : '\0';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
