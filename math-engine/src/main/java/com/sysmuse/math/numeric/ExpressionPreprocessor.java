package com.sysmuse.math.numeric;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites calculator input into the plain grammar understood by {@link NumericParser}.
 *
 * Constants become numeric literals, angle units become conversion factors,
 * perm/comb/factorial/sum/prod/diff/int calls are replaced by their values,
 * and implicit multiplication is made explicit.
 */
public class ExpressionPreprocessor {

    /** Upper bound on the terms a numeric sum or product may iterate over. */
    public static final int MAX_SERIES_TERMS = 10_000;

    /** Subdivisions of the composite Simpson rule, must be even. */
    public static final int SIMPSON_INTERVALS = 200;

    private static final String PI = Double.toString(Math.PI);
    private static final String E = Double.toString(Math.E);

    private static final Pattern RADIAN_PATTERN = Pattern.compile("\\*?rad");
    private static final Pattern PI_PATTERN = Pattern.compile("([\\d)₀])?π");
    private static final Pattern EPSILON0_PATTERN = Pattern.compile("([\\d)₀π])?ε₀");
    private static final Pattern MU0_PATTERN = Pattern.compile("([\\d)₀π])?[μµ]₀");
    private static final Pattern C0_PATTERN = Pattern.compile("([\\d)₀π])?c₀");
    private static final Pattern ELECTRON_PATTERN = Pattern.compile("([\\d)₀π])?e⁻");
    private static final Pattern FACTORIAL_PATTERN = Pattern.compile("\\((\\d+)\\)!|(?<![\\d.])(\\d+)!");
    private static final Pattern PLAIN_NUMBER = Pattern.compile("-?\\d+(\\.\\d*)?([eE][+-]?\\d+)?");

    private static final Pattern DIGIT_PAREN = Pattern.compile("(\\d)\\(");
    private static final Pattern PAREN_DIGIT = Pattern.compile("\\)(\\d)");
    private static final Pattern PAREN_I = Pattern.compile("\\)i(?![a-zA-Z])");
    private static final Pattern I_PAREN = Pattern.compile("(?<![a-zA-Z])i\\(");

    public String preprocess(String expr) {
        expr = expr.replace(" ", "");

        expr = expr.replace("·", "*");
        expr = expr.replace("×", "*");
        expr = expr.replace("ᴇ", "E");

        expr = expr.replace("°", "*(" + PI + "/180)");
        expr = RADIAN_PATTERN.matcher(expr).replaceAll(Matcher.quoteReplacement("*((1/" + PI + ")*180)"));

        // πi and iπ before bare π
        expr = expr.replace("πi", "(" + PI + ")*(i)");
        expr = expr.replace("iπ", "(i)*(" + PI + ")");
        expr = expr.replace("π*i", "(" + PI + ")*(i)");
        expr = expr.replace("i*π", "(i)*(" + PI + ")");

        expr = replaceConstant(expr, PI_PATTERN, PI);
        expr = replaceEuler(expr);

        expr = replaceConstant(expr, EPSILON0_PATTERN, "8.8541878128E-12");
        expr = replaceConstant(expr, MU0_PATTERN, "1.25663706212E-6");
        expr = replaceConstant(expr, C0_PATTERN, "299792458");
        expr = replaceConstant(expr, ELECTRON_PATTERN, "1.602176634E-19");

        expr = processPermComb(expr, "perm", true);
        expr = processPermComb(expr, "comb", false);
        expr = processFactorials(expr);
        expr = processSeries(expr, "sum", false);
        expr = processSeries(expr, "prod", true);
        expr = processDerivatives(expr);
        expr = processIntegrals(expr);

        expr = DIGIT_PAREN.matcher(expr).replaceAll("$1*(");
        expr = PAREN_DIGIT.matcher(expr).replaceAll(")*$1");
        expr = expr.replace(")(", ")*(");
        expr = PAREN_I.matcher(expr).replaceAll(")*(i)");
        expr = I_PAREN.matcher(expr).replaceAll("(i)*(");

        return expr;
    }

    /**
     * Replace a constant symbol by its value, multiplying when it follows a digit,
     * a closing parenthesis or a subscript zero.
     */
    private static String replaceConstant(String expr, Pattern pattern, String literal) {
        return pattern.matcher(expr).replaceAll(match -> {
            String before = match.group(1);
            String replacement = before != null ? before + "*(" + literal + ")" : "(" + literal + ")";
            return Matcher.quoteReplacement(replacement);
        });
    }

    /**
     * Replace a standalone {@code e}, one not inside a word and not the {@code e⁻} symbol.
     */
    private static String replaceEuler(String expr) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < expr.length(); i++) {
            char c = expr.charAt(i);
            char prev = i > 0 ? expr.charAt(i - 1) : '\0';
            char next = i + 1 < expr.length() ? expr.charAt(i + 1) : '\0';

            if (c != 'e' || isLetter(prev) || isLetter(next) || next == '⁻') {
                sb.append(c);
                continue;
            }
            if (Character.isDigit(prev) || prev == ')' || prev == '₀') {
                sb.append('*');
            }
            sb.append('(').append(E).append(')');
        }
        return sb.toString();
    }

    private String processPermComb(String expr, String funcName, boolean permutation) {
        String call = funcName + "(";
        int startIndex;
        while ((startIndex = expr.indexOf(call)) >= 0) {
            int openParen = startIndex + funcName.length();
            int closeParen = findMatchingParen(expr, openParen);
            if (closeParen == -1) {
                throw new NumericParseException("Unclosed " + funcName + "(");
            }

            List<String> args = splitTopLevelArgs(expr.substring(openParen + 1, closeParen), 2);
            long n = (long) evaluateSubExpression(args.get(0));
            long r = (long) evaluateSubExpression(args.get(1));
            double result = permutation ? Combinatorics.permutation(n, r) : Combinatorics.combination(n, r);

            expr = expr.substring(0, startIndex) + literal(result) + expr.substring(closeParen + 1);
        }
        return expr;
    }

    private static String processFactorials(String expr) {
        return FACTORIAL_PATTERN.matcher(expr).replaceAll(match -> {
            String digits = match.group(1) != null ? match.group(1) : match.group(2);
            if (digits.length() > 4) {
                throw new NumericParseException("Factorial argument too large: " + digits);
            }
            // Parenthesized so implicit multiplication sees a separate factor
            return "(" + Combinatorics.factorial(Integer.parseInt(digits)) + ")";
        });
    }

    private String processSeries(String expr, String funcName, boolean product) {
        String call = funcName + "(";
        int startIndex;
        while ((startIndex = expr.indexOf(call)) >= 0) {
            int openParen = startIndex + funcName.length();
            int closeParen = findMatchingParen(expr, openParen);
            if (closeParen == -1) {
                throw new NumericParseException("Unclosed " + funcName + "(");
            }

            List<String> args = splitTopLevelArgs(expr.substring(openParen + 1, closeParen), 4);
            String variable = requireVariable(args.get(0), funcName);
            long lower = Math.round(evaluateSubExpression(args.get(1)));
            long upper = Math.round(evaluateSubExpression(args.get(2)));
            String body = args.get(3).trim();

            double result = product ? 1.0 : 0.0;
            if (lower <= upper) {
                if (upper - lower + 1 > MAX_SERIES_TERMS) {
                    throw new NumericParseException(funcName + " range exceeds " + MAX_SERIES_TERMS + " terms");
                }
                for (long i = lower; i <= upper; i++) {
                    double term = evaluateSubExpression(replaceVariable(body, variable, Long.toString(i)));
                    result = product ? result * term : result + term;
                }
            }

            expr = expr.substring(0, startIndex) + literal(result) + expr.substring(closeParen + 1);
        }
        return expr;
    }

    private String processDerivatives(String expr) {
        int startIndex;
        while ((startIndex = expr.indexOf("diff(")) >= 0) {
            int openParen = startIndex + "diff".length();
            int closeParen = findMatchingParen(expr, openParen);
            if (closeParen == -1) {
                throw new NumericParseException("Unclosed diff(");
            }

            List<String> args = splitTopLevelArgs(expr.substring(openParen + 1, closeParen), 3);
            String variable = requireVariable(args.get(0), "diff");
            double at = evaluateSubExpression(args.get(1));
            String body = args.get(2).trim();

            // Central difference
            double h = 1e-6 * Math.max(1.0, Math.abs(at));
            double fPlus = evaluateSubExpression(replaceVariable(body, variable, Double.toString(at + h)));
            double fMinus = evaluateSubExpression(replaceVariable(body, variable, Double.toString(at - h)));
            double result = (fPlus - fMinus) / (2 * h);

            expr = expr.substring(0, startIndex) + literal(result) + expr.substring(closeParen + 1);
        }
        return expr;
    }

    private String processIntegrals(String expr) {
        int startIndex;
        while ((startIndex = expr.indexOf("int(")) >= 0) {
            int openParen = startIndex + "int".length();
            int closeParen = findMatchingParen(expr, openParen);
            if (closeParen == -1) {
                throw new NumericParseException("Unclosed int(");
            }

            List<String> args = splitTopLevelArgs(expr.substring(openParen + 1, closeParen), 4);
            String variable = requireVariable(args.get(0), "int");
            double a = evaluateSubExpression(args.get(1));
            double b = evaluateSubExpression(args.get(2));
            String body = args.get(3).trim();

            double sign = 1.0;
            if (a > b) {
                double temp = a;
                a = b;
                b = temp;
                sign = -1.0;
            }

            // Composite Simpson rule
            double h = (b - a) / SIMPSON_INTERVALS;
            double sum = 0.0;
            for (int i = 0; i <= SIMPSON_INTERVALS; i++) {
                double x = a + h * i;
                double fx = evaluateSubExpression(replaceVariable(body, variable, Double.toString(x)));
                if (i == 0 || i == SIMPSON_INTERVALS) {
                    sum += fx;
                } else if (i % 2 == 0) {
                    sum += 2 * fx;
                } else {
                    sum += 4 * fx;
                }
            }
            double result = sign * (sum * h / 3.0);

            expr = expr.substring(0, startIndex) + literal(result) + expr.substring(closeParen + 1);
        }
        return expr;
    }

    /**
     * Evaluate an argument of perm/comb/sum/prod/diff/int to a real number.
     */
    double evaluateSubExpression(String expr) {
        expr = expr.trim();
        while (expr.startsWith("(") && findMatchingParen(expr, 0) == expr.length() - 1) {
            expr = expr.substring(1, expr.length() - 1).trim();
        }
        if (expr.isEmpty()) {
            throw new NumericParseException("Empty argument");
        }
        if (PLAIN_NUMBER.matcher(expr).matches()) {
            return Double.parseDouble(expr);
        }

        Complex value = new NumericParser(preprocess(expr)).parse();
        if (!value.isReal()) {
            throw new NumericParseException("Complex value where a real number is required: " + expr);
        }
        return value.getReal();
    }

    private static String requireVariable(String arg, String funcName) {
        String variable = arg.trim();
        if (variable.isEmpty()) {
            throw new NumericParseException(funcName + " needs a variable name");
        }
        return variable;
    }

    /**
     * Parenthesized literal so a negative value or a following factor parses as intended.
     */
    static String literal(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new NumericParseException("Non-finite intermediate result");
        }
        if (Math.abs(value - Math.rint(value)) < 1e-10) {
            return "(" + BigDecimal.valueOf(Math.rint(value)).toBigInteger() + ")";
        }
        return "(" + value + ")";
    }

    static String replaceVariable(String body, String variable, String value) {
        Pattern pattern = Pattern.compile("(?<![a-zA-Z_])" + Pattern.quote(variable) + "(?![a-zA-Z0-9_])");
        return pattern.matcher(body).replaceAll(Matcher.quoteReplacement("(" + value + ")"));
    }

    static int findMatchingParen(String expr, int openIndex) {
        if (openIndex >= expr.length() || expr.charAt(openIndex) != '(') return -1;

        int depth = 1;
        for (int i = openIndex + 1; i < expr.length(); i++) {
            char c = expr.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    static List<String> splitTopLevelArgs(String content, int expected) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int lastIndex = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(content.substring(lastIndex, i));
                lastIndex = i + 1;
            }
        }
        parts.add(content.substring(lastIndex));
        if (parts.size() != expected) {
            throw new NumericParseException("Expected " + expected + " arguments but found " + parts.size());
        }
        return parts;
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
