package com.sysmuse.math.solve;

import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.format.NumberFormatter;
import com.sysmuse.math.numeric.Complex;
import com.sysmuse.math.numeric.NumericEvaluator;
import com.sysmuse.math.numeric.NumericParseException;
import com.sysmuse.util.LoggingUtil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Numeric front end of the calculator: evaluates expressions, solves single
 * linear or quadratic equations in one unknown and square linear systems of
 * up to three equations.
 */
public class MathSolver {

    private static final double EPSILON = 1e-10;
    private static final int MAX_SYSTEM_SIZE = 3;

    private static final Pattern SYSTEM_LINE = Pattern.compile("(.+)=([^=]+)");
    private static final Pattern LETTER = Pattern.compile("[a-zA-Z]");
    private static final Pattern PLAIN_NUMBER = Pattern.compile("-?\\d+(\\.\\d*)?|-?\\.\\d+");

    private final NumericEvaluator evaluator;
    private final NumberFormatter formatter;

    public MathSolver(FormatSettings settings) {
        this.evaluator = new NumericEvaluator(settings);
        this.formatter = new NumberFormatter(settings);
    }

    public FormatSettings getSettings() {
        return evaluator.getSettings();
    }

    /**
     * Classify and solve. A multi-line input is a linear system, an input with '='
     * a single equation, anything else an expression to evaluate.
     *
     * @return the formatted answer, "" when the expression is invalid, or null when
     *         the input cannot be solved (too many unknowns, singular system)
     */
    public String solve(String expression, Map<Integer, String> ansValues) {
        if (expression == null) {
            return null;
        }
        expression = expression.trim();
        if (expression.isEmpty()) {
            return null;
        }

        expression = AnsReferenceResolver.resolve(expression, ansValues);

        if (expression.contains("\n")) {
            List<String> equations = nonEmptyLines(expression);
            Set<String> allVariables = new TreeSet<>();
            for (String eq : equations) {
                allVariables.addAll(VariableFinder.findVariables(eq));
            }
            if (allVariables.size() > equations.size()) {
                LoggingUtil.debug("System has " + allVariables.size() + " unknowns but only "
                        + equations.size() + " equations");
                return null;
            }
            return solveLinearSystem(expression);
        }

        if (expression.contains("=")) {
            if (VariableFinder.findVariables(expression).size() > 1) {
                LoggingUtil.debug("Single equation with several unknowns: " + expression);
                return null;
            }
            return solveEquation(expression);
        }

        return evaluate(expression);
    }

    public String solve(String expression) {
        return solve(expression, null);
    }

    public String evaluate(String expression) {
        return evaluator.evaluate(expression);
    }

    public String formatResult(double value) {
        return formatter.format(value);
    }

    // ---- single equation ----

    /**
     * Solve a linear or quadratic equation in at most one unknown.
     */
    public String solveEquation(String equation) {
        equation = equation.replace(" ", "");

        Set<String> variables = VariableFinder.findVariables(equation);
        if (variables.isEmpty()) {
            // No unknown: report lhs - rhs
            return evaluate(equation.replace("=", "-(") + ")");
        }
        if (variables.size() > 1) {
            return null;
        }

        String variable = variables.iterator().next();
        String[] parts = equation.split("=", -1);
        if (parts.length != 2) {
            return null;
        }

        double[] lhs = getCoefficients(parts[0].trim(), variable);
        double[] rhs = getCoefficients(parts[1].trim(), variable);

        double a = lhs[0] - rhs[0];
        double b = lhs[1] - rhs[1];
        double c = lhs[2] - rhs[2];

        if (Math.abs(a) < EPSILON) {
            if (Math.abs(b) < EPSILON) {
                return Math.abs(c) < EPSILON ? "Infinite solutions" : "No solution";
            }
            return variable + " = " + formatResult(-c / b);
        }

        if (Math.abs(c) < EPSILON) {
            // x(ax + b) = 0
            return variable + " = 0\n" + variable + " = " + formatResult(-b / a);
        }

        double discriminant = b * b - 4 * a * c;
        if (discriminant < 0) {
            double realPart = -b / (2 * a);
            double imagPart = Math.sqrt(-discriminant) / (2 * a);
            return variable + " = " + formatResult(realPart) + " ± " + formatResult(Math.abs(imagPart)) + "i";
        }

        // Citardauq form avoids cancellation when b² dominates
        double root1;
        double root2;
        if (discriminant == 0) {
            root1 = root2 = -b / (2 * a);
        } else {
            double sqrtDisc = Math.sqrt(discriminant);
            if (b >= 0) {
                root1 = (-b - sqrtDisc) / (2 * a);
                root2 = (2 * c) / (-b - sqrtDisc);
            } else {
                root1 = (2 * c) / (-b + sqrtDisc);
                root2 = (-b + sqrtDisc) / (2 * a);
            }
        }

        if (Math.abs(root1 - root2) < EPSILON) {
            return variable + " = " + formatResult(root1);
        }
        return variable + " = " + formatResult(root1) + "\n" + variable + " = " + formatResult(root2);
    }

    /**
     * Coefficients [a, b, c] of a·x² + b·x + c, read term by term.
     */
    double[] getCoefficients(String expression, String variable) {
        double a = 0;
        double b = 0;
        double c = 0;

        String quadSuffix = variable + "^(2)";
        String quadSuffixAlt = variable + "^2";

        for (String term : splitSignedTerms(expression)) {
            if (term.endsWith(quadSuffix) || term.endsWith(quadSuffixAlt)) {
                int suffixLength = term.endsWith(quadSuffix) ? quadSuffix.length() : quadSuffixAlt.length();
                String coeffPart = stripTrailingTimes(term.substring(0, term.length() - suffixLength));
                a += parseCoefficient(coeffPart);
            } else if (term.contains(variable) && !term.contains("^")) {
                int varIndex = term.indexOf(variable);
                String coeffPart = stripTrailingTimes(term.substring(0, varIndex));
                String remainder = term.substring(varIndex + variable.length());
                if ((coeffPart.isEmpty() || coeffPart.equals("+") || coeffPart.equals("-"))
                        && remainder.startsWith("/")) {
                    // x/4 has coefficient 1/4
                    coeffPart = coeffPart + "1" + remainder;
                }
                b += parseCoefficient(coeffPart);
            } else if (!term.contains(variable)) {
                c += parseCoefficient(term);
            }
        }

        return new double[]{a, b, c};
    }

    private static String stripTrailingTimes(String coeff) {
        return coeff.endsWith("*") ? coeff.substring(0, coeff.length() - 1) : coeff;
    }

    /**
     * Split on top-level signs, keeping each sign with its term.
     */
    private static List<String> splitSignedTerms(String expression) {
        expression = expression.replace(" ", "");
        if (!expression.startsWith("+") && !expression.startsWith("-")) {
            expression = "+" + expression;
        }

        List<String> terms = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < expression.length(); i++) {
            char ch = expression.charAt(i);
            if ((ch == '+' || ch == '-') && i > 0) {
                if (current.length() > 0) {
                    terms.add(current.toString().trim());
                }
                current = new StringBuilder().append(ch);
            } else {
                current.append(ch);
            }
        }
        if (current.length() > 0) {
            terms.add(current.toString().trim());
        }
        return terms;
    }

    /**
     * Value of a coefficient string; empty or a bare sign means ±1, unparseable means 0.
     */
    double parseCoefficient(String coeff) {
        coeff = coeff.trim();
        if (coeff.isEmpty() || coeff.equals("+")) return 1.0;
        if (coeff.equals("-")) return -1.0;

        String normalized = coeff.startsWith("+") ? coeff.substring(1) : coeff;
        if (PLAIN_NUMBER.matcher(normalized).matches()) {
            return Double.parseDouble(normalized);
        }

        try {
            Complex value = evaluator.evaluateComplex(normalized);
            return value.isReal() ? value.getReal() : 0.0;
        } catch (NumericParseException | NumberFormatException e) {
            LoggingUtil.debug("Coefficient '" + coeff + "' is not numeric, using 0");
            return 0.0;
        }
    }

    // ---- linear systems ----

    /**
     * Solve a square linear system by Cramer's rule.
     *
     * @return lines "v = value" in alphabetical order of the unknowns, or null when
     *         the system is not square, not linear or has no unique solution
     */
    public String solveLinearSystem(String equationsText) {
        List<String> equations = nonEmptyLines(equationsText.replace(" ", ""));
        if (equations.isEmpty() || equations.size() > MAX_SYSTEM_SIZE) {
            return null;
        }

        List<Map<String, Double>> equationCoefficients = new ArrayList<>();
        List<Double> constants = new ArrayList<>();
        Set<String> variableSet = new TreeSet<>();

        for (String eq : equations) {
            Matcher match = SYSTEM_LINE.matcher(eq);
            if (!match.matches()) {
                LoggingUtil.debug("Not an equation: " + eq);
                return null;
            }

            LinearSide left = parseSide(match.group(1));
            LinearSide right = parseSide(match.group(2));
            if (left == null || right == null) {
                LoggingUtil.debug("Equation is not linear: " + eq);
                return null;
            }

            Map<String, Double> equationMap = new HashMap<>(left.coefficients);
            for (Map.Entry<String, Double> entry : right.coefficients.entrySet()) {
                equationMap.merge(entry.getKey(), -entry.getValue(), Double::sum);
            }

            constants.add(-(left.constant - right.constant));
            equationCoefficients.add(equationMap);
            variableSet.addAll(equationMap.keySet());
        }

        List<String> variables = new ArrayList<>(variableSet);
        if (variables.size() != equations.size()) {
            return null;
        }

        int n = variables.size();
        double[][] coefficients = new double[n][n];
        for (int row = 0; row < n; row++) {
            for (int col = 0; col < n; col++) {
                coefficients[row][col] = equationCoefficients.get(row).getOrDefault(variables.get(col), 0.0);
            }
        }

        double mainDet = Determinants.of(coefficients);
        if (Math.abs(mainDet) < EPSILON) {
            LoggingUtil.debug("System has no unique solution");
            return null;
        }

        List<String> lines = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double[][] replaced = new double[n][];
            for (int row = 0; row < n; row++) {
                replaced[row] = Arrays.copyOf(coefficients[row], n);
                replaced[row][i] = constants.get(row);
            }
            double value = Determinants.of(replaced) / mainDet;
            lines.add(variables.get(i) + " = " + formatResult(value));
        }
        return String.join("\n", lines);
    }

    /**
     * Linear coefficients and constant of one side, or null when a term is not linear.
     */
    private LinearSide parseSide(String side) {
        LinearSide result = new LinearSide();
        if (side.isEmpty()) {
            return result;
        }

        for (String term : splitSignedTerms(side)) {
            if (term.isEmpty() || term.equals("+") || term.equals("-")) continue;
            if (term.contains("^")) return null;

            List<String> letters = new ArrayList<>();
            Matcher m = LETTER.matcher(term);
            while (m.find()) {
                letters.add(m.group());
            }
            if (letters.isEmpty()) {
                result.constant += parseCoefficient(term);
                continue;
            }
            if (letters.size() != 1) return null;

            String varName = letters.get(0);
            if (VariableFinder.RESERVED.contains(varName)) return null;

            String coeffPart = term.replace(varName, "").replace("*", "");
            if (coeffPart.matches("^[+-]?/.*")) {
                coeffPart = coeffPart.replaceFirst("/", "1/");
            }
            result.coefficients.merge(varName, parseCoefficient(coeffPart), Double::sum);
        }
        return result;
    }

    private static List<String> nonEmptyLines(String text) {
        return Arrays.stream(text.split("\n"))
                .filter(line -> !line.trim().isEmpty())
                .collect(Collectors.toList());
    }

    private static class LinearSide {
        final Map<String, Double> coefficients = new HashMap<>();
        double constant = 0.0;
    }
}
