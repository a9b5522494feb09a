package com.sysmuse.math.solve;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the unknowns in a serialized expression.
 */
public final class VariableFinder {

    /** Function names and constants that are never unknowns. */
    public static final Set<String> RESERVED = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "sin", "cos", "tan", "asin", "acos", "atan",
            "sinh", "cosh", "tanh", "asinh", "acosh", "atanh",
            "log", "ln", "sqrt", "abs", "arg", "re", "im", "sgn", "exp",
            "diff", "int", "sum", "prod", "perm", "comb", "ans", "e", "pi", "i")));

    private static final Pattern LETTERS = Pattern.compile("[a-zA-Z]+");

    private VariableFinder() {
    }

    /**
     * Variables in order of first appearance. An unknown run of several letters,
     * such as "xy", counts each letter separately.
     */
    public static Set<String> findVariables(String expression) {
        Set<String> variables = new LinkedHashSet<>();

        Matcher matcher = LETTERS.matcher(expression);
        while (matcher.find()) {
            String word = matcher.group();
            if (RESERVED.contains(word.toLowerCase(Locale.ROOT))) {
                continue;
            }
            if (word.length() == 1) {
                variables.add(word);
                continue;
            }
            for (char c : word.toCharArray()) {
                String letter = String.valueOf(c);
                if (!RESERVED.contains(letter.toLowerCase(Locale.ROOT))) {
                    variables.add(letter);
                }
            }
        }
        return variables;
    }
}
