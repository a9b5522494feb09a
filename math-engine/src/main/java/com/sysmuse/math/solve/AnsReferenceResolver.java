package com.sysmuse.math.solve;

import java.util.Collections;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code ans<N>} references in expression text with the answers of earlier cells.
 */
public final class AnsReferenceResolver {

    private static final Pattern ANS = Pattern.compile("ans(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d*)?([eEᴇ][+-]?\\d+)?");
    private static final Pattern ASSIGNED_NUMBER = Pattern.compile("=\\s*(-?\\d+\\.?\\d*)");
    private static final String UNRESOLVED = "(0)";

    private AnsReferenceResolver() {
    }

    /**
     * Substitute each reference by its parenthesized value. A reference to a missing,
     * empty or non-numeric answer becomes (0); a multi-line answer such as
     * "x = 2\ny = 1" contributes its first assigned number.
     *
     * @param ansValues answers by cell index; null is read as no answers
     */
    public static String resolve(String expression, Map<Integer, String> ansValues) {
        Map<Integer, String> answers = ansValues == null ? Collections.emptyMap() : ansValues;
        return ANS.matcher(expression).replaceAll(match ->
                Matcher.quoteReplacement(lookup(match.group(1), answers)));
    }

    private static String lookup(String indexText, Map<Integer, String> ansValues) {
        if (indexText.length() > 9) {
            return UNRESOLVED;
        }
        String value = ansValues.get(Integer.parseInt(indexText));
        if (value == null || value.trim().isEmpty()) {
            return UNRESOLVED;
        }

        String plain = value.trim().replace(",", "");
        if (NUMBER.matcher(plain).matches()) {
            return "(" + plain + ")";
        }

        for (String line : value.split("\n")) {
            Matcher numMatch = ASSIGNED_NUMBER.matcher(line.replace(",", ""));
            if (numMatch.find()) {
                return "(" + numMatch.group(1) + ")";
            }
        }
        return UNRESOLVED;
    }
}
