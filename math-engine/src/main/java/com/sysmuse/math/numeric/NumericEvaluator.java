package com.sysmuse.math.numeric;

import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.format.NumberFormatter;
import com.sysmuse.util.LoggingUtil;

/**
 * Evaluates calculator expressions to a double or complex value.
 *
 * Immutable and safe to share. The public methods never throw on bad input:
 * {@link #evaluate(String)} reports failure as an empty string and
 * {@link #evaluateToDouble(String)} as null.
 */
public class NumericEvaluator {

    private final FormatSettings settings;
    private final NumberFormatter formatter;
    private final ExpressionPreprocessor preprocessor;

    public NumericEvaluator(FormatSettings settings) {
        this.settings = settings;
        this.formatter = new NumberFormatter(settings);
        this.preprocessor = new ExpressionPreprocessor();
    }

    public FormatSettings getSettings() {
        return settings;
    }

    /**
     * Evaluate and format, e.g. "2+3*4" gives "14" and "1/0" gives "∞".
     *
     * @return the formatted value, or "" when the expression cannot be evaluated
     */
    public String evaluate(String expression) {
        try {
            Complex value = evaluateComplex(expression);
            return formatter.formatComplex(value.getReal(), value.getImag());
        } catch (NumericParseException | NumberFormatException e) {
            LoggingUtil.debug("Numeric evaluation failed for '" + expression + "': " + e.getMessage());
            return "";
        }
    }

    /**
     * Evaluate to a real number.
     *
     * @return the value, or null when the expression is invalid or its value is complex
     */
    public Double evaluateToDouble(String expression) {
        try {
            Complex value = evaluateComplex(expression);
            if (!value.isReal()) {
                LoggingUtil.debug("Expression '" + expression + "' has a complex value");
                return null;
            }
            return value.getReal();
        } catch (NumericParseException | NumberFormatException e) {
            LoggingUtil.debug("Numeric evaluation failed for '" + expression + "': " + e.getMessage());
            return null;
        }
    }

    /**
     * Evaluate without catching parse errors.
     *
     * @throws NumericParseException if the expression is malformed
     */
    public Complex evaluateComplex(String expression) {
        if (expression == null || expression.trim().isEmpty()) {
            throw new NumericParseException("Empty expression");
        }
        String prepared = preprocessor.preprocess(expression);
        return new NumericParser(prepared).parse();
    }

    public String format(double value) {
        return formatter.format(value);
    }
}
