package com.sysmuse.math.numeric;

/**
 * Raised inside the numeric parser when the input is not a valid expression.
 * Public entry points catch it and report an empty result.
 */
public class NumericParseException extends RuntimeException {

    public NumericParseException(String message) {
        super(message);
    }

    public NumericParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
