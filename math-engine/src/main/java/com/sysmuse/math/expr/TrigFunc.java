package com.sysmuse.math.expr;

import java.util.Locale;

public enum TrigFunc {
    SIN, COS, TAN,
    ASIN, ACOS, ATAN,
    SINH, COSH, TANH,
    ASINH, ACOSH, ATANH;

    /**
     * Name as typed by the user, e.g. "asin".
     */
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TrigFunc fromName(String name) {
        if (name == null) {
            return null;
        }
        for (TrigFunc func : values()) {
            if (func.getName().equals(name)) {
                return func;
            }
        }
        return null;
    }
}
