package com.sysmuse.math.expr;

/**
 * Named constants known to the exact engine.
 */
public enum ConstType {
    PI("π", Math.PI, true),
    E("e", Math.E, true),
    PHI("φ", (1 + Math.sqrt(5)) / 2, true),
    EPSILON0("ε₀", 8.8541878128e-12, false),  // vacuum permittivity, F/m
    MU0("μ₀", 1.25663706212e-6, false),       // vacuum permeability, H/m
    C0("c₀", 299792458.0, false),             // speed of light, m/s
    E_MINUS("e⁻", 1.602176634e-19, false);    // elementary charge, C

    private final String symbol;
    private final double value;
    private final boolean plainLiteral;

    ConstType(String symbol, double value, boolean plainLiteral) {
        this.symbol = symbol;
        this.value = value;
        this.plainLiteral = plainLiteral;
    }

    public String getSymbol() {
        return symbol;
    }

    public double getValue() {
        return value;
    }

    /**
     * Mathematical constants render as plain text, physical ones as a constant node.
     */
    public boolean isPlainLiteral() {
        return plainLiteral;
    }

    public static ConstType fromSymbol(String symbol) {
        if ("µ₀".equals(symbol)) {
            return MU0;
        }
        for (ConstType type : values()) {
            if (type.symbol.equals(symbol)) {
                return type;
            }
        }
        return null;
    }
}
