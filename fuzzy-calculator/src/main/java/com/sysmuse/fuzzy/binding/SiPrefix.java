package com.sysmuse.fuzzy.binding;

/**
 * SI multipliers accepted on bound values: {@code 10 k} is 10000.
 * Micro is written 'u'.
 */
public enum SiPrefix {
    FEMTO("f", 1e-15),
    PICO("p", 1e-12),
    NANO("n", 1e-9),
    MICRO("u", 1e-6),
    MILLI("m", 1e-3),
    NONE("", 1),
    KILO("k", 1e3),
    MEGA("M", 1e6),
    GIGA("G", 1e9),
    TERA("T", 1e12);

    private final String symbol;
    private final double factor;

    SiPrefix(String symbol, double factor) {
        this.symbol = symbol;
        this.factor = factor;
    }

    public String getSymbol() {
        return symbol;
    }

    public double getFactor() {
        return factor;
    }

    public double apply(double value) {
        return value * factor;
    }

    /**
     * Case sensitive: "m" is milli, "M" is mega. Null or empty means no prefix.
     */
    public static SiPrefix fromSymbol(String symbol) {
        if (symbol == null || symbol.isEmpty()) {
            return NONE;
        }
        for (SiPrefix prefix : values()) {
            if (prefix.symbol.equals(symbol)) {
                return prefix;
            }
        }
        throw new IllegalArgumentException("Unknown SI prefix: '" + symbol + "'");
    }
}
