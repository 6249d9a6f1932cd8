package com.sysmuse.fuzzy;

public class ArityMismatchException extends ExpressionException {

    private final String function;
    private final int expected;
    private final int actual;

    public ArityMismatchException(String function, int expected, int actual, int position) {
        super(describe(function, expected, actual), position);
        this.function = function;
        this.expected = expected;
        this.actual = actual;
    }

    private static String describe(String function, int expected, int actual) {
        String kind = actual < expected ? "missing argument" : "too many arguments";
        return kind + " in call to '" + function + "': expected " + expected + ", got " + actual;
    }

    public String getFunction() {
        return function;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
