package com.sysmuse.fuzzy;

import java.util.List;

/**
 * A two-operand operator written between its operands. Higher priority binds tighter.
 */
public class InfixOperation extends BaseOperation {

    private final int priority;

    public InfixOperation(String symbol, int priority, NumericOperation implementation) {
        this(symbol, priority, List.of("left", "right"), implementation);
    }

    public InfixOperation(String symbol, int priority, List<String> argNames, NumericOperation implementation) {
        super(symbol, argNames, implementation);
        if (argNames.size() != 2) {
            throw new IllegalArgumentException("Infix operator '" + symbol + "' must take exactly 2 arguments, got " + argNames);
        }
        this.priority = priority;
    }

    public String getSymbol() {
        return getName();
    }

    public int getPriority() {
        return priority;
    }

    public double apply(double left, double right) {
        return super.apply(left, right);
    }
}
