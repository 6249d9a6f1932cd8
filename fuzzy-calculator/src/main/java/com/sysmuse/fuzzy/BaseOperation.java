package com.sysmuse.fuzzy;

import java.util.List;

/**
 * A named function of a fixed number of numeric arguments.
 * The argument names give the arity and are used by custom operations to bind their body.
 */
public class BaseOperation {

    private final String name;
    private final List<String> argNames;
    private final NumericOperation implementation;

    public BaseOperation(String name, List<String> argNames, NumericOperation implementation) {
        this.name = name;
        this.argNames = List.copyOf(argNames);
        this.implementation = implementation;
    }

    public String getName() {
        return name;
    }

    public List<String> getArgNames() {
        return argNames;
    }

    public int getArity() {
        return argNames.size();
    }

    public double apply(double... args) {
        if (args.length != getArity()) {
            throw new ArityMismatchException(name, getArity(), args.length, ExpressionException.UNKNOWN_POSITION);
        }
        return implementation.apply(args);
    }

    @Override
    public String toString() {
        return name + argNames;
    }
}
