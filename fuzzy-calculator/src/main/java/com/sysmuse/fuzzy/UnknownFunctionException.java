package com.sysmuse.fuzzy;

public class UnknownFunctionException extends EvaluationException {

    private final String name;

    public UnknownFunctionException(String kind, String name, int position) {
        super("unknown " + kind + " '" + name + "'", position);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
