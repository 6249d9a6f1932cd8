package com.sysmuse.fuzzy;

public class UndeclaredVariableException extends EvaluationException {

    private final String variable;

    public UndeclaredVariableException(String variable) {
        super("undeclared variable '" + variable + "'");
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
