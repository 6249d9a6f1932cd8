package com.sysmuse.fuzzy.binding;

/**
 * Source of variable values during evaluation. An implementation may return a fixed
 * value or draw a new sample on every call; the evaluator calls it once per occurrence
 * of the variable, right to left within a chain.
 */
@FunctionalInterface
public interface VariableBindings {

    /**
     * @throws com.sysmuse.fuzzy.UndeclaredVariableException when the name is not bound
     */
    double resolve(String name);
}
