package com.sysmuse.fuzzy;

import com.sysmuse.fuzzy.binding.VariableBindings;

import java.util.List;

/**
 * Computes the value of a folded chain.
 * <p>
 * All operators of a folded chain share one priority, and the chain is evaluated from the
 * right: the rightmost operand first, then each operator combines the operand on its left
 * with the value accumulated so far. {@code a - b - c} therefore means {@code a - (b - c)}.
 * Operators are not assumed left-associative, and samplers bound to variables are drawn in
 * this order, so a given seed always reproduces the same result.
 * Function arguments are evaluated in the same right-to-left order.
 */
public class Evaluator {

    private final OperationRegistry registry;

    public Evaluator(OperationRegistry registry) {
        this.registry = registry;
    }

    public double evaluate(Binary binary, VariableBindings bindings) {
        int size = binary.size();
        if (size == 0 || size % 2 == 0) {
            throw new MalformedTreeException("cannot evaluate a chain of " + size + " nodes: " + binary);
        }

        double value = evaluateOperand(binary.get(size - 1), bindings);
        for (int n = size - 2; n >= 1; n -= 2) {
            Node node = binary.get(n);
            if (!(node instanceof Operator)) {
                throw new MalformedTreeException("expected an operator at index " + n + " of " + binary);
            }
            double left = evaluateOperand(binary.get(n - 1), bindings);
            value = applyInfix((Operator) node, left, value);
        }
        return value;
    }

    double evaluateOperand(Node node, VariableBindings bindings) {
        switch (node.getNodeType()) {
            case LEAF:
                return evaluateLeaf((Leaf) node, bindings);
            case MACRO:
                return evaluateMacro((MacroNode) node, bindings);
            default:
                throw new MalformedTreeException("expected an operand but found operator '" + node + "'");
        }
    }

    private double evaluateLeaf(Leaf leaf, VariableBindings bindings) {
        switch (leaf.getKind()) {
            case NUMBER:
                return leaf.getNumberValue();
            case CONSTANT:
                if (leaf.getConstantValue() == null) {
                    throw new EvaluationException("constant '" + leaf.getText() + "' has no real value", leaf.getPosition());
                }
                return leaf.getConstantValue();
            case VARIABLE:
                return bindings.resolve(leaf.getText());
            default:
                throw new MalformedTreeException("leaf of unexpected kind " + leaf.getKind());
        }
    }

    private double evaluateMacro(MacroNode macro, VariableBindings bindings) {
        BaseOperation op = registry.getFunction(macro.getFunction());
        if (op == null) {
            throw new UnknownFunctionException("function", macro.getFunction(), macro.getPosition());
        }
        List<Binary> arguments = macro.getArguments();
        if (arguments.size() != op.getArity()) {
            throw new ArityMismatchException(macro.getFunction(), op.getArity(), arguments.size(), macro.getPosition());
        }

        double[] values = new double[arguments.size()];
        for (int i = arguments.size() - 1; i >= 0; i--) {
            values[i] = evaluate(arguments.get(i), bindings);
        }
        try {
            return op.apply(values);
        } catch (EvaluationException e) {
            throw locate(e, "'" + macro.getFunction() + "'", macro.getPosition());
        }
    }

    private double applyInfix(Operator operator, double left, double right) {
        InfixOperation op = registry.getInfix(operator.getSymbol());
        if (op == null) {
            throw new UnknownFunctionException("infix operator", operator.getSymbol(), operator.getPosition());
        }
        try {
            return op.apply(left, right);
        } catch (EvaluationException e) {
            throw locate(e, "'" + operator.getSymbol() + "'", operator.getPosition());
        }
    }

    /**
     * Attaches the position of the applied operation to an error raised without one.
     */
    private static EvaluationException locate(EvaluationException e, String what, int position) {
        if (e.hasPosition() || position < 0 || e.getClass() != EvaluationException.class) {
            return e;
        }
        return new EvaluationException(e.getMessage() + " in " + what, position, e);
    }
}
