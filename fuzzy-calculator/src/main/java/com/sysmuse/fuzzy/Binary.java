package com.sysmuse.fuzzy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Flat chain of operands and infix operators: {@code L op L op ... L}.
 * <p>
 * Nesting (function calls, parentheses, precedence groups) is pushed down into
 * {@link MacroNode}s, so every level of an expression is one {@code Binary}.
 * The chain is built once, rewritten in place by {@link MinusNormalizer} and
 * {@link PrecedenceFolder}, then only read. Once normalized it always has odd length
 * and strictly alternates operand and operator.
 */
public final class Binary {

    private final List<Node> nodes;

    public Binary(List<? extends Node> nodes) {
        this.nodes = new ArrayList<>(nodes);
    }

    public Binary() {
        this.nodes = new ArrayList<>();
    }

    public static Binary of(Node... nodes) {
        return new Binary(List.of(nodes));
    }

    public List<Node> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public Node get(int index) {
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    void replaceNodes(List<Node> replacement) {
        nodes.clear();
        nodes.addAll(replacement);
    }

    void prepend(Node node) {
        nodes.add(0, node);
    }

    /**
     * Odd length, operand first and last, operators in between.
     */
    public boolean isAlternating() {
        if (nodes.size() % 2 == 0) {
            return false;
        }
        for (int i = 0; i < nodes.size(); i++) {
            boolean expectOperand = i % 2 == 0;
            if (nodes.get(i).isOperand() != expectOperand) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when this chain and every chain nested in its macros alternate.
     */
    public boolean isAlternatingDeep() {
        if (!isAlternating()) {
            return false;
        }
        for (Node node : nodes) {
            if (node instanceof MacroNode) {
                for (Binary argument : ((MacroNode) node).getArguments()) {
                    if (!argument.isAlternatingDeep()) return false;
                }
            }
        }
        return true;
    }

    public List<Operator> getOperators() {
        List<Operator> operators = new ArrayList<>();
        for (Node node : nodes) {
            if (node instanceof Operator) operators.add((Operator) node);
        }
        return operators;
    }

    /**
     * Compact infix rendering, e.g. {@code 0-(2*x*cos((3.1415*t)-1.))}.
     */
    public String toExpression() {
        StringBuilder sb = new StringBuilder();
        for (Node node : nodes) {
            sb.append(node);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return nodes.toString();
    }
}
