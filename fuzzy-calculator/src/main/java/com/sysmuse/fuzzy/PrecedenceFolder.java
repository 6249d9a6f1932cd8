package com.sysmuse.fuzzy;

import com.sysmuse.fuzzy.util.LoggingUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups operators by priority until every chain holds operators of a single priority.
 * <p>
 * Each pass isolates the maximal runs {@code L op L op ... L} whose operators all have the
 * highest priority present and replaces each run with an {@code id(...)} macro holding it.
 * A pass removes one priority level, so the loop ends after at most as many passes as there
 * are distinct priorities. Runs are grouped as a whole, not pairwise, and no operator is
 * assumed commutative.
 * <pre>
 * a * b + c / d ^ e + f   ->   a * b + c / id(d ^ e) + f   ->   id(a * b) + id(c / id(d ^ e)) + f
 * </pre>
 */
public class PrecedenceFolder {

    public void fold(Binary binary) {
        checkShape(binary);

        for (Node node : binary.getNodes()) {
            if (node instanceof MacroNode) {
                for (Binary argument : ((MacroNode) node).getArguments()) {
                    fold(argument);
                }
            }
        }

        int[] range = priorityRange(binary.getNodes());
        while (range[0] != range[1]) {
            binary.replaceNodes(groupTopPriority(binary.getNodes(), range[1]));
            range = priorityRange(binary.getNodes());
        }

        if (LoggingUtil.isDebugEnabled()) {
            LoggingUtil.debug("Folded chain: " + binary.toExpression());
        }
    }

    /**
     * Lowest and highest priority among the operators; equal (0, 0) when there are none.
     */
    static int[] priorityRange(List<Node> nodes) {
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (Node node : nodes) {
            if (node instanceof Operator) {
                int priority = ((Operator) node).getPriority();
                min = Math.min(min, priority);
                max = Math.max(max, priority);
            }
        }
        if (min == Integer.MAX_VALUE) {
            return new int[]{0, 0};
        }
        return new int[]{min, max};
    }

    /**
     * Replaces every run of operators at {@code priority} (with its surrounding operands)
     * by a single identity macro; everything else is copied unchanged.
     */
    static List<Node> groupTopPriority(List<Node> nodes, int priority) {
        int size = nodes.size();
        boolean[] top = new boolean[size];
        for (int n = 0; n < size; n++) {
            Node node = nodes.get(n);
            if (node instanceof Operator) {
                int p = ((Operator) node).getPriority();
                if (p > priority) {
                    throw new MalformedTreeException("operator '" + node + "' is above the highest priority " + priority);
                }
                if (p == priority) {
                    top[n - 1] = true;
                    top[n] = true;
                    top[n + 1] = true;
                }
            }
        }

        List<Node> grouped = new ArrayList<>();
        int start = 0;
        for (int n = 1; n <= size; n++) {
            if (n == size || top[n] != top[start]) {
                List<Node> chunk = nodes.subList(start, n);
                if (top[start] && chunk.size() > 1) {
                    grouped.add(MacroNode.of(NumericOperations.IDENTITY, new Binary(chunk), chunk.get(0).getPosition()));
                } else {
                    grouped.addAll(chunk);
                }
                start = n;
            }
        }
        return grouped;
    }

    private static void checkShape(Binary binary) {
        if (binary.size() % 2 == 0) {
            throw new MalformedTreeException("chain to fold must have an odd number of nodes, got "
                    + binary.size() + ": " + binary);
        }
        if (!binary.isAlternating()) {
            throw new MalformedTreeException("chain to fold must alternate operand and operator: " + binary);
        }
    }
}
