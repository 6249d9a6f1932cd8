package com.sysmuse.fuzzy;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes every unary use of '-' from a chain and from all chains nested in it.
 * <ol>
 *   <li>A chain opening with '-' gets an explicit zero: {@code -x} becomes {@code 0-x}.
 *       No other operator may open a chain.</li>
 *   <li>An operator directly followed by '-' absorbs the minus and its operand into
 *       {@code opp(...)}: {@code 2^-4} becomes {@code 2^opp(4)}. The power case is the
 *       documented use; any other operator followed by '-' is accepted as an ambiguity.</li>
 * </ol>
 * Afterwards every operator has exactly two operands.
 */
public class MinusNormalizer {

    private static final int MIN_OPPOSITE_WINDOW = 4;

    private final OperationRegistry registry;
    private final Diagnostics diagnostics;

    public MinusNormalizer(OperationRegistry registry, Diagnostics diagnostics) {
        this.registry = registry;
        this.diagnostics = diagnostics;
    }

    public MinusNormalizer(OperationRegistry registry) {
        this(registry, new Diagnostics());
    }

    public void normalize(Binary binary) {
        addExplicitZeros(binary);
        wrapOpposites(binary);
    }

    void addExplicitZeros(Binary binary) {
        if (!binary.isEmpty() && binary.get(0).isOperator()) {
            Operator leading = (Operator) binary.get(0);
            if (!leading.is(NumericOperations.MINUS)) {
                throw new SyntaxException("operator '" + leading.getSymbol()
                        + "' cannot open an expression; only '-' has an implicit left operand", leading.getPosition());
            }
            binary.prepend(Leaf.number("0", ExpressionException.UNKNOWN_POSITION));
        }

        for (Node node : binary.getNodes()) {
            if (node instanceof MacroNode) {
                for (Binary argument : ((MacroNode) node).getArguments()) {
                    addExplicitZeros(argument);
                }
            }
        }
    }

    void wrapOpposites(Binary binary) {
        if (binary.size() >= MIN_OPPOSITE_WINDOW) {
            List<Node> nodes = binary.getNodes();
            List<Node> rewritten = new ArrayList<>(nodes.size());
            int n = 0;
            while (n < nodes.size()) {
                Node current = nodes.get(n);
                Node next = n + 1 < nodes.size() ? nodes.get(n + 1) : null;
                if (current.isOperator() && next != null && next.isOperator()) {
                    Operator first = (Operator) current;
                    Operator second = (Operator) next;
                    if (!second.is(NumericOperations.MINUS)) {
                        throw new MalformedTreeException("operators '" + first.getSymbol() + "' and '"
                                + second.getSymbol() + "' are adjacent; the builder should have rejected this");
                    }
                    if (n + 2 >= nodes.size() || !nodes.get(n + 2).isOperand()) {
                        throw new MalformedTreeException("'" + first.getSymbol() + "-' is not followed by an operand");
                    }
                    if (!first.is("^")) {
                        diagnostics.ambiguity("'" + first.getSymbol() + "-' reads the minus as the opposite of the next operand;"
                                + " use parentheses to make it explicit", second.getPosition());
                    }
                    rewritten.add(first);
                    rewritten.add(opposite(nodes.get(n + 2), second.getPosition()));
                    n += 3;
                } else {
                    rewritten.add(current);
                    n++;
                }
            }
            binary.replaceNodes(rewritten);
        }

        for (Node node : binary.getNodes()) {
            if (node instanceof MacroNode) {
                for (Binary argument : ((MacroNode) node).getArguments()) {
                    wrapOpposites(argument);
                }
            }
        }
    }

    private MacroNode opposite(Node operand, int position) {
        int arity = registry.getFunction(NumericOperations.OPPOSITE).getArity();
        return new MacroNode(NumericOperations.OPPOSITE, arity, List.of(Binary.of(operand)), position);
    }
}
