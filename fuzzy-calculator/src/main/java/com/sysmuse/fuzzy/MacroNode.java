package com.sysmuse.fuzzy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function applied to one or more sub-expressions. Plain parentheses and the groups
 * created by {@link PrecedenceFolder} use the identity function {@code id};
 * negation introduced by {@link MinusNormalizer} uses {@code opp}.
 * <p>
 * Owns its argument chains; nothing else references them.
 */
public final class MacroNode implements Node {

    private final String function;
    private final List<Binary> arguments;
    private final int position;

    /**
     * @throws ArityMismatchException when the number of arguments differs from the declared arity
     */
    public MacroNode(String function, int arity, List<Binary> arguments, int position) {
        if (arguments.size() != arity) {
            throw new ArityMismatchException(function, arity, arguments.size(), position);
        }
        this.function = function;
        this.arguments = new ArrayList<>(arguments);
        this.position = position;
    }

    /**
     * Single-argument macro wrapping one chain.
     */
    public static MacroNode of(String function, Binary argument, int position) {
        return new MacroNode(function, 1, List.of(argument), position);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.MACRO;
    }

    @Override
    public int getPosition() {
        return position;
    }

    public String getFunction() {
        return function;
    }

    public List<Binary> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    public int getArity() {
        return arguments.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (!NumericOperations.IDENTITY.equals(function)) {
            sb.append(function);
        }
        sb.append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(arguments.get(i).toExpression());
        }
        return sb.append(')').toString();
    }
}
