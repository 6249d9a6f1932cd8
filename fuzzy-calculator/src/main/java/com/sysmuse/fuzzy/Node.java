package com.sysmuse.fuzzy;

/**
 * Element of a {@link Binary} chain: an operand ({@link Leaf}, {@link MacroNode})
 * or an {@link Operator}.
 */
public interface Node {

    NodeType getNodeType();

    /**
     * Position of the originating token in the source text, -1 for synthetic nodes.
     */
    int getPosition();

    default boolean isOperand() {
        return getNodeType() != NodeType.OPERATOR;
    }

    default boolean isOperator() {
        return getNodeType() == NodeType.OPERATOR;
    }
}
