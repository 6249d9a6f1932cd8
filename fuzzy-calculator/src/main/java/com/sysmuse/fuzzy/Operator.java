package com.sysmuse.fuzzy;

public final class Operator implements Node {

    private final String symbol;
    private final int priority;
    private final int position;

    public Operator(String symbol, int priority, int position) {
        this.symbol = symbol;
        this.priority = priority;
        this.position = position;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.OPERATOR;
    }

    @Override
    public int getPosition() {
        return position;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPriority() {
        return priority;
    }

    public boolean is(String other) {
        return symbol.equals(other);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
