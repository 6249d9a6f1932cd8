package com.sysmuse.fuzzy;

/**
 * Terminal operand: a number literal, a named constant or a variable.
 * Constants carry their value from the registry; variables are resolved at evaluation time.
 */
public final class Leaf implements Node {

    private final TokenType kind;
    private final String text;
    private final Double constantValue;
    private final int position;

    private Leaf(TokenType kind, String text, Double constantValue, int position) {
        this.kind = kind;
        this.text = text;
        this.constantValue = constantValue;
        this.position = position;
    }

    public static Leaf number(String text, int position) {
        if (!Lexer.isNumber(text)) {
            throw new IllegalArgumentException("Not a number literal: '" + text + "'");
        }
        return new Leaf(TokenType.NUMBER, text, null, position);
    }

    /**
     * @param value the constant's value, null for a reserved constant without a real value
     */
    public static Leaf constant(String name, Double value, int position) {
        return new Leaf(TokenType.CONSTANT, name, value, position);
    }

    public static Leaf variable(String name, int position) {
        return new Leaf(TokenType.VARIABLE, name, null, position);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.LEAF;
    }

    @Override
    public int getPosition() {
        return position;
    }

    public TokenType getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public boolean isVariable() {
        return kind == TokenType.VARIABLE;
    }

    public Double getConstantValue() {
        return constantValue;
    }

    public double getNumberValue() {
        return Double.parseDouble(text);
    }

    @Override
    public String toString() {
        return text;
    }
}
