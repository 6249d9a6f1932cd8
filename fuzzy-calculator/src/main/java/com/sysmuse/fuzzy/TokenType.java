package com.sysmuse.fuzzy;

public enum TokenType {
    NUMBER("NUM"),
    CONSTANT("CONST"),
    VARIABLE("VAR"),
    FUNCTION("FCT"),
    INFIX("OP"),
    BRACKET_OPEN("BRKT"),
    BRACKET_CLOSE("BRKT"),
    COMMA("SEP");

    private final String label;

    TokenType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * True for the token kinds that become a leaf of the tree.
     */
    public boolean isLeaf() {
        return this == NUMBER || this == CONSTANT || this == VARIABLE;
    }
}
