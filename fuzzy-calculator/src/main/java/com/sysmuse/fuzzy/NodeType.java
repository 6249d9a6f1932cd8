package com.sysmuse.fuzzy;

public enum NodeType {
    LEAF,
    OPERATOR,
    MACRO
}
