package com.sysmuse.fuzzy;

@FunctionalInterface
public interface NumericOperation {
    double apply(double... args);
}
