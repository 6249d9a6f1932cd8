package com.sysmuse.fuzzy.binding;

import java.util.Random;

public class FixedValue implements VariableSource {

    private final double value;

    public FixedValue(double value) {
        this.value = value;
    }

    @Override
    public double sample(Random random) {
        return value;
    }

    @Override
    public double getNominal() {
        return value;
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
