package com.sysmuse.fuzzy.binding;

import java.util.Random;

/**
 * Uniform draw in {@code nominal * (1 - tolerance)} .. {@code nominal * (1 + tolerance)}.
 * The tolerance is relative: 0.05 for a 5% part.
 */
public class UniformTolerance implements VariableSource {

    private final double nominal;
    private final double tolerance;

    public UniformTolerance(double nominal, double tolerance) {
        if (tolerance < 0 || Double.isNaN(tolerance)) {
            throw new IllegalArgumentException("Tolerance must be zero or positive, got " + tolerance);
        }
        this.nominal = nominal;
        this.tolerance = tolerance;
    }

    @Override
    public double sample(Random random) {
        return nominal * (1 + tolerance * (2 * random.nextDouble() - 1));
    }

    @Override
    public double getNominal() {
        return nominal;
    }

    public double getTolerance() {
        return tolerance;
    }

    @Override
    public String toString() {
        return nominal + " +/-" + (tolerance * 100) + "% (uniform)";
    }
}
