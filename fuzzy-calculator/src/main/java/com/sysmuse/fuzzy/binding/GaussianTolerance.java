package com.sysmuse.fuzzy.binding;

import java.util.Random;

/**
 * Normal draw centred on the nominal value. The relative tolerance is read as three
 * standard deviations, so about 99.7% of the samples fall within it.
 */
public class GaussianTolerance implements VariableSource {

    private final double nominal;
    private final double tolerance;

    public GaussianTolerance(double nominal, double tolerance) {
        if (tolerance < 0 || Double.isNaN(tolerance)) {
            throw new IllegalArgumentException("Tolerance must be zero or positive, got " + tolerance);
        }
        this.nominal = nominal;
        this.tolerance = tolerance;
    }

    @Override
    public double sample(Random random) {
        return nominal + getSigma() * random.nextGaussian();
    }

    @Override
    public double getNominal() {
        return nominal;
    }

    public double getTolerance() {
        return tolerance;
    }

    public double getSigma() {
        return Math.abs(nominal) * tolerance / 3;
    }

    @Override
    public String toString() {
        return nominal + " +/-" + (tolerance * 100) + "% (gaussian, 3 sigma)";
    }
}
