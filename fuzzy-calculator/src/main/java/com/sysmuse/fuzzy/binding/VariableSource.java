package com.sysmuse.fuzzy.binding;

import java.util.Random;

/**
 * Value bound to a variable: either fixed or drawn around a nominal value.
 */
public interface VariableSource {

    double sample(Random random);

    double getNominal();
}
