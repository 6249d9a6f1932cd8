package com.sysmuse.fuzzy;

import java.util.List;

/**
 * The standard table of constants, functions and infix operators.
 */
public class NumericOperations {

    public static final String IDENTITY = "id";
    public static final String OPPOSITE = "opp";
    public static final String MINUS = "-";
    public static final String TIMES = "*";

    private static final List<String> X = List.of("x");

    public static void register(OperationRegistry registry) {
        // Constants. "i" is reserved so that it never reads as a variable.
        registry.registerConstant("pi", Math.PI);
        registry.registerConstant("eps", Math.ulp(1.0));
        registry.registerConstant("inf", Double.POSITIVE_INFINITY);
        registry.reserveConstant("i");

        // Grouping and negation, produced by the parser itself
        registry.registerFunction(IDENTITY, args -> args[0], X);
        registry.registerFunction(OPPOSITE, args -> -args[0], X);

        // Single argument functions
        registry.registerFunction("sin", args -> Math.sin(args[0]), X);
        registry.registerFunction("cos", args -> Math.cos(args[0]), X);
        registry.registerFunction("tan", args -> Math.tan(args[0]), X);
        registry.registerFunction("exp", args -> Math.exp(args[0]), X);
        registry.registerFunction("ln", args -> Math.log(positive("ln", args[0])), X);
        registry.registerFunction("log10", args -> Math.log10(positive("log10", args[0])), X);
        registry.registerFunction("abs", args -> Math.abs(args[0]), X);
        registry.registerFunction("sqrt", args -> {
            if (args[0] < 0) {
                throw new EvaluationException("sqrt is undefined for negative argument " + args[0]);
            }
            return Math.sqrt(args[0]);
        }, X);
        registry.registerFunction("floor", args -> Math.floor(args[0]), X);
        registry.registerFunction("ceil", args -> Math.ceil(args[0]), X);
        registry.registerFunction("round", args -> Math.floor(args[0] + 0.5), X);
        registry.registerFunction("sinc", args -> args[0] == 0.0 ? 1.0 : Math.sin(args[0]) / args[0], X);

        // Two argument functions
        registry.registerFunction("logN", args -> {
            double base = positive("logN base", args[1]);
            if (base == 1.0) {
                throw new EvaluationException("logN is undefined for base 1");
            }
            return Math.log(positive("logN", args[0])) / Math.log(base);
        }, List.of("x", "base"));
        registry.registerFunction("Q", args -> {
            double step = args[1];
            if (step == 0.0) {
                throw new EvaluationException("Q requires a non-zero quantization step");
            }
            return step * Math.floor(args[0] / step + 0.5);
        }, List.of("x", "step"));

        // Infix operators
        registry.registerInfix("+", 1, args -> args[0] + args[1]);
        registry.registerInfix(MINUS, 1, args -> args[0] - args[1]);
        registry.registerInfix(TIMES, 2, args -> args[0] * args[1]);
        registry.registerInfix("/", 2, args -> args[0] / divisor("/", args[1]));
        registry.registerInfix("//", 2, args -> Math.floor(args[0] / divisor("//", args[1])));
        registry.registerInfix("^", 3, args -> {
            double result = Math.pow(args[0], args[1]);
            if (Double.isNaN(result) && !Double.isNaN(args[0]) && !Double.isNaN(args[1])) {
                throw new EvaluationException("power " + args[0] + "^" + args[1] + " is not a real number");
            }
            return result;
        });
    }

    private static double positive(String function, double value) {
        if (value <= 0) {
            throw new EvaluationException(function + " is undefined for non-positive argument " + value);
        }
        return value;
    }

    private static double divisor(String operator, double value) {
        if (value == 0.0) {
            throw new EvaluationException("division by zero in '" + operator + "'");
        }
        return value;
    }
}
